package org.example.aipacs.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Stores reports into an archive through {@code POST {pipeline.archive.url}/studies/{studyUid}}.
 */
@Slf4j
@Component
public class HttpArchiveClient implements ArchiveClient {

    private final String archiveUrl;
    private final String callingAeTitle;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public HttpArchiveClient(@Value("${pipeline.archive.url:http://localhost:8042/dicom-web}") String archiveUrl,
                             @Value("${pipeline.archive.calling-ae-title:IA_SERVER}") String callingAeTitle,
                             @Value("${pipeline.archive.connect-timeout:10s}") Duration connectTimeout,
                             @Value("${pipeline.archive.read-timeout:60s}") Duration readTimeout) {
        this.archiveUrl = archiveUrl;
        this.callingAeTitle = callingAeTitle;
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
        this.readTimeoutMs = (int) readTimeout.toMillis();
    }

    @Override
    public ArchiveResponse storeReport(String studyUid, String reportId, String contentType, byte[] payload) {
        String url = archiveUrl + "/studies/" + URLEncoder.encode(studyUid, StandardCharsets.UTF_8);
        try {
            var con = (HttpURLConnection) URI.create(url).toURL().openConnection();
            con.setDoOutput(true);
            con.setRequestMethod("POST");
            con.setConnectTimeout(connectTimeoutMs);
            con.setReadTimeout(readTimeoutMs);
            con.setRequestProperty("Content-Type", contentType);
            con.setRequestProperty("X-Report-Id", reportId);
            con.setRequestProperty("X-Calling-AE-Title", callingAeTitle);
            try (OutputStream os = con.getOutputStream()) {
                os.write(payload);
            }
            int code = con.getResponseCode();
            String body;
            try (InputStream is = (code >= 200 && code < 300) ? con.getInputStream() : con.getErrorStream()) {
                body = is == null ? "" : new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            log.debug("Archive answered HTTP {} for report {}", code, reportId);
            return classify(code, body);
        } catch (IOException e) {
            // refused association, reset connection, read timeout
            return ArchiveResponse.retryable(0, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static ArchiveResponse classify(int code, String body) {
        if (code >= 200 && code < 300) {
            return ArchiveResponse.accepted(code, body);
        }
        if (code == 408 || code == 429 || code >= 500) {
            return ArchiveResponse.retryable(code, body);
        }
        return ArchiveResponse.permanent(code, body);
    }
}
