package org.example.aipacs.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.EngineTimeoutException;
import org.example.aipacs.exception.EngineUnavailableException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Calls an analysis engine exposed over HTTP: {@code POST {pipeline.engine.url}/analyze} with a JSON
 * body, answered by {@code {"findings": [...]}}. The exchange runs on the engine call executor and the
 * caller waits at most the given timeout for all of it, however slowly the engine sends its answer.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.engine.exec", havingValue = "http", matchIfMissing = true)
public class HttpAnalysisEngine implements AnalysisEngine {

    private final ObjectMapper om;
    private final String engineUrl;
    private final int connectTimeoutMs;
    private final AsyncTaskExecutor callExecutor;

    public HttpAnalysisEngine(ObjectMapper om,
                              @Value("${pipeline.engine.url:http://localhost:8001}") String engineUrl,
                              @Value("${pipeline.engine.connect-timeout:10s}") Duration connectTimeout,
                              @Qualifier("engineCallExecutor") AsyncTaskExecutor callExecutor) {
        this.om = om;
        this.engineUrl = engineUrl;
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
        this.callExecutor = callExecutor;
    }

    @Override
    public List<RawFinding> analyze(EngineRequest request, Duration timeout)
            throws EngineUnavailableException, EngineTimeoutException, EngineRejectedException {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("job_id", request.getJobId());
        payload.put("study_uid", request.getStudyUid());
        payload.put("modality", request.getModality());
        payload.put("instances", request.getInstancePaths());

        AtomicReference<HttpURLConnection> connection = new AtomicReference<>();
        Future<Answer> call;
        try {
            call = callExecutor.submit(() -> exchange(payload, timeout, connection));
        } catch (TaskRejectedException e) {
            throw new EngineUnavailableException("no free engine call slot", e);
        }

        Answer answer;
        try {
            answer = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abort(call, connection.get());
            throw new EngineTimeoutException("engine call exceeded " + timeout, e);
        } catch (InterruptedException e) {
            abort(call, connection.get());
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("interrupted while waiting for engine", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SocketTimeoutException) {
                throw new EngineTimeoutException("engine did not answer within " + timeout, cause);
            }
            if (cause instanceof IOException) {
                throw new EngineUnavailableException("engine unreachable: " + cause.getMessage(), cause);
            }
            throw new IllegalStateException("engine call failed", cause);
        }

        int code = answer.code;
        String body = answer.body;
        log.debug("Engine answered HTTP {} for job {}", code, request.getJobId());
        if (code == 400 || code == 413 || code == 415 || code == 422) {
            throw new EngineRejectedException("engine rejected input (HTTP " + code + "): " + abbreviate(body));
        }
        if (code == 408 || code == 504) {
            throw new EngineTimeoutException("engine timed out (HTTP " + code + ")");
        }
        if (code < 200 || code >= 300) {
            throw new EngineUnavailableException("engine returned HTTP " + code + ": " + abbreviate(body));
        }
        return parse(body);
    }

    private Answer exchange(Map<String, Object> payload, Duration timeout,
                            AtomicReference<HttpURLConnection> connection) throws IOException {
        var con = (HttpURLConnection) URI.create(engineUrl + "/analyze").toURL().openConnection();
        connection.set(con);
        con.setDoOutput(true);
        con.setRequestMethod("POST");
        con.setConnectTimeout(connectTimeoutMs);
        con.setReadTimeout((int) Math.max(1, timeout.toMillis()));
        con.setRequestProperty("Content-Type", "application/json");
        try (OutputStream os = con.getOutputStream()) {
            os.write(om.writeValueAsBytes(payload));
        }
        int code = con.getResponseCode();
        try (InputStream is = (code >= 200 && code < 300) ? con.getInputStream() : con.getErrorStream()) {
            return new Answer(code, is == null ? "" : new String(is.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    // the call thread may sit in a socket read; disconnecting from here could wait on that read
    private void abort(Future<Answer> call, HttpURLConnection con) {
        call.cancel(true);
        if (con != null) {
            try {
                callExecutor.execute(con::disconnect);
            } catch (TaskRejectedException e) {
                log.warn("Abandoned engine call left connected, no free call slot: {}", e.getMessage());
            }
        }
    }

    List<RawFinding> parse(String body) throws EngineRejectedException {
        try {
            JsonNode node = om.readTree(body);
            JsonNode arr = node.isArray() ? node : node.path("findings");
            if (!arr.isArray()) {
                throw new EngineRejectedException("engine answer has no findings array");
            }
            List<RawFinding> out = new ArrayList<>();
            for (JsonNode f : arr) {
                RawFinding raw = om.treeToValue(f, RawFinding.class);
                // older engines send location as [x, y, width, height]
                JsonNode loc = f.path("location");
                if (loc.isArray() && loc.size() >= 4 && raw.getX() == null) {
                    raw.setX(loc.get(0).asInt());
                    raw.setY(loc.get(1).asInt());
                    raw.setWidth(loc.get(2).asInt());
                    raw.setHeight(loc.get(3).asInt());
                }
                out.add(raw);
            }
            return out;
        } catch (IOException e) {
            throw new EngineRejectedException("unreadable engine answer: " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }

    private static final class Answer {
        final int code;
        final String body;

        Answer(int code, String body) {
            this.code = code;
            this.body = body;
        }
    }
}
