package org.example.aipacs.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.client.ArchiveClient;
import org.example.aipacs.client.ArchiveResponse;
import org.example.aipacs.exception.ArchiveRejectedException;
import org.example.aipacs.exception.TransportException;
import org.example.aipacs.model.Report;
import org.example.aipacs.repository.ReportRepository;
import org.example.aipacs.service.DeliverySender;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliverySenderImpl implements DeliverySender {

    private final ArchiveClient archive;
    private final ReportRepository reports;

    @Override
    public void deliver(String reportId) throws TransportException, ArchiveRejectedException {
        Report report = reports.findById(reportId)
                .orElseThrow(() -> new IllegalStateException("report " + reportId + " not found"));

        byte[] payload;
        try {
            payload = Files.readAllBytes(Paths.get(report.getPayloadPath()));
        } catch (IOException e) {
            // the stored payload is gone; resending cannot help
            throw new ArchiveRejectedException("report payload unreadable: " + report.getPayloadPath(), e);
        }

        ArchiveResponse response = archive.storeReport(report.getStudyUid(), report.getId(),
                report.getFormat().contentType(), payload);

        report.setDeliveryAttempts(report.getDeliveryAttempts() + 1);
        report.setArchiveOutcome(response.getOutcome().name());
        report.setArchiveStatus(response.getStatus());
        report.setArchiveResponse(response.getBody());
        reports.save(report);

        switch (response.getOutcome()) {
            case ACCEPTED:
                log.info("Report {} accepted by archive for study {} (HTTP {})",
                        reportId, report.getStudyUid(), response.getStatus());
                return;
            case RETRYABLE:
                throw new TransportException("archive unavailable (HTTP " + response.getStatus() + "): "
                        + abbreviate(response.getBody()));
            default:
                throw new ArchiveRejectedException("archive rejected report (HTTP " + response.getStatus() + "): "
                        + abbreviate(response.getBody()));
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
