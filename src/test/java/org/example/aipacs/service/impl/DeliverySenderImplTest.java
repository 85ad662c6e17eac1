package org.example.aipacs.service.impl;

import org.example.aipacs.client.ArchiveClient;
import org.example.aipacs.client.ArchiveResponse;
import org.example.aipacs.exception.ArchiveRejectedException;
import org.example.aipacs.exception.TransportException;
import org.example.aipacs.model.Report;
import org.example.aipacs.model.ReportFormat;
import org.example.aipacs.repository.ReportRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeliverySenderImplTest {

    @TempDir
    Path tmp;

    private ArchiveClient archive;
    private ReportRepository reports;
    private DeliverySenderImpl sender;
    private Report report;

    @BeforeEach
    void setUp() throws Exception {
        archive = mock(ArchiveClient.class);
        reports = mock(ReportRepository.class);
        sender = new DeliverySenderImpl(archive, reports);

        Path payload = tmp.resolve("r1.json");
        Files.writeString(payload, "{\"findings\":[]}");
        report = new Report();
        report.setId("r1");
        report.setStudyUid("1.2.3");
        report.setFormat(ReportFormat.JSON);
        report.setPayloadPath(payload.toString());
        when(reports.findById("r1")).thenReturn(Optional.of(report));
    }

    @Test
    void acceptedAnswerIsRecorded() throws Exception {
        when(archive.storeReport(eq("1.2.3"), eq("r1"), eq("application/json"), any()))
                .thenReturn(ArchiveResponse.accepted(200, "stored"));

        sender.deliver("r1");

        assertThat(report.getDeliveryAttempts()).isEqualTo(1);
        assertThat(report.getArchiveOutcome()).isEqualTo("ACCEPTED");
        assertThat(report.getArchiveStatus()).isEqualTo(200);
        assertThat(report.getArchiveResponse()).isEqualTo("stored");
        verify(reports).save(report);
    }

    @Test
    void largeArchiveAnswerIsKeptWhole() throws Exception {
        String body = "{\"detail\":\"" + "x".repeat(9000) + "\"}";
        when(archive.storeReport(any(), any(), any(), any())).thenReturn(ArchiveResponse.accepted(200, body));

        sender.deliver("r1");

        assertThat(report.getArchiveResponse()).isEqualTo(body);
    }

    @Test
    void sendsStoredBytes() throws Exception {
        when(archive.storeReport(any(), any(), any(), any())).thenReturn(ArchiveResponse.accepted(200, ""));
        sender.deliver("r1");
        verify(archive).storeReport("1.2.3", "r1", "application/json",
                "{\"findings\":[]}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void retryableAnswerRaisesTransportError() {
        when(archive.storeReport(any(), any(), any(), any())).thenReturn(ArchiveResponse.retryable(503, "busy"));

        assertThatThrownBy(() -> sender.deliver("r1"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("503");
        assertThat(report.getDeliveryAttempts()).isEqualTo(1);
        assertThat(report.getArchiveOutcome()).isEqualTo("RETRYABLE");
        assertThat(report.getArchiveStatus()).isEqualTo(503);
        assertThat(report.getArchiveResponse()).isEqualTo("busy");
    }

    @Test
    void permanentAnswerRaisesRejection() {
        when(archive.storeReport(any(), any(), any(), any())).thenReturn(ArchiveResponse.permanent(400, "bad"));

        assertThatThrownBy(() -> sender.deliver("r1")).isInstanceOf(ArchiveRejectedException.class);
    }

    @Test
    void missingPayloadIsPermanent() throws Exception {
        Files.delete(Path.of(report.getPayloadPath()));

        assertThatThrownBy(() -> sender.deliver("r1")).isInstanceOf(ArchiveRejectedException.class);
        verify(archive, never()).storeReport(any(), any(), any(), any());
    }
}
