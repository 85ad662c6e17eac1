package org.example.aipacs.service.impl;

import org.example.aipacs.client.AnalysisEngine;
import org.example.aipacs.client.EngineRequest;
import org.example.aipacs.client.RawFinding;
import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.EngineTimeoutException;
import org.example.aipacs.model.DicomInstance;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.Severity;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalysisInvokerImplTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final AnalysisEngine engine = mock(AnalysisEngine.class);
    private final AnalysisInvokerImpl invoker = new AnalysisInvokerImpl(engine, Duration.ofSeconds(7));

    private static DicomInstance instance(String series, String sop, Instant at) {
        return DicomInstance.builder()
                .studyUid("1.2.3").seriesUid(series).sopInstanceUid(sop)
                .payloadPath("/data/" + sop + ".dcm").sizeBytes(10).receivedAt(at).build();
    }

    @Test
    void sendsPathsInSeriesThenArrivalOrderWithTimeout() throws Exception {
        when(engine.analyze(any(), any())).thenReturn(List.of());
        List<DicomInstance> instances = List.of(
                instance("1.2.3.2", "9", T0),
                instance("1.2.3.1", "5", T0.plusSeconds(2)),
                instance("1.2.3.1", "7", T0.plusSeconds(1)),
                instance("1.2.3.1", "6", T0.plusSeconds(1)));

        invoker.analyze("job-1", "1.2.3", "CT", instances);

        ArgumentCaptor<EngineRequest> req = ArgumentCaptor.forClass(EngineRequest.class);
        verify(engine).analyze(req.capture(), eq(Duration.ofSeconds(7)));
        assertThat(req.getValue().getInstancePaths())
                .containsExactly("/data/6.dcm", "/data/7.dcm", "/data/5.dcm", "/data/9.dcm");
        assertThat(req.getValue().getModality()).isEqualTo("CT");
    }

    @Test
    void normalizesRawFindings() throws Exception {
        when(engine.analyze(any(), any())).thenReturn(List.of(
                RawFinding.builder().category("nodule").confidence(0.95).x(1).y(2).width(3).height(4)
                        .measurements(Map.of("volume", 2.0, "diameter", 5.0)).build(),
                RawFinding.builder().category("  ").confidence(0.75).severity("LOW").build(),
                RawFinding.builder().category("opacity").confidence(0.2).build()));

        List<Finding> out = invoker.analyze("job-1", "1.2.3", "CR", List.of(instance("1.1", "1", T0)));

        assertThat(out).hasSize(3);
        Finding first = out.get(0);
        assertThat(first.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(first.getZ()).isZero();
        assertThat(first.getDepth()).isEqualTo(1);
        assertThat(first.getMeasurements().keySet()).containsExactly("diameter", "volume");

        assertThat(out.get(1).getCategory()).isEqualTo("unspecified");
        assertThat(out.get(1).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(out.get(2).getSeverity()).isEqualTo(Severity.LOW);
        assertThat(out).extracting(Finding::getOrdinal).containsExactly(0, 1, 2);
    }

    @Test
    void confidenceOutsideUnitIntervalIsRejected() throws Exception {
        when(engine.analyze(any(), any())).thenReturn(List.of(
                RawFinding.builder().category("nodule").confidence(1.4).build()));

        assertThatThrownBy(() -> invoker.analyze("job-1", "1.2.3", "CT", List.of(instance("1.1", "1", T0))))
                .isInstanceOf(EngineRejectedException.class)
                .hasMessageContaining("confidence");
    }

    @Test
    void engineErrorsPassThrough() throws Exception {
        when(engine.analyze(any(), any())).thenThrow(new EngineTimeoutException("slow"));

        assertThatThrownBy(() -> invoker.analyze("job-1", "1.2.3", "CT", List.of(instance("1.1", "1", T0))))
                .isInstanceOf(EngineTimeoutException.class);
    }

    @Test
    void studyWithoutInstancesIsRejected() {
        assertThatThrownBy(() -> invoker.analyze("job-1", "1.2.3", "CT", List.of()))
                .isInstanceOf(EngineRejectedException.class);
    }

    @Test
    void longFreeTextIsKeptAsIs() throws Exception {
        String description = "d".repeat(2500);
        Finding f = AnalysisInvokerImpl.normalize(RawFinding.builder()
                .category("mass").confidence(0.6).description(description).build(), 0);

        assertThat(f.getDescription()).isEqualTo(description);
    }

    @Test
    void overlongCategoryIsRejected() {
        RawFinding raw = RawFinding.builder().category("c".repeat(Finding.CATEGORY_LENGTH + 1)).confidence(0.6).build();

        assertThatThrownBy(() -> AnalysisInvokerImpl.normalize(raw, 3))
                .isInstanceOf(EngineRejectedException.class)
                .hasMessageContaining("category");
    }
}
