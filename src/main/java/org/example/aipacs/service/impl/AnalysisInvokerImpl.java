package org.example.aipacs.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.client.AnalysisEngine;
import org.example.aipacs.client.EngineRequest;
import org.example.aipacs.client.RawFinding;
import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.PipelineException;
import org.example.aipacs.model.DicomInstance;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.Severity;
import org.example.aipacs.service.AnalysisInvoker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
@Service
public class AnalysisInvokerImpl implements AnalysisInvoker {

    static final Comparator<DicomInstance> INSTANCE_ORDER = Comparator
            .comparing(DicomInstance::getSeriesUid)
            .thenComparing(DicomInstance::getReceivedAt)
            .thenComparing(DicomInstance::getSopInstanceUid);

    private final AnalysisEngine engine;
    private final Duration timeout;

    public AnalysisInvokerImpl(AnalysisEngine engine,
                               @Value("${pipeline.engine.timeout:120s}") Duration timeout) {
        this.engine = engine;
        this.timeout = timeout;
    }

    @Override
    public List<Finding> analyze(String jobId, String studyUid, String modality, List<DicomInstance> instances)
            throws PipelineException {
        if (instances == null || instances.isEmpty()) {
            throw new EngineRejectedException("study " + studyUid + " has no instances");
        }
        List<String> paths = instances.stream()
                .sorted(INSTANCE_ORDER)
                .map(DicomInstance::getPayloadPath)
                .collect(Collectors.toList());

        EngineRequest request = EngineRequest.builder()
                .jobId(jobId)
                .studyUid(studyUid)
                .modality(modality)
                .instancePaths(paths)
                .build();

        log.info("Invoking engine for job {} ({} instance(s), modality {})", jobId, paths.size(), modality);
        List<RawFinding> raw = engine.analyze(request, timeout);
        if (raw == null) {
            throw new EngineRejectedException("engine returned no result for job " + jobId);
        }

        List<Finding> out = new ArrayList<>(raw.size());
        int ordinal = 0;
        for (RawFinding r : raw) {
            out.add(normalize(r, ordinal++));
        }
        return out;
    }

    static Finding normalize(RawFinding r, int ordinal) throws EngineRejectedException {
        if (r == null) {
            throw new EngineRejectedException("engine returned an empty finding at position " + ordinal);
        }
        Double conf = r.getConfidence();
        if (conf == null || conf.isNaN() || conf < 0.0 || conf > 1.0) {
            throw new EngineRejectedException("finding " + ordinal + " has confidence outside [0,1]: " + conf);
        }

        String category = r.getCategory() == null || r.getCategory().isBlank() ? "unspecified" : r.getCategory().trim();
        if (category.length() > Finding.CATEGORY_LENGTH) {
            throw new EngineRejectedException("finding " + ordinal + " has a category longer than "
                    + Finding.CATEGORY_LENGTH + " characters");
        }

        Finding f = new Finding();
        f.setOrdinal(ordinal);
        f.setCategory(category);
        f.setConfidence(conf);
        f.setX(orDefault(r.getX(), 0));
        f.setY(orDefault(r.getY(), 0));
        f.setZ(orDefault(r.getZ(), 0));
        f.setWidth(orDefault(r.getWidth(), 0));
        f.setHeight(orDefault(r.getHeight(), 0));
        f.setDepth(orDefault(r.getDepth(), 1));

        Severity sev = Severity.parse(r.getSeverity());
        f.setSeverity(sev != null ? sev : Severity.fromConfidence(conf));
        f.setDescription(r.getDescription());

        Map<String, Double> m = new TreeMap<>();
        if (r.getMeasurements() != null) {
            r.getMeasurements().forEach((k, v) -> {
                if (k != null && v != null) m.put(k, v);
            });
        }
        f.setMeasurements(m);
        return f;
    }

    private static int orDefault(Integer v, int def) {
        return v == null ? def : v;
    }
}
