package org.example.aipacs.support;

import org.example.aipacs.client.AnalysisEngine;
import org.example.aipacs.client.EngineRequest;
import org.example.aipacs.client.RawFinding;
import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.EngineTimeoutException;
import org.example.aipacs.exception.EngineUnavailableException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory analysis engine. Answers two findings unless a script is set for the study.
 */
public class FakeAnalysisEngine implements AnalysisEngine {

    @FunctionalInterface
    public interface Script {
        List<RawFinding> answer(EngineRequest request)
                throws EngineUnavailableException, EngineTimeoutException, EngineRejectedException;
    }

    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> running = new ConcurrentHashMap<>();
    private final Map<String, Integer> maxRunning = new ConcurrentHashMap<>();
    private final List<EngineRequest> requests = new CopyOnWriteArrayList<>();

    public static List<RawFinding> twoFindings() {
        return List.of(
                RawFinding.builder().category("nodule").confidence(0.93).x(120).y(88).width(14).height(14)
                        .description("Solid pulmonary nodule").measurements(Map.of("diameter_mm", 8.2)).build(),
                RawFinding.builder().category("opacity").confidence(0.71).x(40).y(200).width(60).height(45)
                        .build());
    }

    public void script(String studyUid, Script script) {
        scripts.put(studyUid, script);
    }

    public List<EngineRequest> requestsFor(String studyUid) {
        return requests.stream().filter(r -> r.getStudyUid().equals(studyUid)).collect(Collectors.toList());
    }

    public int maxConcurrent(String studyUid) {
        return maxRunning.getOrDefault(studyUid, 0);
    }

    @Override
    public List<RawFinding> analyze(EngineRequest request, Duration timeout)
            throws EngineUnavailableException, EngineTimeoutException, EngineRejectedException {
        requests.add(request);
        String study = request.getStudyUid();
        int now = running.computeIfAbsent(study, k -> new AtomicInteger()).incrementAndGet();
        maxRunning.merge(study, now, Math::max);
        try {
            Script script = scripts.get(study);
            return script == null ? twoFindings() : script.answer(request);
        } finally {
            running.get(study).decrementAndGet();
        }
    }
}
