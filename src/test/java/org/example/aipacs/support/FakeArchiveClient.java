package org.example.aipacs.support;

import org.example.aipacs.client.ArchiveClient;
import org.example.aipacs.client.ArchiveResponse;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * In-memory archive. Accepts every report unless an answer is set for the study.
 */
public class FakeArchiveClient implements ArchiveClient {

    private final Map<String, Supplier<ArchiveResponse>> answers = new ConcurrentHashMap<>();
    private final List<String> received = new CopyOnWriteArrayList<>();

    public void answer(String studyUid, Supplier<ArchiveResponse> answer) {
        answers.put(studyUid, answer);
    }

    public long callsFor(String studyUid) {
        return received.stream().filter(studyUid::equals).count();
    }

    @Override
    public ArchiveResponse storeReport(String studyUid, String reportId, String contentType, byte[] payload) {
        received.add(studyUid);
        Supplier<ArchiveResponse> answer = answers.get(studyUid);
        return answer == null ? ArchiveResponse.accepted(200, "stored " + reportId) : answer.get();
    }
}
