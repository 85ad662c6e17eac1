package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data @Builder
public class JobStatusResponse {
    private String id;
    private String studyUid;
    private String state;
    private Integer attempts;
    private String lastErrorCode;
    private String lastErrorDetail;
    private Instant nextAttemptAt;
    private Instant leaseExpiresAt;

    private Instant createdAt;
    private Instant queuedAt;
    private Instant analyzingAt;
    private Instant reportingAt;
    private Instant deliveringAt;
    private Instant finishedAt;

    private String reportId;

    private List<Event> events;
    private List<FindingItem> findings;

    @Data @Builder
    public static class Event {
        private String from;
        private String to;
        private Integer attempt;
        private String detail;
        private Instant at;
    }

    @Data @Builder
    public static class FindingItem {
        private Integer ordinal;
        private String category;
        private Double confidence;
        private String severity;
        private List<Integer> location;
        private String description;
        private Map<String, Double> measurements;
    }
}
