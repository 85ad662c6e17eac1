package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data @Builder
public class ReportSummaryResponse {
    private String id;
    private String jobId;
    private String studyUid;
    private String format;
    private Integer findingCount;
    private String deliveryState;
    private Integer deliveryAttempts;
    private Instant createdAt;
    private Instant sentAt;
}
