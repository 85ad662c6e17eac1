package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data @Builder
public class ReportResponse {
    private String id;
    private String jobId;
    private String studyUid;
    private String format;
    private String templateVersion;
    private Long sizeBytes;
    private String sha256;
    private Integer findingCount;
    private String deliveryState;
    private Integer deliveryAttempts;
    private String archiveOutcome;
    private Integer archiveStatus;
    private String archiveResponse;
    private Instant createdAt;
    private Instant sentAt;
}
