package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data @Builder
public class FailureSummaryResponse {
    private String jobId;
    private String studyUid;
    private Integer attempts;
    private String errorCode;
    private String errorDetail;
    private Instant finishedAt;
}
