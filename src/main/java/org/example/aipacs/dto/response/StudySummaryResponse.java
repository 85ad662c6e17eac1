package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data @Builder
public class StudySummaryResponse {
    private String studyUid;
    private String patientId;
    private String patientName;
    private String modality;
    private String state;
    private Integer instanceCount;
    private Instant lastInstanceAt;
    private Instant createdAt;
    private String activeJobId;
    // state of the most recent job, null before the first one
    private String analysisState;
}
