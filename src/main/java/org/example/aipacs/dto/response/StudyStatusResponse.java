package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data @Builder
public class StudyStatusResponse {
    private String studyUid;
    private String patientId;
    private String modality;
    private String state;
    private Integer instanceCount;
    private Instant lastInstanceAt;
    private String activeJobId;
    private Instant createdAt;

    private List<JobSummary> jobs;

    @Data @Builder
    public static class JobSummary {
        private String id;
        private String state;
        private Integer attempts;
        private String lastErrorCode;
        private Instant createdAt;
        private Instant finishedAt;
    }
}
