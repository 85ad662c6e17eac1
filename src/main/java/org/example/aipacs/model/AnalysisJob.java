package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_study_uid", columnList = "study_uid"),
        @Index(name = "idx_jobs_state", columnList = "state")
})
@Getter
@Setter
public class AnalysisJob {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "study_uid", nullable = false, updatable = false, length = 64)
    private String studyUid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobState state;

    private int attempts;

    @Column(length = 32)
    private String lastErrorCode;

    @Column(length = 4000)
    private String lastErrorDetail;

    private Instant nextAttemptAt;
    private Instant leaseExpiresAt;

    private Instant createdAt;
    private Instant queuedAt;
    private Instant analyzingAt;
    private Instant reportingAt;
    private Instant deliveringAt;
    private Instant finishedAt;
    private Instant updatedAt;
}
