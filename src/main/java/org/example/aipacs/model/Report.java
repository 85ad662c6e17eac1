package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "reports",
        uniqueConstraints = @UniqueConstraint(name = "uk_reports_job_id", columnNames = "job_id"),
        indexes = @Index(name = "idx_reports_delivery_state", columnList = "delivery_state"))
@Getter
@Setter
public class Report {
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "job_id", nullable = false, updatable = false, length = 36)
    private String jobId;

    @Column(nullable = false, length = 64)
    private String studyUid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private ReportFormat format;

    @Column(length = 16)
    private String templateVersion;

    @Column(length = 512)
    private String payloadPath;

    private long sizeBytes;

    @Column(length = 64)
    private String sha256;

    private int findingCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_state", nullable = false, length = 8)
    private DeliveryState deliveryState;

    // archive answer of the last send, body kept as received
    @Column(length = 16)
    private String archiveOutcome;

    private Integer archiveStatus;

    @Column(columnDefinition = "TEXT")
    private String archiveResponse;

    private int deliveryAttempts;

    private Instant sentAt;
    private Instant createdAt;
}
