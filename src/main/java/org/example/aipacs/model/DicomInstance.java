package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One received image object. Rows are written once by the transfer receiver and
 * never updated.
 */
@Entity
@Table(name = "instances",
        uniqueConstraints = @UniqueConstraint(name = "uk_instances_sop_uid", columnNames = "sop_instance_uid"),
        indexes = @Index(name = "idx_instances_study_uid", columnList = "study_uid"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DicomInstance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sop_instance_uid", nullable = false, updatable = false, length = 64)
    private String sopInstanceUid;

    @Column(name = "series_uid", nullable = false, updatable = false, length = 64)
    private String seriesUid;

    @Column(name = "study_uid", nullable = false, updatable = false, length = 64)
    private String studyUid;

    @Column(updatable = false, length = 64)
    private String sopClassUid;

    @Column(updatable = false, length = 16)
    private String modality;

    @Column(nullable = false, updatable = false, length = 512)
    private String payloadPath;

    @Column(updatable = false)
    private long sizeBytes;

    @Column(nullable = false, updatable = false)
    private Instant receivedAt;

    @Builder
    public DicomInstance(String sopInstanceUid, String seriesUid, String studyUid, String sopClassUid,
                         String modality, String payloadPath, long sizeBytes, Instant receivedAt) {
        this.sopInstanceUid = sopInstanceUid;
        this.seriesUid = seriesUid;
        this.studyUid = studyUid;
        this.sopClassUid = sopClassUid;
        this.modality = modality;
        this.payloadPath = payloadPath;
        this.sizeBytes = sizeBytes;
        this.receivedAt = receivedAt;
    }
}
