package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Entity
@Table(name = "studies",
        uniqueConstraints = @UniqueConstraint(name = "uk_studies_study_uid", columnNames = "study_uid"),
        indexes = @Index(name = "idx_studies_state", columnList = "state"))
@DynamicUpdate
@Getter
@Setter
public class Study {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "study_uid", nullable = false, updatable = false, length = 64)
    private String studyUid;

    @Column(length = 64)
    private String patientId;

    private String patientName;

    @Column(length = 16)
    private String modality;

    private int instanceCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AssemblyState state;

    private Instant lastInstanceAt;

    // holder of the single non-terminal job, cleared when that job ends
    @Column(name = "active_job_id", length = 36)
    private String activeJobId;

    private Instant createdAt;
    private Instant updatedAt;
}
