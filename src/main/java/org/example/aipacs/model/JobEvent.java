package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One entry of a job's attempt history.
 */
@Entity
@Table(name = "job_events", indexes = @Index(name = "idx_job_events_job_id", columnList = "job_id"))
@Getter
@Setter
public class JobEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private JobState fromState;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobState toState;

    private int attempt;

    @Column(length = 4000)
    private String detail;

    @Column(name = "event_at", nullable = false)
    private Instant at;
}
