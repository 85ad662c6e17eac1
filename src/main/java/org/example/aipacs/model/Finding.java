package org.example.aipacs.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Entity
@Table(name = "findings", indexes = @Index(name = "idx_findings_job_id", columnList = "job_id"))
@Getter
@Setter
public class Finding {
    public static final int CATEGORY_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false, length = 36)
    private String jobId;

    private int ordinal;

    @Column(nullable = false, length = CATEGORY_LENGTH)
    private String category;

    private double confidence;

    private int x;
    private int y;
    private int z;
    private int width;
    private int height;
    private int depth = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private Severity severity;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Convert(converter = MeasurementsConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Double> measurements = new TreeMap<>();

    private Instant createdAt;
}
