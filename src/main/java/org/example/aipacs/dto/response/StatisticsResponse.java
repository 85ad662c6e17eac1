package org.example.aipacs.dto.response;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Activity counters over UTC calendar periods plus all-time breakdowns by modality and severity.
 */
@Data @Builder
public class StatisticsResponse {
    private Instant generatedAt;
    private Long totalStudies;
    private Long totalReports;
    private Period today;
    private Period thisWeek;
    private Period thisMonth;
    private Map<String, Long> studiesByModality;
    private Map<String, Long> reportsByModality;
    private Map<String, Long> findingsBySeverity;

    @Data @Builder
    public static class Period {
        private Instant from;
        private Long studiesReceived;
        private Long instancesReceived;
        private Long reportsGenerated;
        private Long reportsSent;
        private Long reportsWithFindings;
    }
}
