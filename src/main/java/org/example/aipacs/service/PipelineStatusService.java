package org.example.aipacs.service;

import org.example.aipacs.dto.response.FailureSummaryResponse;
import org.example.aipacs.dto.response.JobStatusResponse;
import org.example.aipacs.dto.response.PageResponse;
import org.example.aipacs.dto.response.ReportResponse;
import org.example.aipacs.dto.response.ReportSummaryResponse;
import org.example.aipacs.dto.response.StatisticsResponse;
import org.example.aipacs.dto.response.StudyStatusResponse;
import org.example.aipacs.dto.response.StudySummaryResponse;
import org.example.aipacs.model.Report;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface PipelineStatusService {
    Optional<StudyStatusResponse> study(String studyUid);
    Optional<JobStatusResponse> job(String jobId);
    Map<String, Long> countsByState();
    List<FailureSummaryResponse> recentFailures(int limit);
    Optional<ReportResponse> report(String reportId);
    Optional<Report> reportEntity(String reportId);

    /** Received studies, newest first. */
    PageResponse<StudySummaryResponse> studies(int page, int size);

    /** Generated reports, newest first. */
    PageResponse<ReportSummaryResponse> reports(int page, int size);

    StatisticsResponse statistics();
}
