package org.example.aipacs.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.aipacs.dto.response.FailureSummaryResponse;
import org.example.aipacs.dto.response.JobStatusResponse;
import org.example.aipacs.dto.response.PageResponse;
import org.example.aipacs.dto.response.ReportResponse;
import org.example.aipacs.dto.response.ReportSummaryResponse;
import org.example.aipacs.dto.response.StatisticsResponse;
import org.example.aipacs.dto.response.StudyStatusResponse;
import org.example.aipacs.dto.response.StudySummaryResponse;
import org.example.aipacs.model.AnalysisJob;
import org.example.aipacs.model.DeliveryState;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.JobEvent;
import org.example.aipacs.model.JobState;
import org.example.aipacs.model.Report;
import org.example.aipacs.model.Severity;
import org.example.aipacs.model.Study;
import org.example.aipacs.repository.FindingRepository;
import org.example.aipacs.repository.InstanceRepository;
import org.example.aipacs.repository.JobEventRepository;
import org.example.aipacs.repository.JobRepository;
import org.example.aipacs.repository.ReportRepository;
import org.example.aipacs.repository.StudyRepository;
import org.example.aipacs.service.PipelineStatusService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PipelineStatusServiceImpl implements PipelineStatusService {

    static final int MAX_FAILURES = 500;
    static final int MAX_PAGE_SIZE = 100;
    static final String UNKNOWN_MODALITY = "UNKNOWN";

    private final StudyRepository studies;
    private final JobRepository jobs;
    private final JobEventRepository jobEvents;
    private final FindingRepository findings;
    private final ReportRepository reports;
    private final InstanceRepository instances;
    private final Clock clock;

    @Override
    public Optional<StudyStatusResponse> study(String studyUid) {
        return studies.findByStudyUid(studyUid).map(this::toStudyResponse);
    }

    @Override
    public Optional<JobStatusResponse> job(String jobId) {
        return jobs.findById(jobId).map(this::toJobResponse);
    }

    /**
     * Number of jobs per state; every state is present, in lifecycle order.
     */
    @Override
    public Map<String, Long> countsByState() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (JobState s : JobState.values()) {
            out.put(s.name(), 0L);
        }
        for (Object[] row : jobs.countGroupedByState()) {
            out.put(((JobState) row[0]).name(), ((Number) row[1]).longValue());
        }
        return out;
    }

    @Override
    public List<FailureSummaryResponse> recentFailures(int limit) {
        int n = Math.max(1, Math.min(limit, MAX_FAILURES));
        return jobs.findByStateOrderByFinishedAtDesc(JobState.FAILED, PageRequest.of(0, n)).stream()
                .map(j -> FailureSummaryResponse.builder()
                        .jobId(j.getId())
                        .studyUid(j.getStudyUid())
                        .attempts(j.getAttempts())
                        .errorCode(j.getLastErrorCode())
                        .errorDetail(j.getLastErrorDetail())
                        .finishedAt(j.getFinishedAt())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ReportResponse> report(String reportId) {
        return reports.findById(reportId).map(r -> ReportResponse.builder()
                .id(r.getId())
                .jobId(r.getJobId())
                .studyUid(r.getStudyUid())
                .format(r.getFormat().name())
                .templateVersion(r.getTemplateVersion())
                .sizeBytes(r.getSizeBytes())
                .sha256(r.getSha256())
                .findingCount(r.getFindingCount())
                .deliveryState(r.getDeliveryState().name())
                .deliveryAttempts(r.getDeliveryAttempts())
                .archiveOutcome(r.getArchiveOutcome())
                .archiveStatus(r.getArchiveStatus())
                .archiveResponse(r.getArchiveResponse())
                .createdAt(r.getCreatedAt())
                .sentAt(r.getSentAt())
                .build());
    }

    @Override
    public Optional<Report> reportEntity(String reportId) {
        return reports.findById(reportId);
    }

    @Override
    public PageResponse<StudySummaryResponse> studies(int page, int size) {
        Page<Study> result = studies.findAll(newestFirst(page, size));
        return toPage(result, result.getContent().stream()
                .map(s -> StudySummaryResponse.builder()
                        .studyUid(s.getStudyUid())
                        .patientId(s.getPatientId())
                        .patientName(s.getPatientName())
                        .modality(s.getModality())
                        .state(s.getState().name())
                        .instanceCount(s.getInstanceCount())
                        .lastInstanceAt(s.getLastInstanceAt())
                        .createdAt(s.getCreatedAt())
                        .activeJobId(s.getActiveJobId())
                        .analysisState(jobs.findFirstByStudyUidOrderByCreatedAtDesc(s.getStudyUid())
                                .map(j -> j.getState().name())
                                .orElse(null))
                        .build())
                .collect(Collectors.toList()));
    }

    @Override
    public PageResponse<ReportSummaryResponse> reports(int page, int size) {
        Page<Report> result = reports.findAll(newestFirst(page, size));
        return toPage(result, result.getContent().stream()
                .map(r -> ReportSummaryResponse.builder()
                        .id(r.getId())
                        .jobId(r.getJobId())
                        .studyUid(r.getStudyUid())
                        .format(r.getFormat().name())
                        .findingCount(r.getFindingCount())
                        .deliveryState(r.getDeliveryState().name())
                        .deliveryAttempts(r.getDeliveryAttempts())
                        .createdAt(r.getCreatedAt())
                        .sentAt(r.getSentAt())
                        .build())
                .collect(Collectors.toList()));
    }

    /**
     * Periods start at UTC midnight: today, Monday of the current week, the first of the month.
     */
    @Override
    public StatisticsResponse statistics() {
        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, ZoneOffset.UTC);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            bySeverity.put(s.name(), 0L);
        }
        for (Object[] row : findings.countReportedGroupedBySeverity()) {
            bySeverity.put(((Severity) row[0]).name(), ((Number) row[1]).longValue());
        }

        return StatisticsResponse.builder()
                .generatedAt(now)
                .totalStudies(studies.count())
                .totalReports(reports.count())
                .today(period(day))
                .thisWeek(period(day.with(DayOfWeek.MONDAY)))
                .thisMonth(period(day.withDayOfMonth(1)))
                .studiesByModality(byModality(studies.countGroupedByModality()))
                .reportsByModality(byModality(reports.countGroupedByModality()))
                .findingsBySeverity(bySeverity)
                .build();
    }

    private StatisticsResponse.Period period(LocalDate firstDay) {
        Instant from = firstDay.atStartOfDay(ZoneOffset.UTC).toInstant();
        return StatisticsResponse.Period.builder()
                .from(from)
                .studiesReceived(studies.countByCreatedAtGreaterThanEqual(from))
                .instancesReceived(instances.countByReceivedAtGreaterThanEqual(from))
                .reportsGenerated(reports.countByCreatedAtGreaterThanEqual(from))
                .reportsSent(reports.countByDeliveryStateAndSentAtGreaterThanEqual(DeliveryState.SENT, from))
                .reportsWithFindings(reports.countByFindingCountGreaterThanAndCreatedAtGreaterThanEqual(0, from))
                .build();
    }

    private static Map<String, Long> byModality(List<Object[]> rows) {
        Map<String, Long> out = new TreeMap<>();
        for (Object[] row : rows) {
            String modality = row[0] == null ? UNKNOWN_MODALITY : (String) row[0];
            out.merge(modality, ((Number) row[1]).longValue(), Long::sum);
        }
        return out;
    }

    private static PageRequest newestFirst(int page, int size) {
        int n = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return PageRequest.of(Math.max(0, page), n, Sort.by(Sort.Direction.DESC, "createdAt", "id"));
    }

    private static <T> PageResponse<T> toPage(Page<?> source, List<T> items) {
        return PageResponse.<T>builder()
                .items(items)
                .total(source.getTotalElements())
                .page(source.getNumber())
                .size(source.getSize())
                .build();
    }

    private StudyStatusResponse toStudyResponse(Study s) {
        List<StudyStatusResponse.JobSummary> history = jobs.findByStudyUidOrderByCreatedAtAsc(s.getStudyUid()).stream()
                .map(j -> StudyStatusResponse.JobSummary.builder()
                        .id(j.getId())
                        .state(j.getState().name())
                        .attempts(j.getAttempts())
                        .lastErrorCode(j.getLastErrorCode())
                        .createdAt(j.getCreatedAt())
                        .finishedAt(j.getFinishedAt())
                        .build())
                .collect(Collectors.toList());

        return StudyStatusResponse.builder()
                .studyUid(s.getStudyUid())
                .patientId(s.getPatientId())
                .modality(s.getModality())
                .state(s.getState().name())
                .instanceCount(s.getInstanceCount())
                .lastInstanceAt(s.getLastInstanceAt())
                .activeJobId(s.getActiveJobId())
                .createdAt(s.getCreatedAt())
                .jobs(history)
                .build();
    }

    private JobStatusResponse toJobResponse(AnalysisJob j) {
        List<JobStatusResponse.Event> events = jobEvents.findByJobIdOrderByIdAsc(j.getId()).stream()
                .map(this::toEvent)
                .collect(Collectors.toList());
        List<JobStatusResponse.FindingItem> items = findings.findByJobIdOrderByOrdinalAsc(j.getId()).stream()
                .map(this::toFinding)
                .collect(Collectors.toList());

        return JobStatusResponse.builder()
                .id(j.getId())
                .studyUid(j.getStudyUid())
                .state(j.getState().name())
                .attempts(j.getAttempts())
                .lastErrorCode(j.getLastErrorCode())
                .lastErrorDetail(j.getLastErrorDetail())
                .nextAttemptAt(j.getNextAttemptAt())
                .leaseExpiresAt(j.getLeaseExpiresAt())
                .createdAt(j.getCreatedAt())
                .queuedAt(j.getQueuedAt())
                .analyzingAt(j.getAnalyzingAt())
                .reportingAt(j.getReportingAt())
                .deliveringAt(j.getDeliveringAt())
                .finishedAt(j.getFinishedAt())
                .reportId(reports.findByJobId(j.getId()).map(Report::getId).orElse(null))
                .events(events)
                .findings(items)
                .build();
    }

    private JobStatusResponse.Event toEvent(JobEvent e) {
        return JobStatusResponse.Event.builder()
                .from(e.getFromState() == null ? null : e.getFromState().name())
                .to(e.getToState().name())
                .attempt(e.getAttempt())
                .detail(e.getDetail())
                .at(e.getAt())
                .build();
    }

    private JobStatusResponse.FindingItem toFinding(Finding f) {
        return JobStatusResponse.FindingItem.builder()
                .ordinal(f.getOrdinal())
                .category(f.getCategory())
                .confidence(f.getConfidence())
                .severity(f.getSeverity().name())
                .location(List.of(f.getX(), f.getY(), f.getZ(), f.getWidth(), f.getHeight(), f.getDepth()))
                .description(f.getDescription())
                .measurements(new TreeMap<>(f.getMeasurements()))
                .build();
    }
}
