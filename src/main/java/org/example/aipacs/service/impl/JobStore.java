package org.example.aipacs.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.model.AnalysisJob;
import org.example.aipacs.model.DeliveryState;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.JobEvent;
import org.example.aipacs.model.JobState;
import org.example.aipacs.model.Report;
import org.example.aipacs.repository.FindingRepository;
import org.example.aipacs.repository.JobEventRepository;
import org.example.aipacs.repository.JobRepository;
import org.example.aipacs.repository.ReportRepository;
import org.example.aipacs.repository.StudyRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable side of the job state machine. Each public method is one transaction that starts with a
 * conditional write on the job (or study) row; a {@code false}/empty result means another actor
 * got there first and the caller must stop touching the job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobStore {

    private static final int MAX_DETAIL = 4000;

    private final JobRepository jobs;
    private final JobEventRepository jobEvents;
    private final StudyRepository studies;
    private final FindingRepository findings;
    private final ReportRepository reports;
    private final Clock clock;

    /**
     * Creates a job for the study if it holds no other non-terminal job, and admits it to the queue.
     */
    @Transactional
    public Optional<AnalysisJob> createJob(String studyUid) {
        Instant now = clock.instant();
        String jobId = UUID.randomUUID().toString();
        if (studies.claimActiveJob(studyUid, jobId, now) == 0) {
            return Optional.empty();
        }

        AnalysisJob job = new AnalysisJob();
        job.setId(jobId);
        job.setStudyUid(studyUid);
        job.setState(JobState.RECEIVED);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        record(job, null, JobState.RECEIVED, "job created", now);

        JobState.RECEIVED.checkTransition(JobState.QUEUED);
        job.setState(JobState.QUEUED);
        job.setQueuedAt(now);
        jobs.save(job);
        record(job, JobState.RECEIVED, JobState.QUEUED, "admitted to work queue", now);
        return Optional.of(job);
    }

    @Transactional
    public boolean claimForAnalysis(String jobId, Instant leaseUntil) {
        Instant now = clock.instant();
        if (jobs.claimQueued(jobId, now, leaseUntil) == 0) {
            return false;
        }
        AnalysisJob job = jobs.findById(jobId).orElseThrow();
        record(job, JobState.QUEUED, JobState.ANALYZING, "claimed by worker", now);
        return true;
    }

    /**
     * Takes the lease of a job that stays in {@code state}: a delivery retry or a stale in-flight job.
     */
    @Transactional
    public boolean claimLease(String jobId, JobState state, Instant leaseUntil, String detail) {
        Instant now = clock.instant();
        if (jobs.claimLease(jobId, state, now, leaseUntil) == 0) {
            return false;
        }
        if (detail != null) {
            AnalysisJob job = jobs.findById(jobId).orElseThrow();
            record(job, state, state, detail, now);
        }
        return true;
    }

    @Transactional
    public boolean completeAnalysis(String jobId, List<Finding> batch, Instant leaseUntil) {
        Instant now = clock.instant();
        AnalysisJob job = advance(jobId, JobState.ANALYZING, JobState.REPORTING, now);
        if (job == null) return false;
        job.setReportingAt(now);
        job.setLeaseExpiresAt(leaseUntil);
        jobs.save(job);
        for (Finding f : batch) {
            f.setJobId(jobId);
            f.setCreatedAt(now);
        }
        findings.saveAll(batch);
        record(job, JobState.ANALYZING, JobState.REPORTING, batch.size() + " finding(s)", now);
        return true;
    }

    @Transactional
    public boolean completeReport(String jobId, Report report, Instant leaseUntil) {
        Instant now = clock.instant();
        AnalysisJob job = advance(jobId, JobState.REPORTING, JobState.DELIVERING, now);
        if (job == null) return false;
        job.setDeliveringAt(now);
        job.setLeaseExpiresAt(leaseUntil);
        jobs.save(job);
        report.setCreatedAt(now);
        report.setDeliveryState(DeliveryState.PENDING);
        reports.save(report);
        record(job, JobState.REPORTING, JobState.DELIVERING, "report " + report.getId() + " built", now);
        return true;
    }

    @Transactional
    public boolean completeDelivery(String jobId, String reportId) {
        Instant now = clock.instant();
        AnalysisJob job = advance(jobId, JobState.DELIVERING, JobState.DONE, now);
        if (job == null) return false;
        finish(job, now);
        reports.findById(reportId).ifPresent(r -> {
            r.setDeliveryState(DeliveryState.SENT);
            r.setSentAt(now);
            reports.save(r);
        });
        record(job, JobState.DELIVERING, JobState.DONE, "report " + reportId + " accepted by archive", now);
        return true;
    }

    /**
     * Records a transient failure and parks the job until {@code nextAttemptAt}. The job moves to
     * {@code target}: QUEUED after an analysis failure, DELIVERING again after a transport failure.
     */
    @Transactional
    public boolean scheduleRetry(String jobId, JobState from, JobState target, Instant nextAttemptAt,
                                 String errorCode, String detail) {
        Instant now = clock.instant();
        AnalysisJob job = advance(jobId, from, target, now);
        if (job == null) return false;
        job.setAttempts(job.getAttempts() + 1);
        job.setLastErrorCode(errorCode);
        job.setLastErrorDetail(truncate(detail));
        job.setNextAttemptAt(nextAttemptAt);
        job.setLeaseExpiresAt(null);
        if (target == JobState.QUEUED) {
            job.setQueuedAt(now);
        }
        jobs.save(job);
        record(job, from, target, errorCode + ": " + detail + " (retry at " + nextAttemptAt + ")", now);
        return true;
    }

    @Transactional
    public boolean fail(String jobId, JobState from, String errorCode, String detail, boolean countAttempt) {
        Instant now = clock.instant();
        AnalysisJob job = advance(jobId, from, JobState.FAILED, now);
        if (job == null) return false;
        if (countAttempt) {
            job.setAttempts(job.getAttempts() + 1);
        }
        job.setLastErrorCode(errorCode);
        job.setLastErrorDetail(truncate(detail));
        finish(job, now);
        reports.findByJobId(jobId)
                .filter(r -> r.getDeliveryState() == DeliveryState.PENDING)
                .ifPresent(r -> {
                    r.setDeliveryState(DeliveryState.FAILED);
                    reports.save(r);
                });
        record(job, from, JobState.FAILED, errorCode + ": " + detail, now);
        return true;
    }

    private AnalysisJob advance(String jobId, JobState from, JobState to, Instant now) {
        from.checkTransition(to);
        if (jobs.compareAndSetState(jobId, from, to, now) == 0) {
            log.debug("Job {} no longer in {}, {} skipped", jobId, from, to);
            return null;
        }
        return jobs.findById(jobId).orElseThrow();
    }

    private void finish(AnalysisJob job, Instant now) {
        job.setFinishedAt(now);
        job.setLeaseExpiresAt(null);
        job.setNextAttemptAt(null);
        jobs.save(job);
        studies.releaseActiveJob(job.getStudyUid(), job.getId(), now);
        studies.closeIfReady(job.getStudyUid(), now);
    }

    private void record(AnalysisJob job, JobState from, JobState to, String detail, Instant now) {
        JobEvent e = new JobEvent();
        e.setJobId(job.getId());
        e.setFromState(from);
        e.setToState(to);
        e.setAttempt(job.getAttempts());
        e.setDetail(truncate(detail));
        e.setAt(now);
        jobEvents.save(e);
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_DETAIL) return s;
        return s.substring(0, MAX_DETAIL);
    }
}
