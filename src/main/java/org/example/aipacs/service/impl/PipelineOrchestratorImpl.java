package org.example.aipacs.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.config.PipelineProperties;
import org.example.aipacs.exception.ErrorCode;
import org.example.aipacs.exception.PipelineException;
import org.example.aipacs.model.AnalysisJob;
import org.example.aipacs.model.AssemblyState;
import org.example.aipacs.model.DicomInstance;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.JobState;
import org.example.aipacs.model.Report;
import org.example.aipacs.model.Study;
import org.example.aipacs.repository.FindingRepository;
import org.example.aipacs.repository.InstanceRepository;
import org.example.aipacs.repository.JobRepository;
import org.example.aipacs.repository.ReportRepository;
import org.example.aipacs.repository.StudyRepository;
import org.example.aipacs.service.AnalysisInvoker;
import org.example.aipacs.service.DeliverySender;
import org.example.aipacs.service.PipelineOrchestrator;
import org.example.aipacs.service.ReportBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs jobs on the bounded work queue. A worker first takes the job (the QUEUED claim or a lease),
 * then carries it through the remaining stages; every stage ends in one conditional write in
 * {@link JobStore}, and losing that write means another worker owns the job.
 */
@Slf4j
@Service
public class PipelineOrchestratorImpl implements PipelineOrchestrator {

    private final JobStore store;
    private final JobRepository jobs;
    private final StudyRepository studies;
    private final InstanceRepository instances;
    private final FindingRepository findings;
    private final ReportRepository reports;
    private final AnalysisInvoker invoker;
    private final ReportBuilder reportBuilder;
    private final DeliverySender deliverySender;
    private final JobWorkQueue workQueue;
    private final TaskScheduler scheduler;
    private final PipelineProperties props;
    private final BackoffPolicy backoff;
    private final Clock clock;

    public PipelineOrchestratorImpl(JobStore store,
                                    JobRepository jobs,
                                    StudyRepository studies,
                                    InstanceRepository instances,
                                    FindingRepository findings,
                                    ReportRepository reports,
                                    AnalysisInvoker invoker,
                                    ReportBuilder reportBuilder,
                                    DeliverySender deliverySender,
                                    JobWorkQueue workQueue,
                                    @Qualifier("pipelineScheduler") TaskScheduler scheduler,
                                    PipelineProperties props,
                                    Clock clock) {
        this.store = store;
        this.jobs = jobs;
        this.studies = studies;
        this.instances = instances;
        this.findings = findings;
        this.reports = reports;
        this.invoker = invoker;
        this.reportBuilder = reportBuilder;
        this.deliverySender = deliverySender;
        this.workQueue = workQueue;
        this.scheduler = scheduler;
        this.props = props;
        this.backoff = BackoffPolicy.from(props.getRetry());
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startDispatcher() {
        Duration interval = props.getWorkers().getDispatchInterval();
        scheduler.scheduleWithFixedDelay(this::dispatchDue, interval);
        scheduler.scheduleWithFixedDelay(this::recoverStale, interval);
        scheduler.scheduleWithFixedDelay(this::resubmitReady, interval);
        log.info("Dispatcher started: every {}, {} worker(s), queue capacity {}",
                interval, props.getWorkers().getCount(), workQueue.capacity());
    }

    @Override
    public Optional<String> requestJob(String studyUid) {
        Optional<AnalysisJob> created = store.createJob(studyUid);
        if (created.isEmpty()) {
            log.warn("Orchestrator invariant violation: study {} already has an active job, request dropped", studyUid);
            return Optional.empty();
        }
        String jobId = created.get().getId();
        log.info("Job {} created for study {}: RECEIVED -> QUEUED", jobId, studyUid);
        afterCommit(() -> submit(jobId));
        return Optional.of(jobId);
    }

    @Override
    public int dispatchDue() {
        Instant now = clock.instant();
        PageRequest page = PageRequest.of(0, props.getWorkers().getDispatchBatch());
        int submitted = 0;
        for (JobState state : List.of(JobState.QUEUED, JobState.DELIVERING)) {
            for (String jobId : jobs.findDue(state, now, page)) {
                if (workQueue.isHeld(jobId)) continue;
                if (!submit(jobId)) {
                    return submitted;
                }
                submitted++;
            }
        }
        if (submitted > 0) {
            log.debug("Dispatcher submitted {} job(s)", submitted);
        }
        return submitted;
    }

    @Override
    public int recoverStale() {
        int submitted = 0;
        for (String jobId : jobs.findStale(JobState.IN_FLIGHT, clock.instant())) {
            if (workQueue.isHeld(jobId)) continue;
            log.warn("Job {} lease expired, resubmitting", jobId);
            if (submit(jobId)) {
                submitted++;
            }
        }
        return submitted;
    }

    @Override
    public int resubmitReady() {
        // a study marked READY a moment ago is about to get its job from the assembler
        Instant cutoff = clock.instant().minus(props.getWorkers().getDispatchInterval());
        int created = 0;
        for (Study study : studies.findByStateAndActiveJobIdIsNullAndUpdatedAtBefore(AssemblyState.READY, cutoff)) {
            Optional<AnalysisJob> job = store.createJob(study.getStudyUid());
            if (job.isEmpty()) {
                continue;
            }
            log.warn("Study {} was READY without a job, job {} created", study.getStudyUid(), job.get().getId());
            submit(job.get().getId());
            created++;
        }
        return created;
    }

    private boolean submit(String jobId) {
        return workQueue.submit(jobId, () -> runJob(jobId));
    }

    void runJob(String jobId) {
        AnalysisJob job = jobs.findById(jobId).orElse(null);
        if (job == null || job.getState().isTerminal()) {
            return;
        }
        String studyUid = job.getStudyUid();
        JobState stage = job.getState();

        boolean claimed;
        if (stage == JobState.QUEUED) {
            claimed = store.claimForAnalysis(jobId, leaseUntil());
            stage = JobState.ANALYZING;
        } else {
            String detail = job.getLeaseExpiresAt() != null ? "lease expired, stage restarted" : null;
            claimed = store.claimLease(jobId, stage, leaseUntil(), detail);
        }
        if (!claimed) {
            log.debug("Job {} not claimable in {}, skipped", jobId, job.getState());
            return;
        }
        log.info("Job {} for study {}: {} (attempt {})", jobId, studyUid, stage, job.getAttempts() + 1);

        while (stage != null) {
            try {
                stage = runStage(jobId, studyUid, stage);
            } catch (PipelineException e) {
                handleFailure(jobId, studyUid, stage, e);
                return;
            } catch (RuntimeException e) {
                log.error("Job {} for study {} crashed in {}", jobId, studyUid, stage, e);
                store.fail(jobId, stage, ErrorCode.INTERNAL_ERROR.name(), String.valueOf(e.getMessage()), true);
                return;
            }
        }
    }

    /**
     * Runs one stage and returns the next one, or null when the job is finished or was taken over.
     */
    private JobState runStage(String jobId, String studyUid, JobState stage) throws PipelineException {
        switch (stage) {
            case ANALYZING: {
                Study study = loadStudy(studyUid);
                List<DicomInstance> batch =
                        instances.findByStudyUidOrderBySeriesUidAscReceivedAtAscSopInstanceUidAsc(studyUid);
                List<Finding> found = invoker.analyze(jobId, studyUid, study.getModality(), batch);
                if (!store.completeAnalysis(jobId, found, leaseUntil())) return null;
                log.info("Job {} for study {}: ANALYZING -> REPORTING, {} finding(s)", jobId, studyUid, found.size());
                return JobState.REPORTING;
            }
            case REPORTING: {
                Study study = loadStudy(studyUid);
                Report report = reportBuilder.build(jobId, study, findings.findByJobIdOrderByOrdinalAsc(jobId));
                if (!store.completeReport(jobId, report, leaseUntil())) return null;
                log.info("Job {} for study {}: REPORTING -> DELIVERING, report {}", jobId, studyUid, report.getId());
                return JobState.DELIVERING;
            }
            case DELIVERING: {
                Report report = reports.findByJobId(jobId)
                        .orElseThrow(() -> new IllegalStateException("job " + jobId + " has no report"));
                deliverySender.deliver(report.getId());
                if (store.completeDelivery(jobId, report.getId())) {
                    log.info("Job {} for study {}: DELIVERING -> DONE", jobId, studyUid);
                }
                return null;
            }
            default:
                throw new IllegalStateException("job " + jobId + " cannot run in state " + stage);
        }
    }

    private void handleFailure(String jobId, String studyUid, JobState stage, PipelineException e) {
        String code = e.getCode().name();
        if (!e.isRetryable() || stage == JobState.REPORTING) {
            if (store.fail(jobId, stage, code, e.getMessage(), true)) {
                log.error("Job {} for study {}: {} -> FAILED ({}: {})", jobId, studyUid, stage, code, e.getMessage());
            }
            return;
        }

        int failures = jobs.findById(jobId).map(AnalysisJob::getAttempts).orElse(0) + 1;
        if (backoff.exhausted(failures)) {
            if (store.fail(jobId, stage, code, e.getMessage(), true)) {
                log.error("Job {} for study {}: {} -> FAILED after {} attempt(s) ({}: {})",
                        jobId, studyUid, stage, failures, code, e.getMessage());
            }
            return;
        }

        Instant next = clock.instant().plus(backoff.delayFor(failures));
        JobState target = stage == JobState.ANALYZING ? JobState.QUEUED : JobState.DELIVERING;
        if (store.scheduleRetry(jobId, stage, target, next, code, e.getMessage())) {
            log.warn("Job {} for study {}: {} failed ({}: {}), attempt {}/{}, retry at {}",
                    jobId, studyUid, stage, code, e.getMessage(), failures, backoff.getMaxAttempts(), next);
            scheduler.schedule(() -> submit(jobId), next);
        }
    }

    private Study loadStudy(String studyUid) {
        return studies.findByStudyUid(studyUid)
                .orElseThrow(() -> new IllegalStateException("study " + studyUid + " not found"));
    }

    private Instant leaseUntil() {
        return clock.instant().plus(props.getWorkers().getLease());
    }

    private static void afterCommit(Runnable action) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    action.run();
                }
            });
        } else {
            action.run();
        }
    }
}
