package org.example.aipacs.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.config.PipelineProperties;
import org.example.aipacs.model.AssemblyState;
import org.example.aipacs.model.Study;
import org.example.aipacs.repository.InstanceRepository;
import org.example.aipacs.repository.StudyRepository;
import org.example.aipacs.service.InstanceReceivedEvent;
import org.example.aipacs.service.PipelineOrchestrator;
import org.example.aipacs.service.StudyAssembler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Updates to one study are serialized through a lock stripe picked by study UID; different studies
 * proceed in parallel. Each study has at most one armed idle timer.
 */
@Slf4j
@Service
public class StudyAssemblerImpl implements StudyAssembler {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];
    private final Map<String, IdleTimer> timers = new ConcurrentHashMap<>();

    private final StudyRepository studies;
    private final InstanceRepository instances;
    private final PipelineOrchestrator orchestrator;
    private final TaskScheduler scheduler;
    private final TransactionTemplate tx;
    private final Duration idleTimeout;
    private final Clock clock;

    public StudyAssemblerImpl(StudyRepository studies,
                              InstanceRepository instances,
                              PipelineOrchestrator orchestrator,
                              @Qualifier("pipelineScheduler") TaskScheduler scheduler,
                              PlatformTransactionManager txManager,
                              PipelineProperties props,
                              Clock clock) {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        this.studies = studies;
        this.instances = instances;
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.tx = new TransactionTemplate(txManager);
        this.idleTimeout = props.getAssembly().getIdleTimeout();
        this.clock = clock;
    }

    @Override
    @EventListener
    public void onInstanceReceived(InstanceReceivedEvent event) {
        String studyUid = event.getStudyUid();
        ReentrantLock lock = lockFor(studyUid);
        lock.lock();
        try {
            Integer count = tx.execute(status -> append(event));
            arm(studyUid, count == null ? 0 : count, idleTimeout);
        } finally {
            lock.unlock();
        }
    }

    private int append(InstanceReceivedEvent event) {
        Instant now = clock.instant();
        Study study = studies.findByStudyUid(event.getStudyUid()).orElse(null);
        if (study == null) {
            study = new Study();
            study.setStudyUid(event.getStudyUid());
            study.setState(AssemblyState.COLLECTING);
            study.setCreatedAt(now);
            log.info("Study {} opened", event.getStudyUid());
        }
        if (study.getPatientId() == null) study.setPatientId(event.getPatientId());
        if (study.getPatientName() == null) study.setPatientName(event.getPatientName());
        if (study.getModality() == null) study.setModality(event.getModality());

        if (study.getState() == AssemblyState.CLOSED) {
            log.info("Study {} reopened by instance {}", study.getStudyUid(), event.getSopInstanceUid());
            study.setState(AssemblyState.COLLECTING);
        } else if (study.getState() == AssemblyState.READY) {
            log.info("Late instance {} for study {}, back to COLLECTING", event.getSopInstanceUid(), study.getStudyUid());
            study.setState(AssemblyState.COLLECTING);
        }

        int count = (int) instances.countByStudyUid(study.getStudyUid());
        study.setInstanceCount(count);
        study.setLastInstanceAt(event.getReceivedAt());
        study.setUpdatedAt(now);
        studies.save(study);
        return count;
    }

    @Override
    public void onIdleTimeout(String studyUid, int armedCount) {
        ReentrantLock lock = lockFor(studyUid);
        lock.lock();
        try {
            timers.computeIfPresent(studyUid, (k, t) -> t.count == armedCount ? null : t);
            Study study = studies.findByStudyUid(studyUid).orElse(null);
            if (study == null || study.getState() != AssemblyState.COLLECTING) {
                return;
            }
            if (study.getActiveJobId() != null) {
                log.info("Study {} idle but job {} still running, ready signal deferred",
                        studyUid, study.getActiveJobId());
                arm(studyUid, armedCount, idleTimeout);
                return;
            }
            Integer updated = tx.execute(status -> studies.markReady(studyUid, armedCount, clock.instant()));
            if (updated == null || updated == 0) {
                log.debug("Study {} changed since the timer was armed for {} instance(s)", studyUid, armedCount);
                return;
            }
            log.info("Study {} READY with {} instance(s)", studyUid, armedCount);
        } finally {
            lock.unlock();
        }
        try {
            orchestrator.requestJob(studyUid);
        } catch (RuntimeException e) {
            log.error("Job request for READY study {} failed, the dispatcher will create it", studyUid, e);
        }
    }

    /**
     * Re-arms timers of collecting studies and resubmits ready studies that never got a job.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        Instant now = clock.instant();
        int armed = 0;
        for (Study study : studies.findByState(AssemblyState.COLLECTING)) {
            Instant last = study.getLastInstanceAt() == null ? now : study.getLastInstanceAt();
            Duration remaining = idleTimeout.minus(Duration.between(last, now));
            arm(study.getStudyUid(), study.getInstanceCount(), remaining.isNegative() ? Duration.ZERO : remaining);
            armed++;
        }
        int resubmitted = 0;
        for (Study study : studies.findByStateAndActiveJobIdIsNull(AssemblyState.READY)) {
            orchestrator.requestJob(study.getStudyUid());
            resubmitted++;
        }
        if (armed > 0 || resubmitted > 0) {
            log.info("Assembler recovery: {} idle timer(s) re-armed, {} ready stud(ies) resubmitted", armed, resubmitted);
        }
    }

    int armedCount(String studyUid) {
        IdleTimer t = timers.get(studyUid);
        return t == null ? -1 : t.count;
    }

    private void arm(String studyUid, int count, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(() -> onIdleTimeout(studyUid, count), clock.instant().plus(delay));
        IdleTimer previous = timers.put(studyUid, new IdleTimer(count, future));
        if (previous != null && previous.future != null) {
            previous.future.cancel(false);
        }
    }

    private ReentrantLock lockFor(String studyUid) {
        return locks[Math.floorMod(studyUid.hashCode(), STRIPES)];
    }

    private static final class IdleTimer {
        final int count;
        final ScheduledFuture<?> future;

        IdleTimer(int count, ScheduledFuture<?> future) {
            this.count = count;
            this.future = future;
        }
    }
}
