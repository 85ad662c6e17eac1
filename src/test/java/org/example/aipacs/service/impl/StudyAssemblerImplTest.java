package org.example.aipacs.service.impl;

import org.example.aipacs.config.PipelineProperties;
import org.example.aipacs.model.AssemblyState;
import org.example.aipacs.model.Study;
import org.example.aipacs.repository.InstanceRepository;
import org.example.aipacs.repository.StudyRepository;
import org.example.aipacs.service.InstanceReceivedEvent;
import org.example.aipacs.service.PipelineOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StudyAssemblerImplTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final String STUDY = "1.2.840.5";

    private StudyRepository studies;
    private InstanceRepository instances;
    private PipelineOrchestrator orchestrator;
    private TaskScheduler scheduler;
    private ScheduledFuture<?> future;
    private StudyAssemblerImpl assembler;

    @BeforeEach
    void setUp() {
        studies = mock(StudyRepository.class);
        instances = mock(InstanceRepository.class);
        orchestrator = mock(PipelineOrchestrator.class);
        scheduler = mock(TaskScheduler.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
        when(studies.save(any(Study.class))).thenAnswer(inv -> inv.getArgument(0));

        assembler = new StudyAssemblerImpl(studies, instances, orchestrator, scheduler,
                mock(PlatformTransactionManager.class), new PipelineProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static InstanceReceivedEvent event(String sop) {
        return InstanceReceivedEvent.builder()
                .studyUid(STUDY).seriesUid("1.2.840.5.1").sopInstanceUid(sop)
                .modality("MR").patientId("P-9").receivedAt(NOW).build();
    }

    private static Study study(AssemblyState state, int count, String activeJob) {
        Study s = new Study();
        s.setStudyUid(STUDY);
        s.setState(state);
        s.setInstanceCount(count);
        s.setActiveJobId(activeJob);
        s.setLastInstanceAt(NOW.minusSeconds(10));
        return s;
    }

    @Test
    void firstInstanceOpensStudyAndArmsIdleTimer() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.empty());
        when(instances.countByStudyUid(STUDY)).thenReturn(1L);

        assembler.onInstanceReceived(event("1.1"));

        ArgumentCaptor<Study> saved = ArgumentCaptor.forClass(Study.class);
        verify(studies).save(saved.capture());
        assertThat(saved.getValue().getState()).isEqualTo(AssemblyState.COLLECTING);
        assertThat(saved.getValue().getInstanceCount()).isEqualTo(1);
        assertThat(saved.getValue().getModality()).isEqualTo("MR");
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(30)));
        assertThat(assembler.armedCount(STUDY)).isEqualTo(1);
    }

    @Test
    void eachInstanceRearmsAndCancelsThePreviousTimer() {
        Study s = study(AssemblyState.COLLECTING, 1, null);
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(s));
        when(instances.countByStudyUid(STUDY)).thenReturn(1L, 2L);

        assembler.onInstanceReceived(event("1.1"));
        assembler.onInstanceReceived(event("1.2"));

        verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
        verify(future).cancel(false);
        assertThat(assembler.armedCount(STUDY)).isEqualTo(2);
    }

    @Test
    void timerFiringRunsIdleTimeoutForArmedCount() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(study(AssemblyState.COLLECTING, 3, null)));
        when(instances.countByStudyUid(STUDY)).thenReturn(3L);
        when(studies.markReady(eq(STUDY), eq(3), any())).thenReturn(1);

        assembler.onInstanceReceived(event("1.3"));
        ArgumentCaptor<Runnable> timer = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timer.capture(), any(Instant.class));
        timer.getValue().run();

        verify(studies).markReady(eq(STUDY), eq(3), any());
        verify(orchestrator).requestJob(STUDY);
        assertThat(assembler.armedCount(STUDY)).isEqualTo(-1);
    }

    @Test
    void quietStudyBecomesReadyAndRequestsAJob() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(study(AssemblyState.COLLECTING, 2, null)));
        when(studies.markReady(eq(STUDY), eq(2), any())).thenReturn(1);

        assembler.onIdleTimeout(STUDY, 2);

        verify(orchestrator).requestJob(STUDY);
    }

    @Test
    void lateInstanceWinsOverAStaleTimer() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(study(AssemblyState.COLLECTING, 3, null)));
        when(studies.markReady(eq(STUDY), eq(2), any())).thenReturn(0);

        assembler.onIdleTimeout(STUDY, 2);

        verify(orchestrator, never()).requestJob(anyString());
    }

    @Test
    void readySignalDeferredWhileAJobIsActive() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(study(AssemblyState.COLLECTING, 4, "job-1")));

        assembler.onIdleTimeout(STUDY, 4);

        verify(studies, never()).markReady(anyString(), anyInt(), any());
        verify(orchestrator, never()).requestJob(anyString());
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(30)));
        assertThat(assembler.armedCount(STUDY)).isEqualTo(4);
    }

    @Test
    void instanceForReadyStudyReturnsItToCollecting() {
        Study s = study(AssemblyState.READY, 2, "job-1");
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(s));
        when(instances.countByStudyUid(STUDY)).thenReturn(3L);

        assembler.onInstanceReceived(event("1.3"));

        assertThat(s.getState()).isEqualTo(AssemblyState.COLLECTING);
        assertThat(s.getInstanceCount()).isEqualTo(3);
        assertThat(s.getActiveJobId()).isEqualTo("job-1");
    }

    @Test
    void instanceForClosedStudyReopensIt() {
        Study s = study(AssemblyState.CLOSED, 2, null);
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(s));
        when(instances.countByStudyUid(STUDY)).thenReturn(3L);

        assembler.onInstanceReceived(event("1.3"));

        assertThat(s.getState()).isEqualTo(AssemblyState.COLLECTING);
    }

    @Test
    void recoveryRearmsCollectingAndResubmitsReadyStudies() {
        Study collecting = study(AssemblyState.COLLECTING, 5, null);
        Study ready = study(AssemblyState.READY, 2, null);
        ready.setStudyUid("1.2.840.6");
        when(studies.findByState(AssemblyState.COLLECTING)).thenReturn(List.of(collecting));
        when(studies.findByStateAndActiveJobIdIsNull(AssemblyState.READY)).thenReturn(List.of(ready));

        assembler.recover();

        // armed 10 s before: 20 s of quiet period left
        verify(scheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(20)));
        assertThat(assembler.armedCount(STUDY)).isEqualTo(5);
        verify(orchestrator).requestJob("1.2.840.6");
    }

    @Test
    void failedJobRequestLeavesTheReadyStudyToTheDispatcher() {
        when(studies.findByStudyUid(STUDY)).thenReturn(Optional.of(study(AssemblyState.COLLECTING, 2, null)));
        when(studies.markReady(eq(STUDY), eq(2), any())).thenReturn(1);
        when(orchestrator.requestJob(STUDY)).thenThrow(new IllegalStateException("connection pool exhausted"));

        assertThatCode(() -> assembler.onIdleTimeout(STUDY, 2)).doesNotThrowAnyException();

        verify(orchestrator).requestJob(STUDY);
        verify(studies).markReady(eq(STUDY), eq(2), any());
    }
}
