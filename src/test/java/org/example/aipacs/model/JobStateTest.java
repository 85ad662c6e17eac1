package org.example.aipacs.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStateTest {

    @Test
    void forwardPathIsAllowed() {
        assertThat(JobState.RECEIVED.canTransitionTo(JobState.QUEUED)).isTrue();
        assertThat(JobState.QUEUED.canTransitionTo(JobState.ANALYZING)).isTrue();
        assertThat(JobState.ANALYZING.canTransitionTo(JobState.REPORTING)).isTrue();
        assertThat(JobState.REPORTING.canTransitionTo(JobState.DELIVERING)).isTrue();
        assertThat(JobState.DELIVERING.canTransitionTo(JobState.DONE)).isTrue();
    }

    @Test
    void retryEdgesOnlyForAnalyzingAndDelivering() {
        assertThat(JobState.ANALYZING.canTransitionTo(JobState.QUEUED)).isTrue();
        assertThat(JobState.DELIVERING.canTransitionTo(JobState.DELIVERING)).isTrue();
        assertThat(JobState.REPORTING.canTransitionTo(JobState.REPORTING)).isFalse();
        assertThat(JobState.REPORTING.canTransitionTo(JobState.QUEUED)).isFalse();
    }

    @Test
    void everyNonTerminalStateMayFail() {
        for (JobState s : JobState.NON_TERMINAL) {
            assertThat(s.canTransitionTo(JobState.FAILED)).as(s.name()).isTrue();
        }
    }

    @Test
    void terminalStatesAreFrozen() {
        for (JobState s : new JobState[]{JobState.DONE, JobState.FAILED}) {
            assertThat(s.isTerminal()).isTrue();
            assertThat(s.allowedTargets()).isEmpty();
        }
        assertThatThrownBy(() -> JobState.DONE.checkTransition(JobState.QUEUED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DONE -> QUEUED");
    }

    @Test
    void skippingAStageIsRejected() {
        assertThatThrownBy(() -> JobState.QUEUED.checkTransition(JobState.DELIVERING))
                .isInstanceOf(IllegalStateException.class);
        assertThat(JobState.ANALYZING.canTransitionTo(JobState.DONE)).isFalse();
    }
}
