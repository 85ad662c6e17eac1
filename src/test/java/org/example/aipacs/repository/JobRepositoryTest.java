package org.example.aipacs.repository;

import org.example.aipacs.model.AnalysisJob;
import org.example.aipacs.model.JobState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class JobRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private JobRepository jobs;

    private AnalysisJob job(String id, JobState state) {
        AnalysisJob j = new AnalysisJob();
        j.setId(id);
        j.setStudyUid("1.2.3");
        j.setState(state);
        j.setCreatedAt(NOW);
        j.setUpdatedAt(NOW);
        return jobs.saveAndFlush(j);
    }

    @Test
    void compareAndSetOnlyFromExpectedState() {
        job("j1", JobState.REPORTING);

        assertThat(jobs.compareAndSetState("j1", JobState.ANALYZING, JobState.REPORTING, NOW)).isZero();
        assertThat(jobs.compareAndSetState("j1", JobState.REPORTING, JobState.DELIVERING, NOW)).isEqualTo(1);
        assertThat(jobs.findById("j1").orElseThrow().getState()).isEqualTo(JobState.DELIVERING);
    }

    @Test
    void queuedClaimWaitsForRetryDelayAndSetsLease() {
        AnalysisJob j = job("j1", JobState.QUEUED);
        j.setNextAttemptAt(NOW.plusSeconds(5));
        jobs.saveAndFlush(j);

        assertThat(jobs.claimQueued("j1", NOW, NOW.plusSeconds(60))).isZero();
        assertThat(jobs.claimQueued("j1", NOW.plusSeconds(5), NOW.plusSeconds(65))).isEqualTo(1);
        assertThat(jobs.claimQueued("j1", NOW.plusSeconds(6), NOW.plusSeconds(66))).isZero();

        AnalysisJob claimed = jobs.findById("j1").orElseThrow();
        assertThat(claimed.getState()).isEqualTo(JobState.ANALYZING);
        assertThat(claimed.getLeaseExpiresAt()).isEqualTo(NOW.plusSeconds(65));
        assertThat(claimed.getNextAttemptAt()).isNull();
    }

    @Test
    void leaseCanOnlyBeRetakenAfterExpiry() {
        AnalysisJob j = job("j1", JobState.DELIVERING);
        j.setLeaseExpiresAt(NOW.plusSeconds(30));
        jobs.saveAndFlush(j);

        assertThat(jobs.claimLease("j1", JobState.DELIVERING, NOW, NOW.plusSeconds(90))).isZero();
        assertThat(jobs.claimLease("j1", JobState.DELIVERING, NOW.plusSeconds(31), NOW.plusSeconds(90))).isEqualTo(1);
        assertThat(jobs.claimLease("j1", JobState.ANALYZING, NOW.plusSeconds(100), NOW.plusSeconds(200))).isZero();
    }

    @Test
    void dueAndStaleQueries() {
        job("due", JobState.QUEUED);
        AnalysisJob later = job("later", JobState.QUEUED);
        later.setNextAttemptAt(NOW.plusSeconds(60));
        jobs.saveAndFlush(later);
        AnalysisJob retry = job("retry", JobState.DELIVERING);
        retry.setNextAttemptAt(NOW.minusSeconds(1));
        jobs.saveAndFlush(retry);
        AnalysisJob stale = job("stale", JobState.ANALYZING);
        stale.setLeaseExpiresAt(NOW.minusSeconds(1));
        jobs.saveAndFlush(stale);
        AnalysisJob busy = job("busy", JobState.REPORTING);
        busy.setLeaseExpiresAt(NOW.plusSeconds(100));
        jobs.saveAndFlush(busy);

        assertThat(jobs.findDue(JobState.QUEUED, NOW, PageRequest.of(0, 10))).containsExactly("due");
        assertThat(jobs.findDue(JobState.DELIVERING, NOW, PageRequest.of(0, 10))).containsExactly("retry");
        assertThat(jobs.findStale(JobState.IN_FLIGHT, NOW)).containsExactly("stale");
    }

    @Test
    void countsGroupedByState() {
        job("a", JobState.DONE);
        job("b", JobState.DONE);
        job("c", JobState.FAILED);

        List<Object[]> rows = jobs.countGroupedByState();
        Map<JobState, Long> counts = rows.stream()
                .collect(Collectors.toMap(r -> (JobState) r[0], r -> ((Number) r[1]).longValue()));
        assertThat(counts).containsEntry(JobState.DONE, 2L).containsEntry(JobState.FAILED, 1L).hasSize(2);
    }
}
