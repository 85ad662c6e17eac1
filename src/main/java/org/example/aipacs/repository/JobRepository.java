package org.example.aipacs.repository;

import org.example.aipacs.model.AnalysisJob;
import org.example.aipacs.model.JobState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<AnalysisJob, String> {

    List<AnalysisJob> findByStudyUidOrderByCreatedAtAsc(String studyUid);

    Optional<AnalysisJob> findFirstByStudyUidOrderByCreatedAtDesc(String studyUid);

    long countByStudyUidAndStateIn(String studyUid, Collection<JobState> states);

    @Query("select j.state, count(j) from AnalysisJob j group by j.state")
    List<Object[]> countGroupedByState();

    List<AnalysisJob> findByStateOrderByFinishedAtDesc(JobState state, Pageable page);

    @Query("select j.id from AnalysisJob j where j.state = :state and j.leaseExpiresAt is null " +
            "and (j.nextAttemptAt is null or j.nextAttemptAt <= :now) order by j.createdAt")
    List<String> findDue(@Param("state") JobState state, @Param("now") Instant now, Pageable page);

    @Query("select j.id from AnalysisJob j where j.state in :states and j.leaseExpiresAt < :now order by j.updatedAt")
    List<String> findStale(@Param("states") Collection<JobState> states, @Param("now") Instant now);

    /**
     * Single conditional write for a state change; 0 means the job was not in {@code from}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AnalysisJob j set j.state = :to, j.updatedAt = :now where j.id = :id and j.state = :from")
    int compareAndSetState(@Param("id") String id, @Param("from") JobState from, @Param("to") JobState to,
                           @Param("now") Instant now);

    /**
     * Claims a queued job for a worker: QUEUED -> ANALYZING with a lease, only once the retry delay passed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AnalysisJob j set j.state = org.example.aipacs.model.JobState.ANALYZING, " +
            "j.analyzingAt = :now, j.leaseExpiresAt = :leaseUntil, j.nextAttemptAt = null, j.updatedAt = :now " +
            "where j.id = :id and j.state = org.example.aipacs.model.JobState.QUEUED " +
            "and (j.nextAttemptAt is null or j.nextAttemptAt <= :now)")
    int claimQueued(@Param("id") String id, @Param("now") Instant now, @Param("leaseUntil") Instant leaseUntil);

    /**
     * Takes (or retakes after expiry) the lease of a job that stays in its current state.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update AnalysisJob j set j.leaseExpiresAt = :leaseUntil, j.nextAttemptAt = null, j.updatedAt = :now " +
            "where j.id = :id and j.state = :state " +
            "and (j.leaseExpiresAt is null or j.leaseExpiresAt < :now) " +
            "and (j.nextAttemptAt is null or j.nextAttemptAt <= :now)")
    int claimLease(@Param("id") String id, @Param("state") JobState state, @Param("now") Instant now,
                   @Param("leaseUntil") Instant leaseUntil);
}
