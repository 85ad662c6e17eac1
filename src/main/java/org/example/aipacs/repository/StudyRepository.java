package org.example.aipacs.repository;

import org.example.aipacs.model.AssemblyState;
import org.example.aipacs.model.Study;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface StudyRepository extends JpaRepository<Study, Long> {
    Optional<Study> findByStudyUid(String studyUid);

    List<Study> findByState(AssemblyState state);

    List<Study> findByStateAndActiveJobIdIsNull(AssemblyState state);

    List<Study> findByStateAndActiveJobIdIsNullAndUpdatedAtBefore(AssemblyState state, Instant cutoff);

    long countByCreatedAtGreaterThanEqual(Instant from);

    @Query("select s.modality, count(s) from Study s group by s.modality")
    List<Object[]> countGroupedByModality();

    /**
     * Moves a collecting study to READY only if no instance arrived since the timer was armed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Study s set s.state = org.example.aipacs.model.AssemblyState.READY, s.updatedAt = :now " +
            "where s.studyUid = :studyUid and s.state = org.example.aipacs.model.AssemblyState.COLLECTING " +
            "and s.instanceCount = :expectedCount")
    int markReady(@Param("studyUid") String studyUid, @Param("expectedCount") int expectedCount, @Param("now") Instant now);

    /**
     * Takes the study's single active-job slot. Returns 0 when another non-terminal job holds it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Study s set s.activeJobId = :jobId, s.updatedAt = :now " +
            "where s.studyUid = :studyUid and s.activeJobId is null")
    int claimActiveJob(@Param("studyUid") String studyUid, @Param("jobId") String jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Study s set s.activeJobId = null, s.updatedAt = :now " +
            "where s.studyUid = :studyUid and s.activeJobId = :jobId")
    int releaseActiveJob(@Param("studyUid") String studyUid, @Param("jobId") String jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Study s set s.state = org.example.aipacs.model.AssemblyState.CLOSED, s.updatedAt = :now " +
            "where s.studyUid = :studyUid and s.state = org.example.aipacs.model.AssemblyState.READY")
    int closeIfReady(@Param("studyUid") String studyUid, @Param("now") Instant now);
}
