package org.example.aipacs.repository;

import org.example.aipacs.model.DicomInstance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface InstanceRepository extends JpaRepository<DicomInstance, Long> {
    boolean existsBySopInstanceUid(String sopInstanceUid);

    long countByStudyUid(String studyUid);

    long countByReceivedAtGreaterThanEqual(Instant from);

    List<DicomInstance> findByStudyUidOrderBySeriesUidAscReceivedAtAscSopInstanceUidAsc(String studyUid);

    @Query("select i.sopInstanceUid from DicomInstance i where i.studyUid = :studyUid order by i.sopInstanceUid")
    List<String> findSopInstanceUids(@Param("studyUid") String studyUid);
}
