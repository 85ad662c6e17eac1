package org.example.aipacs.repository;

import org.example.aipacs.model.DeliveryState;
import org.example.aipacs.model.Report;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ReportRepository extends JpaRepository<Report, String> {
    Optional<Report> findByJobId(String jobId);

    List<Report> findByDeliveryState(DeliveryState state);

    long countByCreatedAtGreaterThanEqual(Instant from);

    long countByDeliveryStateAndSentAtGreaterThanEqual(DeliveryState state, Instant from);

    long countByFindingCountGreaterThanAndCreatedAtGreaterThanEqual(int findingCount, Instant from);

    @Query("select s.modality, count(r) from Report r, Study s where s.studyUid = r.studyUid group by s.modality")
    List<Object[]> countGroupedByModality();
}
