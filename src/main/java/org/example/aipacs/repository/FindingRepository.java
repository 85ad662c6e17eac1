package org.example.aipacs.repository;

import org.example.aipacs.model.Finding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface FindingRepository extends JpaRepository<Finding, Long> {
    List<Finding> findByJobIdOrderByOrdinalAsc(String jobId);

    long countByJobId(String jobId);

    /** Severity histogram over findings that made it into a report. */
    @Query("select f.severity, count(f) from Finding f where f.jobId in (select r.jobId from Report r) " +
            "group by f.severity")
    List<Object[]> countReportedGroupedBySeverity();
}
