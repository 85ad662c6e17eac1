package org.example.aipacs.repository;

import org.example.aipacs.model.JobEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobEventRepository extends JpaRepository<JobEvent, Long> {
    List<JobEvent> findByJobIdOrderByIdAsc(String jobId);
}
