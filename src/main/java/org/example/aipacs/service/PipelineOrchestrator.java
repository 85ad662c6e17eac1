package org.example.aipacs.service;

import java.util.Optional;

/**
 * Drives analysis jobs through their states and decides retry versus failure.
 */
public interface PipelineOrchestrator {

    /**
     * Creates and queues a job for a ready study.
     *
     * @return the new job id, or empty when the study already has an active job
     */
    Optional<String> requestJob(String studyUid);

    /** Hands due queued jobs and pending delivery retries to the workers. */
    int dispatchDue();

    /** Re-submits in-flight jobs whose lease ran out. */
    int recoverStale();

    /** Creates the missing job of studies left READY when their job request failed. */
    int resubmitReady();
}
