package org.example.aipacs.service;

/**
 * Groups received instances into studies and decides when a study is complete.
 */
public interface StudyAssembler {

    void onInstanceReceived(InstanceReceivedEvent event);

    /**
     * Called when no instance arrived for the idle timeout after the study held {@code armedCount} instances.
     */
    void onIdleTimeout(String studyUid, int armedCount);
}
