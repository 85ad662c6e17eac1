package org.example.aipacs.client;

/**
 * Outbound "store report" towards the archive the study came from.
 */
public interface ArchiveClient {
    ArchiveResponse storeReport(String studyUid, String reportId, String contentType, byte[] payload);
}
