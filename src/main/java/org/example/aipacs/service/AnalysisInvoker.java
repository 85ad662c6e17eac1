package org.example.aipacs.service;

import org.example.aipacs.exception.PipelineException;
import org.example.aipacs.model.DicomInstance;
import org.example.aipacs.model.Finding;

import java.util.List;

public interface AnalysisInvoker {
    /**
     * Scores the study's instances and returns normalized, not yet persisted findings.
     * An empty list is a successful outcome.
     */
    List<Finding> analyze(String jobId, String studyUid, String modality, List<DicomInstance> instances)
            throws PipelineException;
}
