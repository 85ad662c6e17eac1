package org.example.aipacs.service;

import org.example.aipacs.exception.TemplateException;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.Report;
import org.example.aipacs.model.Study;

import java.util.List;

public interface ReportBuilder {
    /**
     * Renders and stores the report of a job. The returned {@link Report} is not persisted yet.
     */
    Report build(String jobId, Study study, List<Finding> findings) throws TemplateException;
}
