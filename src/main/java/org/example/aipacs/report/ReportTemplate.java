package org.example.aipacs.report;

import org.example.aipacs.exception.TemplateException;
import org.example.aipacs.model.ReportFormat;

/**
 * Pure rendering of report content into one output format.
 */
public interface ReportTemplate {
    ReportFormat format();

    byte[] render(ReportContent content) throws TemplateException;
}
