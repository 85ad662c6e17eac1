package org.example.aipacs.report;

import lombok.Builder;
import lombok.Value;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.Severity;

import java.util.List;

/**
 * Everything a template may print. Holds no timestamps and no job or report ids, so the same
 * findings and template version always render the same bytes.
 */
@Value
@Builder
public class ReportContent {
    String studyUid;
    String patientId;
    String modality;
    String templateVersion;
    /** Already in report order. */
    List<Finding> findings;

    public double overallConfidence() {
        if (findings == null || findings.isEmpty()) return 0.0;
        return findings.stream().mapToDouble(Finding::getConfidence).sum() / findings.size();
    }

    public long countBySeverity(Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).count();
    }
}
