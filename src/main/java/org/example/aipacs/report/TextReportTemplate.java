package org.example.aipacs.report;

import org.example.aipacs.model.Finding;
import org.example.aipacs.model.ReportFormat;
import org.example.aipacs.model.Severity;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Plain-text structured report: summary, one block per finding, conclusion.
 */
@Component
public class TextReportTemplate implements ReportTemplate {

    @Override
    public ReportFormat format() {
        return ReportFormat.TEXT;
    }

    @Override
    public byte[] render(ReportContent content) {
        StringBuilder sb = new StringBuilder();
        sb.append("AI ANALYSIS REPORT\n");
        sb.append("Study: ").append(content.getStudyUid()).append('\n');
        sb.append("Patient: ").append(nullToDash(content.getPatientId())).append('\n');
        sb.append("Modality: ").append(nullToDash(content.getModality())).append('\n');
        sb.append("Template: ").append(content.getTemplateVersion()).append("\n\n");

        sb.append("SUMMARY\n").append(summary(content)).append("\n\n");

        if (content.getFindings().isEmpty()) {
            sb.append("NO FINDINGS\n");
            sb.append("The automated analysis did not detect any significant abnormality.\n\n");
        } else {
            sb.append("FINDINGS\n");
            int i = 1;
            for (Finding f : content.getFindings()) {
                sb.append(i++).append(". ").append(f.getCategory().replace('_', ' '))
                        .append(" [").append(f.getSeverity().name().toLowerCase(Locale.ROOT)).append("]\n");
                if (f.getDescription() != null && !f.getDescription().isBlank()) {
                    sb.append("   ").append(f.getDescription()).append('\n');
                }
                sb.append("   Confidence: ").append(percent(f.getConfidence())).append('\n');
                sb.append(String.format(Locale.ROOT, "   Location: x=%d, y=%d, z=%d, width=%d, height=%d, depth=%d%n",
                        f.getX(), f.getY(), f.getZ(), f.getWidth(), f.getHeight(), f.getDepth()));
                if (!f.getMeasurements().isEmpty()) {
                    sb.append("   Measurements: ")
                            .append(f.getMeasurements().entrySet().stream()
                                    .map(e -> e.getKey() + ": " + e.getValue())
                                    .collect(Collectors.joining(", ")))
                            .append('\n');
                }
            }
            sb.append('\n');
        }

        sb.append("CONCLUSION\n").append(conclusion(content)).append('\n');
        sb.append("\nThis automated report must be validated by a qualified radiologist.\n");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static String summary(ReportContent c) {
        String modality = nullToDash(c.getModality());
        if (c.getFindings().isEmpty()) {
            return "AI analysis of " + modality + " study completed. No significant abnormality detected.";
        }
        long high = c.countBySeverity(Severity.HIGH);
        StringBuilder s = new StringBuilder("AI analysis of " + modality + " study completed. ")
                .append(c.getFindings().size()).append(" finding(s) detected");
        if (high > 0) {
            s.append(", ").append(high).append(" of high severity");
        }
        s.append(". Overall confidence: ").append(percent(c.overallConfidence())).append('.');
        return s.toString();
    }

    static String conclusion(ReportContent c) {
        if (c.getFindings().isEmpty()) {
            return "The automated analysis revealed no significant abnormality. Review by a radiologist is still recommended.";
        }
        String head = c.countBySeverity(Severity.HIGH) > 0
                ? "ATTENTION: high severity findings detected. Urgent review by a radiologist is strongly recommended. "
                : "Findings detected that require validation by a radiologist. ";
        return head + "Overall system confidence: " + percent(c.overallConfidence())
                + ". This automated report does not replace human medical expertise.";
    }

    private static String percent(double v) {
        return String.format(Locale.ROOT, "%.2f%%", v * 100.0);
    }

    private static String nullToDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }
}
