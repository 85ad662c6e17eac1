package org.example.aipacs.report;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.example.aipacs.exception.TemplateException;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.ReportFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One row per finding; measurements are folded into a single {@code key=value;...} column.
 */
@Component
public class CsvReportTemplate implements ReportTemplate {

    private static final String[] HEADER = {
            "study_uid", "template_version", "rank", "category", "confidence", "severity",
            "x", "y", "z", "width", "height", "depth", "description", "measurements"
    };

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public byte[] render(ReportContent content) throws TemplateException {
        StringWriter sw = new StringWriter();
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(HEADER).setRecordSeparator("\n").build();
        try (CSVPrinter printer = new CSVPrinter(sw, fmt)) {
            int rank = 1;
            for (Finding f : content.getFindings()) {
                printer.printRecord(
                        content.getStudyUid(),
                        content.getTemplateVersion(),
                        rank++,
                        f.getCategory(),
                        f.getConfidence(),
                        f.getSeverity().name().toLowerCase(Locale.ROOT),
                        f.getX(), f.getY(), f.getZ(), f.getWidth(), f.getHeight(), f.getDepth(),
                        f.getDescription() == null ? "" : f.getDescription(),
                        f.getMeasurements().entrySet().stream()
                                .map(e -> e.getKey() + "=" + e.getValue())
                                .collect(Collectors.joining(";")));
            }
        } catch (IOException e) {
            throw new TemplateException("cannot render CSV report: " + e.getMessage(), e);
        }
        return sw.toString().getBytes(StandardCharsets.UTF_8);
    }
}
