package org.example.aipacs.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.example.aipacs.exception.TemplateException;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.ReportFormat;
import org.example.aipacs.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Component
public class JsonReportTemplate implements ReportTemplate {

    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public byte[] render(ReportContent content) throws TemplateException {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("studyUid", content.getStudyUid());
        out.put("patientId", content.getPatientId());
        out.put("modality", content.getModality());
        out.put("templateVersion", content.getTemplateVersion());
        out.put("findingCount", content.getFindings().size());
        out.put("highSeverityCount", content.countBySeverity(Severity.HIGH));
        out.put("overallConfidence", content.overallConfidence());

        List<Map<String, Object>> findings = new ArrayList<>();
        for (Finding f : content.getFindings()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("category", f.getCategory());
            m.put("confidence", f.getConfidence());
            m.put("severity", f.getSeverity().name().toLowerCase(Locale.ROOT));
            m.put("location", List.of(f.getX(), f.getY(), f.getZ(), f.getWidth(), f.getHeight(), f.getDepth()));
            m.put("description", f.getDescription());
            m.put("measurements", new TreeMap<>(f.getMeasurements()));
            findings.add(m);
        }
        out.put("findings", findings);

        try {
            return om.writeValueAsBytes(out);
        } catch (JsonProcessingException e) {
            throw new TemplateException("cannot render JSON report: " + e.getOriginalMessage(), e);
        }
    }
}
