package org.example.aipacs.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.config.PipelineProperties;
import org.example.aipacs.exception.TemplateException;
import org.example.aipacs.model.Finding;
import org.example.aipacs.model.Report;
import org.example.aipacs.model.ReportFormat;
import org.example.aipacs.model.Study;
import org.example.aipacs.report.ReportContent;
import org.example.aipacs.report.ReportTemplate;
import org.example.aipacs.service.ReportBuilder;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class ReportBuilderImpl implements ReportBuilder {

    /** Severity desc, confidence desc, category, engine order. */
    static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::getSeverity, Comparator.reverseOrder())
            .thenComparing(Finding::getConfidence, Comparator.reverseOrder())
            .thenComparing(Finding::getCategory)
            .thenComparingInt(Finding::getOrdinal);

    private final Map<ReportFormat, ReportTemplate> templates = new EnumMap<>(ReportFormat.class);
    private final StorageLayout storage;
    private final PipelineProperties props;

    public ReportBuilderImpl(List<ReportTemplate> templates, StorageLayout storage, PipelineProperties props) {
        for (ReportTemplate t : templates) {
            this.templates.put(t.format(), t);
        }
        this.storage = storage;
        this.props = props;
    }

    @Override
    public Report build(String jobId, Study study, List<Finding> findings) throws TemplateException {
        ReportFormat format = props.getReport().getFormat();
        ReportTemplate template = templates.get(format);
        if (template == null) {
            throw new TemplateException("no template for report format " + format);
        }

        // one report per job, so the job id doubles as the report id
        String reportId = jobId;
        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(REPORT_ORDER);

        ReportContent content = ReportContent.builder()
                .studyUid(study.getStudyUid())
                .patientId(study.getPatientId())
                .modality(study.getModality())
                .templateVersion(props.getReport().getTemplateVersion())
                .findings(ordered)
                .build();

        byte[] payload;
        try {
            payload = template.render(content);
        } catch (RuntimeException e) {
            throw new TemplateException("template " + format + " failed: " + e.getMessage(), e);
        }

        Path target = storage.reportPath(study.getStudyUid(), reportId, format.extension());
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(reportId + "." + UUID.randomUUID() + ".tmp");
            Files.write(tmp, payload);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TemplateException("cannot write report " + target + ": " + e.getMessage(), e);
        }

        Report report = new Report();
        report.setId(reportId);
        report.setJobId(jobId);
        report.setStudyUid(study.getStudyUid());
        report.setFormat(format);
        report.setTemplateVersion(props.getReport().getTemplateVersion());
        report.setPayloadPath(target.toString());
        report.setSizeBytes(payload.length);
        report.setSha256(sha256(payload));
        report.setFindingCount(ordered.size());
        log.info("Report {} built for study {}: {} finding(s), {} bytes, format {}",
                reportId, study.getStudyUid(), ordered.size(), payload.length, format);
        return report;
    }

    static String sha256(byte[] payload) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
