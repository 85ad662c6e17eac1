package org.example.aipacs.service.impl;

import lombok.RequiredArgsConstructor;
import org.example.aipacs.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * On-disk layout under {@code pipeline.storage-root}:
 * <pre>
 * incoming/{uuid}.part                       transfers being written
 * instances/{study}/{series}/{sop}.dcm       stored instances
 * reports/{study}/{reportId}.{ext}           generated reports
 * engine/{jobId}/                            scratch space for the local engine
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class StorageLayout {

    private final PipelineProperties props;

    public Path root() {
        return Paths.get(props.getStorageRoot()).toAbsolutePath().normalize();
    }

    public Path newIncomingFile() throws IOException {
        Path dir = root().resolve("incoming");
        Files.createDirectories(dir);
        return dir.resolve(UUID.randomUUID() + ".part");
    }

    public Path instancePath(String studyUid, String seriesUid, String sopInstanceUid) {
        return root().resolve("instances")
                .resolve(sanitize(studyUid))
                .resolve(sanitize(seriesUid))
                .resolve(sanitize(sopInstanceUid) + ".dcm");
    }

    public Path reportPath(String studyUid, String reportId, String extension) {
        return root().resolve("reports").resolve(sanitize(studyUid)).resolve(reportId + "." + extension);
    }

    public Path engineWorkDir(String jobId) {
        return root().resolve("engine").resolve(jobId);
    }

    // UIDs are validated upstream; this only keeps path segments inert
    static String sanitize(String name) {
        if (name == null) return "_";
        String base = name.replaceAll("[\\r\\n\\t]", "_").trim();
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        if (base.isEmpty() || base.equals(".") || base.equals("..")) return "_";
        return base;
    }
}
