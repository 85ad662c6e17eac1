package org.example.aipacs.client;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.EngineTimeoutException;
import org.example.aipacs.exception.EngineUnavailableException;
import org.example.aipacs.service.impl.StorageLayout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the engine as a local command. The command receives
 * {@code --job_id --study_uid --modality --input_list --output_dir} and must write
 * {@code findings.csv} into the output directory. Exit code 2 means the input was refused.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.engine.exec", havingValue = "local")
public class LocalProcessAnalysisEngine implements AnalysisEngine {

    static final int EXIT_REJECTED = 2;
    private static final String MEASUREMENT_PREFIX = "m_";

    private final StorageLayout storage;
    private final List<String> command;

    public LocalProcessAnalysisEngine(StorageLayout storage,
                                      @Value("${pipeline.engine.command:python3 scripts/run_engine.py}") String command) {
        this.storage = storage;
        this.command = Arrays.asList(command.trim().split("\\s+"));
    }

    @Override
    public List<RawFinding> analyze(EngineRequest request, Duration timeout)
            throws EngineUnavailableException, EngineTimeoutException, EngineRejectedException {
        Path workDir = storage.engineWorkDir(request.getJobId());
        Path inputList = workDir.resolve("instances.txt");
        Path outputDir = workDir.resolve("output");
        Path logFile = workDir.resolve("engine.log");

        List<String> cmd = new ArrayList<>(command);
        cmd.add("--job_id");
        cmd.add(request.getJobId());
        cmd.add("--study_uid");
        cmd.add(request.getStudyUid());
        cmd.add("--modality");
        cmd.add(request.getModality() == null ? "OT" : request.getModality());
        cmd.add("--input_list");
        cmd.add(inputList.toString());
        cmd.add("--output_dir");
        cmd.add(outputDir.toString());

        int exit;
        try {
            Files.createDirectories(outputDir);
            Files.write(inputList, request.getInstancePaths(), StandardCharsets.UTF_8);
            Files.writeString(logFile, "cmd=" + String.join(" ", cmd) + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.directory(workDir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            Process p = pb.start();
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new EngineTimeoutException("engine process exceeded " + timeout);
            }
            exit = p.exitValue();
        } catch (IOException e) {
            throw new EngineUnavailableException("cannot run engine command: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("interrupted while waiting for engine", e);
        }

        log.info("Engine process for job {} exited with {}", request.getJobId(), exit);
        if (exit == EXIT_REJECTED) {
            throw new EngineRejectedException("engine refused study " + request.getStudyUid() + ", see " + logFile);
        }
        if (exit != 0) {
            throw new EngineUnavailableException("engine exited with code " + exit + ", see " + logFile);
        }

        Path csv = outputDir.resolve("findings.csv");
        if (!Files.exists(csv)) {
            return List.of();
        }
        return readFindings(csv);
    }

    static List<RawFinding> readFindings(Path csvPath) throws EngineRejectedException {
        List<RawFinding> out = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(csvPath);
             CSVParser csv = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(in)) {
            for (CSVRecord r : csv) {
                Map<String, Double> measurements = new TreeMap<>();
                for (String col : csv.getHeaderNames()) {
                    if (col.startsWith(MEASUREMENT_PREFIX) && r.isMapped(col) && !r.get(col).isBlank()) {
                        measurements.put(col.substring(MEASUREMENT_PREFIX.length()), Double.parseDouble(r.get(col)));
                    }
                }
                out.add(RawFinding.builder()
                        .category(getFirst(r, "category", "type", "finding_type", "label"))
                        .confidence(parseDouble(getFirst(r, "confidence", "conf", "score")))
                        .x(parseInt(getFirst(r, "x")))
                        .y(parseInt(getFirst(r, "y")))
                        .z(parseInt(getFirst(r, "z")))
                        .width(parseInt(getFirst(r, "width", "w")))
                        .height(parseInt(getFirst(r, "height", "h")))
                        .depth(parseInt(getFirst(r, "depth", "d")))
                        .severity(getFirst(r, "severity"))
                        .description(getFirst(r, "description"))
                        .measurements(measurements)
                        .build());
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new EngineRejectedException("unreadable engine output " + csvPath + ": " + e.getMessage(), e);
        }
        return out;
    }

    private static String getFirst(CSVRecord r, String... cols) {
        for (String c : cols) {
            if (r.isMapped(c)) {
                String v = r.get(c);
                if (v != null && !v.isBlank()) return v.trim();
            }
        }
        return null;
    }

    private static Double parseDouble(String v) {
        return v == null ? null : Double.parseDouble(v);
    }

    private static Integer parseInt(String v) {
        return v == null ? null : (int) Math.round(Double.parseDouble(v));
    }
}
