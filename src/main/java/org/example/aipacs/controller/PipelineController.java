package org.example.aipacs.controller;

import lombok.RequiredArgsConstructor;
import org.example.aipacs.dto.response.FailureSummaryResponse;
import org.example.aipacs.dto.response.JobStatusResponse;
import org.example.aipacs.dto.response.PageResponse;
import org.example.aipacs.dto.response.ReportResponse;
import org.example.aipacs.dto.response.ReportSummaryResponse;
import org.example.aipacs.dto.response.StatisticsResponse;
import org.example.aipacs.dto.response.StudyStatusResponse;
import org.example.aipacs.dto.response.StudySummaryResponse;
import org.example.aipacs.model.Report;
import org.example.aipacs.service.PipelineStatusService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineStatusService statusService;

    @GetMapping("/studies")
    public PageResponse<StudySummaryResponse> studies(@RequestParam(defaultValue = "0") int page,
                                                      @RequestParam(defaultValue = "10") int size) {
        return statusService.studies(page, size);
    }

    @GetMapping("/studies/{studyUid}")
    public StudyStatusResponse study(@PathVariable String studyUid) {
        return statusService.study(studyUid)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "study not found"));
    }

    @GetMapping("/jobs/{id}")
    public JobStatusResponse job(@PathVariable String id) {
        return statusService.job(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "job not found"));
    }

    @GetMapping("/jobs/counts")
    public Map<String, Long> counts() {
        return statusService.countsByState();
    }

    @GetMapping("/jobs/failures")
    public List<FailureSummaryResponse> failures(@RequestParam(defaultValue = "20") int limit) {
        return statusService.recentFailures(limit);
    }

    @GetMapping("/reports")
    public PageResponse<ReportSummaryResponse> reports(@RequestParam(defaultValue = "0") int page,
                                                       @RequestParam(defaultValue = "10") int size) {
        return statusService.reports(page, size);
    }

    @GetMapping("/statistics")
    public StatisticsResponse statistics() {
        return statusService.statistics();
    }

    @GetMapping("/reports/{id}")
    public ReportResponse report(@PathVariable String id) {
        return statusService.report(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "report not found"));
    }

    @GetMapping("/reports/{id}/payload")
    public ResponseEntity<Resource> reportPayload(@PathVariable String id) {
        Report r = statusService.reportEntity(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "report not found"));

        Path p = Paths.get(r.getPayloadPath());
        if (!Files.exists(p)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "report payload not found");
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(r.getFormat().contentType()))
                .body(new FileSystemResource(p));
    }
}
