package org.example.aipacs.controller;

import lombok.RequiredArgsConstructor;
import org.example.aipacs.dto.request.StoreInstanceRequest;
import org.example.aipacs.dto.response.StoreInstanceResponse;
import org.example.aipacs.exception.ErrorCode;
import org.example.aipacs.service.StoreResult;
import org.example.aipacs.service.TransferReceiver;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/transfer")
@RequiredArgsConstructor
public class TransferController {

    private final TransferReceiver receiver;

    @PostMapping("/instances")
    public ResponseEntity<StoreInstanceResponse> store(@RequestParam("file") MultipartFile file,
                                                       @RequestParam(required = false) String studyUid,
                                                       @RequestParam(required = false) String seriesUid,
                                                       @RequestParam(required = false) String sopInstanceUid,
                                                       @RequestParam(required = false) String sopClassUid,
                                                       @RequestParam(required = false) String modality,
                                                       @RequestParam(required = false) String patientId,
                                                       @RequestParam(required = false) String patientName) throws IOException {
        StoreInstanceRequest request = StoreInstanceRequest.builder()
                .studyUid(studyUid)
                .seriesUid(seriesUid)
                .sopInstanceUid(sopInstanceUid)
                .sopClassUid(sopClassUid)
                .modality(modality)
                .patientId(patientId)
                .patientName(patientName)
                .build();

        StoreResult result;
        try (InputStream in = file.getInputStream()) {
            result = receiver.store(request, in);
        }

        StoreInstanceResponse body = StoreInstanceResponse.builder()
                .sopInstanceUid(result.getSopInstanceUid())
                .status(result.getStatus().name())
                .reasonCode(result.getReasonCode() == null ? null : result.getReasonCode().name())
                .message(result.getMessage())
                .build();
        return ResponseEntity.status(statusOf(result)).body(body);
    }

    @GetMapping("/studies/{studyUid}/instances")
    public List<String> instances(@PathVariable String studyUid) {
        return receiver.listInstanceUids(studyUid);
    }

    static HttpStatus statusOf(StoreResult result) {
        if (result.isAccepted()) return HttpStatus.OK;
        return result.getReasonCode() == ErrorCode.STORAGE_ERROR
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.BAD_REQUEST;
    }
}
