package org.example.aipacs.service.impl;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.aipacs.config.PipelineProperties;
import org.example.aipacs.dto.request.StoreInstanceRequest;
import org.example.aipacs.exception.ErrorCode;
import org.example.aipacs.model.DicomInstance;
import org.example.aipacs.repository.InstanceRepository;
import org.example.aipacs.service.InstanceReceivedEvent;
import org.example.aipacs.service.StoreResult;
import org.example.aipacs.service.TransferReceiver;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TransferReceiverImpl implements TransferReceiver {

    private final InstanceRepository instances;
    private final Validator validator;
    private final ApplicationEventPublisher events;
    private final PlatformTransactionManager txManager;
    private final StorageLayout storage;
    private final PipelineProperties props;
    private final Clock clock;

    @Override
    public StoreResult store(StoreInstanceRequest request, InputStream payload) {
        if (request == null) {
            return StoreResult.rejected(null, ErrorCode.VALIDATION_ERROR, "missing identifying metadata");
        }
        String sopUid = request.getSopInstanceUid();

        Set<ConstraintViolation<StoreInstanceRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String msg = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining("; "));
            log.warn("Rejected transfer {}: {}", sopUid, msg);
            return StoreResult.rejected(sopUid, ErrorCode.VALIDATION_ERROR, msg);
        }
        if (payload == null) {
            return StoreResult.rejected(sopUid, ErrorCode.VALIDATION_ERROR, "empty payload");
        }

        // sender retries usually land here; the unique constraint below covers concurrent copies
        if (instances.existsBySopInstanceUid(sopUid)) {
            log.info("Duplicate transfer of instance {} ignored", sopUid);
            return StoreResult.duplicate(sopUid);
        }

        Path part;
        long size;
        try {
            part = storage.newIncomingFile();
            size = copyBounded(payload, part);
        } catch (PayloadTooLargeException e) {
            log.warn("Rejected transfer {}: {}", sopUid, e.getMessage());
            return StoreResult.rejected(sopUid, ErrorCode.VALIDATION_ERROR, e.getMessage());
        } catch (IOException e) {
            log.error("Could not buffer instance {}: {}", sopUid, e.getMessage(), e);
            return StoreResult.rejected(sopUid, ErrorCode.STORAGE_ERROR, "could not write payload");
        }

        if (size == 0) {
            deleteQuietly(part);
            return StoreResult.rejected(sopUid, ErrorCode.VALIDATION_ERROR, "empty payload");
        }

        Path target = storage.instancePath(request.getStudyUid(), request.getSeriesUid(), sopUid);
        Instant receivedAt = clock.instant();
        try {
            new TransactionTemplate(txManager).executeWithoutResult(status -> {
                instances.saveAndFlush(DicomInstance.builder()
                        .sopInstanceUid(sopUid)
                        .seriesUid(request.getSeriesUid())
                        .studyUid(request.getStudyUid())
                        .sopClassUid(request.getSopClassUid())
                        .modality(request.getModality())
                        .payloadPath(target.toString())
                        .sizeBytes(size)
                        .receivedAt(receivedAt)
                        .build());
                try {
                    Files.createDirectories(target.getParent());
                    Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (DataIntegrityViolationException e) {
            deleteQuietly(part);
            log.info("Concurrent duplicate transfer of instance {} ignored", sopUid);
            return StoreResult.duplicate(sopUid);
        } catch (UncheckedIOException e) {
            deleteQuietly(part);
            log.error("Could not store instance {}: {}", sopUid, e.getMessage(), e);
            return StoreResult.rejected(sopUid, ErrorCode.STORAGE_ERROR, "could not store payload");
        }

        log.info("Stored instance {} (study {}, series {}, {} bytes)",
                sopUid, request.getStudyUid(), request.getSeriesUid(), size);

        events.publishEvent(InstanceReceivedEvent.builder()
                .studyUid(request.getStudyUid())
                .seriesUid(request.getSeriesUid())
                .sopInstanceUid(sopUid)
                .modality(request.getModality())
                .patientId(request.getPatientId())
                .patientName(request.getPatientName())
                .receivedAt(receivedAt)
                .build());

        return StoreResult.accepted(sopUid);
    }

    @Override
    public List<String> listInstanceUids(String studyUid) {
        return instances.findSopInstanceUids(studyUid);
    }

    private long copyBounded(InputStream in, Path out) throws IOException {
        long max = props.getMaxPayloadBytes();
        long total = 0;
        byte[] buf = new byte[64 * 1024];
        try (OutputStream os = Files.newOutputStream(out)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                total += n;
                if (total > max) {
                    throw new PayloadTooLargeException("payload exceeds " + max + " bytes");
                }
                os.write(buf, 0, n);
            }
        } catch (IOException e) {
            deleteQuietly(out);
            throw e;
        }
        return total;
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Could not remove {}: {}", p, e.getMessage());
        }
    }

    private static class PayloadTooLargeException extends IOException {
        PayloadTooLargeException(String message) {
            super(message);
        }
    }
}
