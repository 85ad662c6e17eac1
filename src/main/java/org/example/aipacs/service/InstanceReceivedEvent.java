package org.example.aipacs.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Published once per newly stored instance, after its record is committed.
 */
@Value
@Builder
public class InstanceReceivedEvent {
    String studyUid;
    String seriesUid;
    String sopInstanceUid;
    String modality;
    String patientId;
    String patientName;
    Instant receivedAt;
}
