package org.example.aipacs.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EngineRequest {
    String jobId;
    String studyUid;
    String modality;
    /** Payload files in series, receipt and UID order. */
    List<String> instancePaths;
}
