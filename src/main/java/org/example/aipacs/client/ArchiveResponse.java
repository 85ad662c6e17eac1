package org.example.aipacs.client;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ArchiveResponse {

    public enum Outcome { ACCEPTED, RETRYABLE, PERMANENT }

    Outcome outcome;
    int status;
    /** Raw archive answer, persisted verbatim. */
    String body;

    public static ArchiveResponse accepted(int status, String body) {
        return new ArchiveResponse(Outcome.ACCEPTED, status, body);
    }

    public static ArchiveResponse retryable(int status, String body) {
        return new ArchiveResponse(Outcome.RETRYABLE, status, body);
    }

    public static ArchiveResponse permanent(int status, String body) {
        return new ArchiveResponse(Outcome.PERMANENT, status, body);
    }
}
