package org.example.aipacs.service;

import lombok.Getter;
import org.example.aipacs.exception.ErrorCode;

/**
 * Answer to one "store instance" transfer.
 */
@Getter
public class StoreResult {

    public enum Status { ACCEPTED, DUPLICATE, REJECTED }

    private final Status status;
    private final String sopInstanceUid;
    private final ErrorCode reasonCode;
    private final String message;

    private StoreResult(Status status, String sopInstanceUid, ErrorCode reasonCode, String message) {
        this.status = status;
        this.sopInstanceUid = sopInstanceUid;
        this.reasonCode = reasonCode;
        this.message = message;
    }

    public static StoreResult accepted(String sopInstanceUid) {
        return new StoreResult(Status.ACCEPTED, sopInstanceUid, null, "stored");
    }

    public static StoreResult duplicate(String sopInstanceUid) {
        return new StoreResult(Status.DUPLICATE, sopInstanceUid, ErrorCode.DUPLICATE_INSTANCE, "already stored");
    }

    public static StoreResult rejected(String sopInstanceUid, ErrorCode reasonCode, String message) {
        return new StoreResult(Status.REJECTED, sopInstanceUid, reasonCode, message);
    }

    public boolean isAccepted() {
        return status != Status.REJECTED;
    }
}
