package org.example.aipacs.exception;

/**
 * Permanent refusal from the archive, e.g. a malformed artifact. Never retried.
 */
public class ArchiveRejectedException extends PipelineException {

    public ArchiveRejectedException(String message) {
        super(ErrorCode.ARCHIVE_REJECTED, message);
    }

    public ArchiveRejectedException(String message, Throwable cause) {
        super(ErrorCode.ARCHIVE_REJECTED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
