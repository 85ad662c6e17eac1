package org.example.aipacs.exception;

/**
 * Failure of one pipeline stage. The orchestrator reads {@link #isRetryable()} to choose
 * between a retry and a terminal failure.
 */
public abstract class PipelineException extends Exception {

    private final ErrorCode code;

    protected PipelineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected PipelineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public abstract boolean isRetryable();
}
