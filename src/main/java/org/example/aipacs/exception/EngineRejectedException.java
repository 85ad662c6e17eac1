package org.example.aipacs.exception;

/**
 * The engine refused the study input, or answered with output that cannot be normalized.
 */
public class EngineRejectedException extends PipelineException {

    public EngineRejectedException(String message) {
        super(ErrorCode.ENGINE_REJECTED, message);
    }

    public EngineRejectedException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_REJECTED, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
