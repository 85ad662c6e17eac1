package org.example.aipacs.exception;

public class EngineTimeoutException extends PipelineException {

    public EngineTimeoutException(String message) {
        super(ErrorCode.ENGINE_TIMEOUT, message);
    }

    public EngineTimeoutException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_TIMEOUT, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
