package org.example.aipacs.exception;

public class EngineUnavailableException extends PipelineException {

    public EngineUnavailableException(String message) {
        super(ErrorCode.ENGINE_UNAVAILABLE, message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
