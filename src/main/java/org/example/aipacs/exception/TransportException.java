package org.example.aipacs.exception;

/**
 * Association refused, archive busy or connection failure while sending a report.
 */
public class TransportException extends PipelineException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
