package org.example.aipacs.exception;

public class TemplateException extends PipelineException {

    public TemplateException(String message) {
        super(ErrorCode.TEMPLATE_ERROR, message);
    }

    public TemplateException(String message, Throwable cause) {
        super(ErrorCode.TEMPLATE_ERROR, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
