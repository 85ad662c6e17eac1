package org.example.aipacs.exception;

public enum ErrorCode {
    VALIDATION_ERROR,
    DUPLICATE_INSTANCE,
    STORAGE_ERROR,
    ENGINE_UNAVAILABLE,
    ENGINE_TIMEOUT,
    ENGINE_REJECTED,
    TEMPLATE_ERROR,
    TRANSPORT_ERROR,
    ARCHIVE_REJECTED,
    INTERNAL_ERROR
}
