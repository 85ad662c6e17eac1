package org.example.aipacs.model;

public enum ReportFormat {
    JSON("json", "application/json"),
    CSV("csv", "text/csv"),
    TEXT("txt", "text/plain");

    private final String extension;
    private final String contentType;

    ReportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }
}
