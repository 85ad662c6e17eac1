package org.example.aipacs.model;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses the engine's severity label; returns {@code null} for blank or unknown labels.
     */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low":
                return LOW;
            case "medium":
            case "moderate":
                return MEDIUM;
            case "high":
            case "critical":
                return HIGH;
            default:
                return null;
        }
    }

    public static Severity fromConfidence(double confidence) {
        if (confidence >= 0.9) return HIGH;
        if (confidence >= 0.7) return MEDIUM;
        return LOW;
    }
}
