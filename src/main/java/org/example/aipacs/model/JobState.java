package org.example.aipacs.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an analysis job. Transitions not listed in {@link #allowedTargets()}
 * are rejected by {@link #checkTransition(JobState)}.
 */
public enum JobState {
    RECEIVED,
    QUEUED,
    ANALYZING,
    REPORTING,
    DELIVERING,
    DONE,
    FAILED;

    public static final Set<JobState> NON_TERMINAL = EnumSet.of(RECEIVED, QUEUED, ANALYZING, REPORTING, DELIVERING);
    public static final Set<JobState> IN_FLIGHT = EnumSet.of(ANALYZING, REPORTING, DELIVERING);

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    public Set<JobState> allowedTargets() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(QUEUED, FAILED);
            case QUEUED:
                return EnumSet.of(ANALYZING, FAILED);
            case ANALYZING:
                return EnumSet.of(REPORTING, QUEUED, FAILED);
            case REPORTING:
                return EnumSet.of(DELIVERING, FAILED);
            case DELIVERING:
                return EnumSet.of(DELIVERING, DONE, FAILED);
            default:
                return EnumSet.noneOf(JobState.class);
        }
    }

    public boolean canTransitionTo(JobState target) {
        return allowedTargets().contains(target);
    }

    public void checkTransition(JobState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("illegal job transition " + this + " -> " + target);
        }
    }
}
