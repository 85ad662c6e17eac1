package org.example.aipacs.client;

import org.example.aipacs.exception.EngineRejectedException;
import org.example.aipacs.exception.EngineTimeoutException;
import org.example.aipacs.exception.EngineUnavailableException;

import java.time.Duration;
import java.util.List;

/**
 * The external scoring function. Implementations must give up after {@code timeout}.
 */
public interface AnalysisEngine {
    List<RawFinding> analyze(EngineRequest request, Duration timeout)
            throws EngineUnavailableException, EngineTimeoutException, EngineRejectedException;
}
