package com.example.handwritingcomparator.service.analysis;

import com.example.handwritingcomparator.exception.ExternalServiceException;
import java.util.Optional;

/**
 * Best-effort expert opinion on a specimen pair, typically from a remote vision model. The
 * deterministic comparison never depends on it. Implementations can be swapped through Spring
 * configuration.
 */
public interface AnalysisProvider {

    /**
     * @param questioned encoded questioned specimen
     * @param known      encoded reference specimen
     * @return the opinion, or empty when the provider has nothing to offer
     * @throws ExternalServiceException when the remote collaborator fails
     */
    Optional<AnalysisResult> analyze(byte[] questioned, byte[] known);

    String name();
}
