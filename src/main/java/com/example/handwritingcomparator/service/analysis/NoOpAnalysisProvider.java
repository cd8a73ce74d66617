package com.example.handwritingcomparator.service.analysis;

import java.util.Optional;

/**
 * Fallback used when no vision model is configured. Never produces an opinion.
 */
public class NoOpAnalysisProvider implements AnalysisProvider {

    @Override
    public Optional<AnalysisResult> analyze(byte[] questioned, byte[] known) {
        return Optional.empty();
    }

    @Override
    public String name() {
        return "none";
    }
}
