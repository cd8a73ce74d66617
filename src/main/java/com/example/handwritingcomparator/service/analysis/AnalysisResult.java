package com.example.handwritingcomparator.service.analysis;

/**
 * Opinion returned by an {@link AnalysisProvider}.
 *
 * @param analysis free text as written by the collaborator
 * @param score    similarity opinion in [0, 100], or {@code null} when none could be read
 * @param provider name of the provider that produced it
 */
public record AnalysisResult(String analysis, Double score, String provider) {

    public boolean hasScore() {
        return score != null;
    }
}
