package com.example.handwritingcomparator.service.metrics;

/**
 * Descriptor families compared by {@link SimilarityMetrics#featureDistance}.
 */
public enum FeatureKind {
    /** Slant, letter proportions and line spacing. */
    GEOMETRY,
    /** Stroke thickness distribution. */
    STROKE_WIDTH,
    /** Turning angle statistics along the skeleton. */
    CURVATURE
}
