package com.example.handwritingcomparator.model;

/**
 * Outcome of re-scoring an aligned overlay against the base region beneath it. Images are PNG encoded.
 */
public record LocalComparisonResult(
        double localSsim,
        double edgeOverlap,
        byte[] differenceHeatmap,
        byte[] edgeVisualization,
        int regionWidth,
        int regionHeight,
        int regionX,
        int regionY) {
}
