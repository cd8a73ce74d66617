package com.example.handwritingcomparator.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One named, independently computed similarity figure. A comparison emits these in a fixed order
 * that clients display as-is.
 */
@Schema(description = "Single similarity metric contributing to the composite score")
public record SubScore(
        @Schema(description = "Unique, human readable metric name", example = "Structural Similarity") String name,
        @Schema(description = "Score in percent", example = "84.2") double score,
        @Schema(description = "What was measured") String description) {

    public static final String MACRO_GEOMETRY = "Macro Geometry";
    public static final String STROKE_DISTRIBUTION = "Stroke Distribution";
    public static final String CURVATURE_MATCH = "Curvature Match";
    public static final String STRUCTURAL_SIMILARITY = "Structural Similarity";
    public static final String CORRELATION = "Correlation";
    public static final String AI_DEEP_ANALYSIS = "AI Deep Analysis";

    public SubScore {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sub-score name must not be blank");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Sub-score " + name + " must lie in [0, 100] but was " + score);
        }
    }

    /**
     * Builds a sub-score from a percentage, rounded to one decimal place.
     */
    public static SubScore of(String name, double percent, String description) {
        return new SubScore(name, round(percent), description);
    }

    public boolean isAiDerived() {
        return AI_DEEP_ANALYSIS.equals(name);
    }

    public static double round(double percent) {
        double bounded = Math.max(0.0, Math.min(100.0, percent));
        return Math.round(bounded * 10.0) / 10.0;
    }
}
