package com.example.handwritingcomparator.model;

/**
 * Categorical reading of a composite score. Thresholds live in the scoring table, not here.
 */
public enum Verdict {

    MATCH_LIKELY("High probability same writer", "#22c55e"),
    INCONCLUSIVE("Possible / Inconclusive", "#f59e0b"),
    MATCH_UNLIKELY("Likely different writers", "#ef4444");

    private final String label;
    private final String color;

    Verdict(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public String label() {
        return label;
    }

    public String color() {
        return color;
    }
}
