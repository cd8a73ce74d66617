package com.example.handwritingcomparator.model;

/**
 * Mean and variance of the absolute turning angle, in radians, along traced stroke skeletons.
 */
public record CurvatureStats(double mean, double variance) {

    public static final CurvatureStats NONE = new CurvatureStats(0.0, 0.0);

    public double standardDeviation() {
        return Math.sqrt(Math.max(0.0, variance));
    }
}
