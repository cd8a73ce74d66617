package com.example.handwritingcomparator.model;

import java.util.Collections;
import java.util.List;

/**
 * Writer descriptors for one specimen. A specimen without ink yields {@link #empty(int)} rather than
 * an error, so that downstream comparators can score it as 0.
 *
 * @param slantAngle           mean lean of the upright strokes from vertical in degrees, in [-45, 45];
 *                             positive leans right
 * @param sizeRatio            median blob width divided by median blob height
 * @param lineSpacing          mean distance between text line centres, in median blob heights
 * @param strokeWidthHistogram stroke thickness counts per bucket; bucket {@code i} holds widths in [i, i+1) px
 * @param branchRatio          share of skeleton pixels with more than two skeleton neighbours
 * @param endRatio             share of skeleton pixels with exactly one skeleton neighbour
 * @param curvature            turning angle statistics along the stroke skeletons
 * @param componentCount       ink components retained as character blobs
 * @param inkPixels            binary foreground pixel count
 */
public record FeatureVector(
        double slantAngle,
        double sizeRatio,
        double lineSpacing,
        List<Integer> strokeWidthHistogram,
        double branchRatio,
        double endRatio,
        CurvatureStats curvature,
        int componentCount,
        long inkPixels) {

    public FeatureVector {
        strokeWidthHistogram = List.copyOf(strokeWidthHistogram);
    }

    public static FeatureVector empty(int buckets) {
        return new FeatureVector(0.0, 0.0, 0.0, Collections.nCopies(buckets, 0), 0.0, 0.0, CurvatureStats.NONE, 0, 0);
    }

    public boolean isEmpty() {
        return componentCount == 0 || inkPixels == 0;
    }
}
