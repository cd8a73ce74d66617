package com.example.handwritingcomparator.service.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.model.CurvatureStats;
import com.example.handwritingcomparator.model.FeatureVector;
import com.example.handwritingcomparator.support.SpecimenImages;
import com.example.handwritingcomparator.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.util.List;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

class SimilarityMetricsTest {

    private final SimilarityMetrics metrics = new SimilarityMetrics(new ComparatorProperties());

    private static Mat gray(BufferedImage image) {
        return ImageUtils.toGray(ImageUtils.decode(SpecimenImages.png(image)));
    }

    @Test
    void identicalImagesScoreFullSimilarity() {
        Mat specimen = gray(SpecimenImages.handwriting(3, 320, 240));

        assertThat(metrics.ssim(specimen, specimen.clone())).isCloseTo(100.0, within(1e-3));
        assertThat(metrics.crossCorrelation(specimen, specimen.clone())).isCloseTo(100.0, within(1e-3));
        assertThat(metrics.edgeOverlap(specimen, specimen.clone())).isEqualTo(100.0);
    }

    @Test
    void metricsAreSymmetricForDifferentlySizedInputs() {
        Mat first = gray(SpecimenImages.handwriting(1, 320, 240));
        Mat second = gray(SpecimenImages.handwriting(2, 400, 200));

        assertThat(metrics.ssim(first, second)).isCloseTo(metrics.ssim(second, first), within(1e-9));
        assertThat(metrics.crossCorrelation(first, second)).isCloseTo(metrics.crossCorrelation(second, first), within(1e-3));
        assertThat(metrics.edgeOverlap(first, second)).isEqualTo(metrics.edgeOverlap(second, first));
    }

    @Test
    void scoresStayWithinPercentRange() {
        Mat first = gray(SpecimenImages.handwriting(7, 300, 300));
        Mat second = gray(SpecimenImages.bars(300, 300, 5, 4f, false));

        assertThat(metrics.ssim(first, second)).isBetween(0.0, 100.0);
        assertThat(metrics.crossCorrelation(first, second)).isBetween(0.0, 100.0);
        assertThat(metrics.edgeOverlap(first, second)).isBetween(0.0, 100.0);
    }

    @Test
    void flatImageHasNoCorrelation() {
        Mat blank = gray(SpecimenImages.blank(200, 100));
        Mat specimen = gray(SpecimenImages.handwriting(4, 200, 100));

        assertThat(metrics.crossCorrelation(blank, specimen)).isZero();
        assertThat(metrics.crossCorrelation(blank, blank.clone())).isZero();
    }

    @Test
    void inverseImageCorrelationIsClampedToZero() {
        Mat specimen = gray(SpecimenImages.handwriting(4, 200, 100));
        Mat inverted = new Mat();
        opencv_core.bitwise_not(specimen, inverted);

        assertThat(metrics.crossCorrelation(specimen, inverted)).isZero();
    }

    @Test
    void correlationFallsAsNoiseIsAdded() {
        BufferedImage source = SpecimenImages.handwriting(6, 320, 240);
        Mat specimen = gray(source);

        double light = metrics.crossCorrelation(specimen, gray(SpecimenImages.withSaltAndPepper(source, 0.05, 1)));
        double heavy = metrics.crossCorrelation(specimen, gray(SpecimenImages.withSaltAndPepper(source, 0.3, 1)));

        assertThat(light).isLessThan(100.0).isGreaterThan(heavy);
        assertThat(heavy).isPositive();
    }

    @Test
    void edgeOverlapIsZeroWhenOneSideHasNoEdges() {
        Mat blank = gray(SpecimenImages.blank(200, 100));
        Mat specimen = gray(SpecimenImages.handwriting(4, 200, 100));

        assertThat(metrics.edgeOverlap(blank, specimen)).isZero();
    }

    @Test
    void featureDistanceOfIdenticalVectorsIsFull() {
        FeatureVector vector = vector(12.0, 0.7, 3.1, List.of(0, 4, 10, 3), new CurvatureStats(0.4, 0.09));

        for (FeatureKind kind : FeatureKind.values()) {
            assertThat(metrics.featureDistance(vector, vector, kind)).as(kind.name()).isCloseTo(100.0, within(1e-9));
        }
    }

    @Test
    void featureDistanceInvolvingEmptySpecimenIsZero() {
        FeatureVector vector = vector(12.0, 0.7, 3.1, List.of(0, 4, 10, 3), new CurvatureStats(0.4, 0.09));

        for (FeatureKind kind : FeatureKind.values()) {
            assertThat(metrics.featureDistance(vector, FeatureVector.empty(4), kind)).isZero();
            assertThat(metrics.featureDistance(FeatureVector.empty(4), vector, kind)).isZero();
        }
    }

    @Test
    void geometryScoreFallsWithSlantDifference() {
        FeatureVector upright = vector(0.0, 0.7, 3.0, List.of(1, 1), new CurvatureStats(0.4, 0.09));
        FeatureVector leaning = vector(15.0, 0.7, 3.0, List.of(1, 1), new CurvatureStats(0.4, 0.09));

        // half the 30 degree saturation on one of three components
        assertThat(metrics.featureDistance(upright, leaning, FeatureKind.GEOMETRY)).isCloseTo(500.0 / 6.0, within(1e-9));
    }

    @Test
    void strokeDistributionAccountsForSkeletonConnectivity() {
        FeatureVector parallel = vector(0.0, 0.7, 3.0, List.of(2, 6, 2), new CurvatureStats(0.4, 0.09), 0.0, 0.04);
        FeatureVector crossing = vector(0.0, 0.7, 3.0, List.of(2, 6, 2), new CurvatureStats(0.4, 0.09), 0.01, 0.04);
        FeatureVector branching = vector(0.0, 0.7, 3.0, List.of(2, 6, 2), new CurvatureStats(0.4, 0.09), 0.05, 0.04);

        // equal width histograms; the branch ratios differ by half the 0.02 saturation
        assertThat(metrics.featureDistance(parallel, crossing, FeatureKind.STROKE_WIDTH)).isCloseTo(87.5, within(1e-9));
        assertThat(metrics.featureDistance(parallel, branching, FeatureKind.STROKE_WIDTH)).isCloseTo(75.0, within(1e-9));
        assertThat(metrics.featureDistance(parallel, crossing, FeatureKind.GEOMETRY)).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void slantDifferenceIsAxial() {
        assertThat(SimilarityMetrics.slantDifference(89, -89)).isCloseTo(2.0, within(1e-9));
        assertThat(SimilarityMetrics.slantDifference(10, -10)).isCloseTo(20.0, within(1e-9));
        assertThat(SimilarityMetrics.slantDifference(-45, 45)).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void histogramIntersectionNormalisesCounts() {
        assertThat(SimilarityMetrics.histogramIntersection(List.of(2, 0), List.of(0, 5))).isZero();
        assertThat(SimilarityMetrics.histogramIntersection(List.of(1, 1), List.of(10, 10))).isCloseTo(100.0, within(1e-9));
        assertThat(SimilarityMetrics.histogramIntersection(List.of(1, 3), List.of(3, 1))).isCloseTo(50.0, within(1e-9));
        assertThatThrownBy(() -> SimilarityMetrics.histogramIntersection(List.of(1), List.of(1, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closenessSaturates() {
        assertThat(SimilarityMetrics.closeness(0, 2)).isEqualTo(1.0);
        assertThat(SimilarityMetrics.closeness(1, 2)).isEqualTo(0.5);
        assertThat(SimilarityMetrics.closeness(5, 2)).isZero();
    }

    private static FeatureVector vector(double slant, double ratio, double spacing, List<Integer> widths, CurvatureStats curvature) {
        return vector(slant, ratio, spacing, widths, curvature, 0.01, 0.05);
    }

    private static FeatureVector vector(double slant, double ratio, double spacing, List<Integer> widths,
                                        CurvatureStats curvature, double branchRatio, double endRatio) {
        return new FeatureVector(slant, ratio, spacing, widths, branchRatio, endRatio, curvature, 20, 1000);
    }
}
