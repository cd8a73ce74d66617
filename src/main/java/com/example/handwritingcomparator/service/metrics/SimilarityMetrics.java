package com.example.handwritingcomparator.service.metrics;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.model.CurvatureStats;
import com.example.handwritingcomparator.model.FeatureVector;
import com.example.handwritingcomparator.util.ImageUtils;
import java.util.List;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Component;

/**
 * Pixel and descriptor level similarity measures. Every method is a pure function of its inputs and
 * returns a percentage in [0, 100]. The pixel metrics letterbox both inputs to a shared shape first,
 * so callers may pass images of different sizes.
 */
@Component
public class SimilarityMetrics {

    private static final double C1 = Math.pow(0.01 * 255, 2);
    private static final double C2 = Math.pow(0.03 * 255, 2);
    private static final Size SSIM_WINDOW = new Size(11, 11);
    private static final double SSIM_SIGMA = 1.5;
    private static final Scalar PAPER = new Scalar(255, 255, 255, 0);

    private final ComparatorProperties.Features features;
    private final ComparatorProperties.Overlay overlay;

    public SimilarityMetrics(ComparatorProperties properties) {
        this.features = properties.getFeatures();
        this.overlay = properties.getOverlay();
    }

    /**
     * Mean structural similarity with an 11x11 Gaussian window. Negative structure correlation is
     * treated as no similarity.
     */
    public double ssim(Mat a, Mat b) {
        Mat[] aligned = ImageUtils.alignToCommonShape(a, b, PAPER);
        Mat i1 = new Mat();
        Mat i2 = new Mat();
        aligned[0].convertTo(i1, opencv_core.CV_32F);
        aligned[1].convertTo(i2, opencv_core.CV_32F);

        Mat mu1 = blur(i1);
        Mat mu2 = blur(i2);
        Mat mu1Sq = product(mu1, mu1);
        Mat mu2Sq = product(mu2, mu2);
        Mat mu1Mu2 = product(mu1, mu2);

        Mat sigma1Sq = difference(blur(product(i1, i1)), mu1Sq);
        Mat sigma2Sq = difference(blur(product(i2, i2)), mu2Sq);
        Mat sigma12 = difference(blur(product(i1, i2)), mu1Mu2);

        Mat numerator = product(affine(mu1Mu2, 2.0, C1), affine(sigma12, 2.0, C2));
        Mat denominator = product(affine(sum(mu1Sq, mu2Sq), 1.0, C1), affine(sum(sigma1Sq, sigma2Sq), 1.0, C2));
        Mat map = new Mat();
        opencv_core.divide(numerator, denominator, map);

        double mssim = opencv_core.mean(map).get(0);
        return toPercent(mssim);
    }

    /**
     * Normalized cross-correlation coefficient of the two aligned rasters, taken from a single
     * {@code TM_CCOEFF_NORMED} template match of equal sized inputs. A flat image has no defined
     * correlation and scores 0; anti-correlation also scores 0.
     */
    public double crossCorrelation(Mat a, Mat b) {
        Mat[] aligned = ImageUtils.alignToCommonShape(a, b, PAPER);
        if (isFlat(aligned[0]) || isFlat(aligned[1])) {
            return 0.0;
        }
        Mat result = new Mat();
        opencv_imgproc.matchTemplate(aligned[0], aligned[1], result, opencv_imgproc.TM_CCOEFF_NORMED);
        double coefficient;
        try (FloatIndexer index = result.createIndexer()) {
            coefficient = index.get(0, 0);
        }
        if (Double.isNaN(coefficient)) {
            return 0.0;
        }
        return toPercent(coefficient);
    }

    private static boolean isFlat(Mat gray) {
        Mat mean = new Mat();
        Mat stddev = new Mat();
        opencv_core.meanStdDev(gray, mean, stddev);
        try (DoubleIndexer index = stddev.createIndexer()) {
            return index.get(0, 0) == 0.0;
        }
    }

    /**
     * Intersection over union of the Canny edge masks. Returns 0 when either image has no edges.
     */
    public double edgeOverlap(Mat a, Mat b) {
        Mat[] aligned = ImageUtils.alignToCommonShape(a, b, PAPER);
        Mat edgesA = edges(aligned[0]);
        Mat edgesB = edges(aligned[1]);
        if (opencv_core.countNonZero(edgesA) == 0 || opencv_core.countNonZero(edgesB) == 0) {
            return 0.0;
        }
        Mat intersection = new Mat();
        Mat union = new Mat();
        opencv_core.bitwise_and(edgesA, edgesB, intersection);
        opencv_core.bitwise_or(edgesA, edgesB, union);
        return toPercent(opencv_core.countNonZero(intersection) / (double) opencv_core.countNonZero(union));
    }

    public Mat edges(Mat gray) {
        Mat edges = new Mat();
        opencv_imgproc.Canny(gray, edges, overlay.getCannyLow(), overlay.getCannyHigh());
        return edges;
    }

    /**
     * Compares one descriptor family. A specimen without ink carries no descriptors, so any pair
     * involving one scores 0.
     */
    public double featureDistance(FeatureVector a, FeatureVector b, FeatureKind kind) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return switch (kind) {
            case GEOMETRY -> geometry(a, b);
            case STROKE_WIDTH -> strokeDistribution(a, b);
            case CURVATURE -> curvature(a.curvature(), b.curvature());
        };
    }

    private double geometry(FeatureVector a, FeatureVector b) {
        double slant = closeness(slantDifference(a.slantAngle(), b.slantAngle()), features.getSlantSaturationDegrees());
        double ratio = closeness(Math.abs(a.sizeRatio() - b.sizeRatio()), features.getSizeRatioSaturation());
        double spacing = closeness(Math.abs(a.lineSpacing() - b.lineSpacing()), features.getLineSpacingSaturation());
        return (slant + ratio + spacing) / 3.0 * 100.0;
    }

    /**
     * Mean of the stroke width histogram intersection and the skeleton connectivity closeness, where
     * connectivity averages the branch point and end point ratio agreement.
     */
    private double strokeDistribution(FeatureVector a, FeatureVector b) {
        double widths = histogramIntersection(a.strokeWidthHistogram(), b.strokeWidthHistogram()) / 100.0;
        double saturation = features.getConnectivitySaturation();
        double branches = closeness(Math.abs(a.branchRatio() - b.branchRatio()), saturation);
        double ends = closeness(Math.abs(a.endRatio() - b.endRatio()), saturation);
        return (widths + (branches + ends) / 2.0) / 2.0 * 100.0;
    }

    private double curvature(CurvatureStats a, CurvatureStats b) {
        double saturation = features.getCurvatureSaturation();
        double mean = closeness(Math.abs(a.mean() - b.mean()), saturation);
        double spread = closeness(Math.abs(a.standardDeviation() - b.standardDeviation()), saturation);
        return (mean + spread) / 2.0 * 100.0;
    }

    static double histogramIntersection(List<Integer> a, List<Integer> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Histograms differ in length: " + a.size() + " vs " + b.size());
        }
        double totalA = a.stream().mapToLong(Integer::longValue).sum();
        double totalB = b.stream().mapToLong(Integer::longValue).sum();
        if (totalA == 0 || totalB == 0) {
            return 0.0;
        }
        double overlap = 0;
        for (int i = 0; i < a.size(); i++) {
            overlap += Math.min(a.get(i) / totalA, b.get(i) / totalB);
        }
        return Math.min(1.0, overlap) * 100.0;
    }

    /**
     * Slant is axial: 89 and -89 degrees are two degrees apart.
     */
    static double slantDifference(double a, double b) {
        double d = Math.abs(a - b) % 180.0;
        return Math.min(d, 180.0 - d);
    }

    /**
     * Linear falloff from 1 at no difference to 0 at {@code saturation} and beyond.
     */
    static double closeness(double difference, double saturation) {
        if (saturation <= 0) {
            return difference == 0 ? 1.0 : 0.0;
        }
        return Math.max(0.0, 1.0 - difference / saturation);
    }

    private static double toPercent(double coefficient) {
        return Math.max(0.0, Math.min(1.0, coefficient)) * 100.0;
    }

    private static Mat blur(Mat src) {
        Mat dst = new Mat();
        opencv_imgproc.GaussianBlur(src, dst, SSIM_WINDOW, SSIM_SIGMA);
        return dst;
    }

    private static Mat product(Mat a, Mat b) {
        Mat dst = new Mat();
        opencv_core.multiply(a, b, dst);
        return dst;
    }

    private static Mat sum(Mat a, Mat b) {
        Mat dst = new Mat();
        opencv_core.add(a, b, dst);
        return dst;
    }

    private static Mat difference(Mat a, Mat b) {
        Mat dst = new Mat();
        opencv_core.subtract(a, b, dst);
        return dst;
    }

    private static Mat affine(Mat src, double alpha, double beta) {
        Mat dst = new Mat();
        src.convertTo(dst, -1, alpha, beta);
        return dst;
    }
}
