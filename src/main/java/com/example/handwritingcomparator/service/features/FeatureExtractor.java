package com.example.handwritingcomparator.service.features;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.model.CurvatureStats;
import com.example.handwritingcomparator.model.FeatureVector;
import com.example.handwritingcomparator.model.NormalizedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.javacpp.indexer.IntIndexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives writer descriptors from a normalized specimen: slant, proportions, line spacing, stroke
 * thickness distribution, skeleton connectivity and skeleton curvature.
 */
@Component
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private static final int SLANT_BINS = 90;
    private static final double MAX_LEAN_DEGREES = 45.0;
    private static final int CURVATURE_MIN_POINTS = 10;
    private static final int CURVATURE_STEP = 2;
    private static final double MAX_BLOB_HEIGHT_FRACTION = 0.8;

    private final ComparatorProperties.Features settings;

    public FeatureExtractor(ComparatorProperties properties) {
        this.settings = properties.getFeatures();
    }

    public FeatureVector extract(NormalizedImage image) {
        Mat binary = image.binary();
        long inkPixels = opencv_core.countNonZero(binary);
        if (inkPixels == 0) {
            log.debug("Specimen carries no ink, returning empty feature vector");
            return FeatureVector.empty(settings.getStrokeWidthBuckets());
        }

        List<Blob> blobs = findBlobs(binary);
        if (blobs.isEmpty()) {
            log.debug("No character blobs among {} ink pixels, returning empty feature vector", inkPixels);
            return FeatureVector.empty(settings.getStrokeWidthBuckets());
        }

        double medianWidth = median(blobs.stream().mapToDouble(Blob::width).toArray());
        double medianHeight = median(blobs.stream().mapToDouble(Blob::height).toArray());
        double sizeRatio = medianHeight > 0 ? medianWidth / medianHeight : 0.0;
        double lineSpacing = lineSpacing(blobs, medianHeight);
        double slant = slantAngle(image.gray(), binary);

        Mat skeleton = image.skeleton();
        List<Integer> histogram = strokeWidthHistogram(binary, skeleton);
        Connectivity connectivity = connectivity(skeleton);
        CurvatureStats curvature = curvature(skeleton);

        log.debug("Extracted features: blobs={}, ink={}, slant={}, ratio={}, spacing={}, branches={}, ends={}",
                blobs.size(), inkPixels, slant, sizeRatio, lineSpacing,
                connectivity.branchRatio(), connectivity.endRatio());
        return new FeatureVector(slant, sizeRatio, lineSpacing, histogram,
                connectivity.branchRatio(), connectivity.endRatio(), curvature, blobs.size(), inkPixels);
    }

    private List<Blob> findBlobs(Mat binary) {
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = opencv_imgproc.connectedComponentsWithStats(binary, labels, stats, centroids, 8, opencv_core.CV_32S);
        double maxHeight = binary.rows() * MAX_BLOB_HEIGHT_FRACTION;

        List<Blob> blobs = new ArrayList<>();
        try (IntIndexer statIndex = stats.createIndexer(); DoubleIndexer centroidIndex = centroids.createIndexer()) {
            // label 0 is the background
            for (int label = 1; label < count; label++) {
                int area = statIndex.get(label, opencv_imgproc.CC_STAT_AREA);
                int width = statIndex.get(label, opencv_imgproc.CC_STAT_WIDTH);
                int height = statIndex.get(label, opencv_imgproc.CC_STAT_HEIGHT);
                if (area < settings.getMinBlobArea() || height >= maxHeight) {
                    continue;
                }
                blobs.add(new Blob(width, height, centroidIndex.get(label, 1)));
            }
        }
        return blobs;
    }

    /**
     * Groups blob centroids into text lines and returns the mean gap between consecutive line
     * centres in units of the median blob height. A single line yields 0.
     */
    static double lineSpacing(List<Blob> blobs, double medianHeight) {
        if (medianHeight <= 0) {
            return 0.0;
        }
        double[] ys = blobs.stream().mapToDouble(Blob::centroidY).sorted().toArray();
        List<Double> lineCentres = new ArrayList<>();
        double sum = ys[0];
        int members = 1;
        for (int i = 1; i < ys.length; i++) {
            if (ys[i] - ys[i - 1] > medianHeight) {
                lineCentres.add(sum / members);
                sum = 0;
                members = 0;
            }
            sum += ys[i];
            members++;
        }
        lineCentres.add(sum / members);
        if (lineCentres.size() < 2) {
            return 0.0;
        }
        double gaps = 0;
        for (int i = 1; i < lineCentres.size(); i++) {
            gaps += lineCentres.get(i) - lineCentres.get(i - 1);
        }
        return gaps / (lineCentres.size() - 1) / medianHeight;
    }

    /**
     * Lean of the upright strokes in degrees: 0 for vertical, positive when the top of a stroke lies
     * to the right of its foot. Stroke direction is the gradient orientation rotated by 90 degrees;
     * only ink pixels whose stroke runs within 45 degrees of vertical vote, weighted by gradient
     * magnitude, so horizontal connectors and baselines do not pull the mean. Returns 0 when no
     * stroke qualifies.
     */
    private double slantAngle(Mat gray, Mat binary) {
        Mat gx = new Mat();
        Mat gy = new Mat();
        opencv_imgproc.Sobel(gray, gx, opencv_core.CV_32F, 1, 0);
        opencv_imgproc.Sobel(gray, gy, opencv_core.CV_32F, 0, 1);

        double[] histogram = new double[SLANT_BINS];
        double binWidth = 2.0 * MAX_LEAN_DEGREES / SLANT_BINS;
        try (FloatIndexer gxIndex = gx.createIndexer();
             FloatIndexer gyIndex = gy.createIndexer();
             UByteIndexer inkIndex = binary.createIndexer()) {
            for (int y = 0; y < binary.rows(); y++) {
                for (int x = 0; x < binary.cols(); x++) {
                    if (inkIndex.get(y, x) == 0) {
                        continue;
                    }
                    double dx = gxIndex.get(y, x);
                    double dy = gyIndex.get(y, x);
                    double magnitude = Math.hypot(dx, dy);
                    if (magnitude < 1e-3) {
                        continue;
                    }
                    double lean = leanFromVertical(Math.toDegrees(Math.atan2(dy, dx)) + 90.0);
                    if (Math.abs(lean) > MAX_LEAN_DEGREES) {
                        continue;
                    }
                    int bin = Math.min(SLANT_BINS - 1, (int) ((lean + MAX_LEAN_DEGREES) / binWidth));
                    histogram[bin] += magnitude;
                }
            }
        }

        double weight = 0;
        double weighted = 0;
        for (int bin = 0; bin < SLANT_BINS; bin++) {
            weight += histogram[bin];
            weighted += histogram[bin] * (-MAX_LEAN_DEGREES + (bin + 0.5) * binWidth);
        }
        return weight == 0 ? 0.0 : weighted / weight;
    }

    /**
     * Maps an axial stroke direction in image coordinates (y down, so 90 is vertical) to its lean
     * from vertical in (-90, 90]. An up-and-right stroke runs at 90 + lean modulo 180.
     */
    static double leanFromVertical(double direction) {
        double lean = (direction - 90.0) % 180.0;
        if (lean > 90.0) {
            lean -= 180.0;
        } else if (lean <= -90.0) {
            lean += 180.0;
        }
        return lean;
    }

    /**
     * Share of skeleton pixels that are junctions (more than two skeleton neighbours) and stroke
     * ends (exactly one neighbour), counted in the 8-neighbourhood.
     */
    static Connectivity connectivity(Mat skeleton) {
        int width = skeleton.cols();
        int height = skeleton.rows();
        long total = 0;
        long branches = 0;
        long ends = 0;
        try (UByteIndexer index = skeleton.createIndexer()) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (index.get(y, x) == 0) {
                        continue;
                    }
                    total++;
                    int neighbours = 0;
                    for (int ny = Math.max(0, y - 1); ny <= Math.min(height - 1, y + 1); ny++) {
                        for (int nx = Math.max(0, x - 1); nx <= Math.min(width - 1, x + 1); nx++) {
                            if ((nx != x || ny != y) && index.get(ny, nx) != 0) {
                                neighbours++;
                            }
                        }
                    }
                    if (neighbours > 2) {
                        branches++;
                    } else if (neighbours == 1) {
                        ends++;
                    }
                }
            }
        }
        if (total == 0) {
            return new Connectivity(0.0, 0.0);
        }
        return new Connectivity(branches / (double) total, ends / (double) total);
    }

    /**
     * Local thickness is twice the distance to the nearest background pixel, sampled on the
     * skeleton. Bucket {@code i} counts widths in [i, i+1); the last bucket absorbs the overflow.
     */
    private List<Integer> strokeWidthHistogram(Mat binary, Mat skeleton) {
        int buckets = settings.getStrokeWidthBuckets();
        Integer[] counts = new Integer[buckets];
        Arrays.fill(counts, 0);

        Mat distance = new Mat();
        opencv_imgproc.distanceTransform(binary, distance, opencv_imgproc.DIST_L2, 5);
        try (FloatIndexer distanceIndex = distance.createIndexer(); UByteIndexer skeletonIndex = skeleton.createIndexer()) {
            for (int y = 0; y < skeleton.rows(); y++) {
                for (int x = 0; x < skeleton.cols(); x++) {
                    if (skeletonIndex.get(y, x) == 0) {
                        continue;
                    }
                    double width = 2.0 * distanceIndex.get(y, x);
                    int bucket = Math.min(buckets - 1, (int) width);
                    counts[bucket]++;
                }
            }
        }
        return Arrays.asList(counts);
    }

    /**
     * Absolute turning angle between the chords {@code p[i-2] -> p[i]} and {@code p[i] -> p[i+2]}
     * along every skeleton contour long enough to carry a shape.
     */
    private CurvatureStats curvature(Mat skeleton) {
        MatVector contours = new MatVector();
        Mat hierarchy = new Mat();
        opencv_imgproc.findContours(skeleton.clone(), contours, hierarchy,
                opencv_imgproc.RETR_LIST, opencv_imgproc.CHAIN_APPROX_NONE);

        double sum = 0;
        double sumSquares = 0;
        long samples = 0;
        for (long c = 0; c < contours.size(); c++) {
            Mat contour = contours.get(c);
            int points = contour.rows();
            if (points <= CURVATURE_MIN_POINTS) {
                continue;
            }
            int[] xs = new int[points];
            int[] ys = new int[points];
            try (IntIndexer pointIndex = contour.createIndexer()) {
                for (int i = 0; i < points; i++) {
                    xs[i] = pointIndex.get(i, 0, 0);
                    ys[i] = pointIndex.get(i, 0, 1);
                }
            }
            for (int i = CURVATURE_STEP; i < points - CURVATURE_STEP; i++) {
                double ax = xs[i] - xs[i - CURVATURE_STEP];
                double ay = ys[i] - ys[i - CURVATURE_STEP];
                double bx = xs[i + CURVATURE_STEP] - xs[i];
                double by = ys[i + CURVATURE_STEP] - ys[i];
                if ((ax == 0 && ay == 0) || (bx == 0 && by == 0)) {
                    continue;
                }
                double turn = Math.abs(Math.atan2(ax * by - ay * bx, ax * bx + ay * by));
                sum += turn;
                sumSquares += turn * turn;
                samples++;
            }
        }
        if (samples == 0) {
            return CurvatureStats.NONE;
        }
        double mean = sum / samples;
        double variance = Math.max(0.0, sumSquares / samples - mean * mean);
        return new CurvatureStats(mean, variance);
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    record Blob(double width, double height, double centroidY) {
    }

    record Connectivity(double branchRatio, double endRatio) {
    }
}
