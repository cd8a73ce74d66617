package com.example.handwritingcomparator.service.overlay;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.GeometryException;
import com.example.handwritingcomparator.model.CropRect;
import com.example.handwritingcomparator.model.CropResult;
import com.example.handwritingcomparator.model.ImageSize;
import com.example.handwritingcomparator.model.LocalComparisonResult;
import com.example.handwritingcomparator.model.OverlayTransform;
import com.example.handwritingcomparator.model.SubScore;
import com.example.handwritingcomparator.service.metrics.SimilarityMetrics;
import com.example.handwritingcomparator.service.preprocessing.ImagePreprocessor;
import com.example.handwritingcomparator.service.visualization.VisualizationGenerator;
import com.example.handwritingcomparator.util.GeometryTransform;
import com.example.handwritingcomparator.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Native resolution cropping and the interactive overlay re-scoring loop. Out of range transforms
 * are clamped rather than rejected because the overlay is driven by continuous gestures.
 */
@Component
public class CropOverlayEngine {

    private static final Logger log = LoggerFactory.getLogger(CropOverlayEngine.class);
    private static final Scalar WHITE = new Scalar(255, 255, 255, 0);

    private final ImagePreprocessor preprocessor;
    private final SimilarityMetrics metrics;
    private final VisualizationGenerator visualization;
    private final ComparatorProperties.Overlay settings;

    public CropOverlayEngine(ImagePreprocessor preprocessor,
                             SimilarityMetrics metrics,
                             VisualizationGenerator visualization,
                             ComparatorProperties properties) {
        this.preprocessor = preprocessor;
        this.metrics = metrics;
        this.visualization = visualization;
        this.settings = properties.getOverlay();
    }

    /**
     * Cuts {@code rect}, given in source pixels, out of {@code image}. The transparent rendering
     * uses the inverted gray level as alpha so that paper disappears and ink stays opaque.
     */
    public CropResult crop(Mat image, CropRect rect) {
        CropRect clamped = GeometryTransform.clamp(rect, new ImageSize(image.cols(), image.rows()));
        if (!clamped.equals(rect)) {
            log.debug("Clamped crop {} to {} within {}x{}", rect, clamped, image.cols(), image.rows());
        }
        Mat region = new Mat(image, new Rect(clamped.x(), clamped.y(), clamped.width(), clamped.height())).clone();
        Mat solid = ImageUtils.toBgr(region);

        Mat alpha = new Mat();
        opencv_core.bitwise_not(ImageUtils.toGray(solid), alpha);
        MatVector channels = new MatVector();
        opencv_core.split(solid, channels);
        Mat transparent = new Mat();
        opencv_core.merge(new MatVector(channels.get(0), channels.get(1), channels.get(2), alpha), transparent);

        return new CropResult(
                ImageUtils.encodePng(transparent),
                ImageUtils.encodePng(solid),
                clamped.width(),
                clamped.height(),
                clamped.x(),
                clamped.y());
    }

    public LocalComparisonResult localCompare(Mat base, Mat overlay, OverlayTransform transform) {
        double scale = clamp(transform.scale(), settings.getMinScale(), settings.getMaxScale());
        double rotation = clamp(transform.rotationDegrees(), -180.0, 180.0);
        double alpha = clamp(transform.alpha(), settings.getMinAlpha(), settings.getMaxAlpha());

        int width = regionExtent(transform.width(), overlay.cols(), scale, "width");
        int height = regionExtent(transform.height(), overlay.rows(), scale, "height");
        Mat placed = rotate(ImageUtils.resize(overlay, width, height), rotation);

        int regionWidth = Math.min(width, base.cols());
        int regionHeight = Math.min(height, base.rows());
        int x = clampInt((int) Math.round(transform.translateX()), 0, base.cols() - regionWidth);
        int y = clampInt((int) Math.round(transform.translateY()), 0, base.rows() - regionHeight);
        log.debug("Local comparison at ({}, {}) size {}x{}, scale {}, rotation {}, alpha {}",
                x, y, regionWidth, regionHeight, scale, rotation, alpha);

        Mat baseRegion = new Mat(base, new Rect(x, y, regionWidth, regionHeight)).clone();
        Mat overlayRegion = regionWidth == width && regionHeight == height
                ? placed
                : new Mat(placed, new Rect(0, 0, regionWidth, regionHeight)).clone();

        Mat baseGray = preprocessor.normalizeRegion(baseRegion);
        Mat overlayGray = preprocessor.normalizeRegion(overlayRegion);

        double ssim = metrics.ssim(baseGray, overlayGray);
        double edges = metrics.edgeOverlap(baseGray, overlayGray);
        return new LocalComparisonResult(
                SubScore.round(ssim),
                SubScore.round(edges),
                ImageUtils.encodePng(visualization.differenceHeatmap(baseGray, overlayGray)),
                ImageUtils.encodePng(visualization.edgeVisualization(baseGray, overlayGray)),
                regionWidth,
                regionHeight,
                x,
                y);
    }

    private static int regionExtent(Integer explicit, int overlayExtent, double scale, String label) {
        if (explicit != null) {
            if (explicit <= 0) {
                throw new GeometryException("Overlay " + label + " must be positive but was " + explicit);
            }
            return explicit;
        }
        return Math.max(1, (int) Math.round(overlayExtent * scale));
    }

    /**
     * Rotates about the centre, keeping the canvas size. The angle is clockwise as seen on screen,
     * which is negative in OpenCV's convention.
     */
    private static Mat rotate(Mat src, double clockwiseDegrees) {
        if (clockwiseDegrees == 0.0) {
            return src;
        }
        Point2f centre = new Point2f(src.cols() / 2.0f, src.rows() / 2.0f);
        Mat matrix = opencv_imgproc.getRotationMatrix2D(centre, -clockwiseDegrees, 1.0);
        Mat rotated = new Mat();
        opencv_imgproc.warpAffine(src, rotated, matrix, new Size(src.cols(), src.rows()),
                opencv_imgproc.INTER_LINEAR, opencv_core.BORDER_CONSTANT, WHITE);
        return rotated;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static int clampInt(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
