package com.example.handwritingcomparator.service.preprocessing;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.ConfigurationException;
import com.example.handwritingcomparator.model.NormalizedImage;
import com.example.handwritingcomparator.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.RotatedRect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brings arbitrary specimens to a comparable form. Scanning resolution is removed by rescaling to a
 * canonical longest edge, lighting differences are flattened with contrast limited adaptive
 * histogram equalisation (CLAHE), an unsharp mask restores stroke edges before an adaptive threshold
 * separates ink from paper, and a small page rotation is undone from the minimum area rectangle
 * around the ink.
 */
@Component
public class ImagePreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    private static final Scalar PAPER = new Scalar(255, 255, 255, 0);

    private final ComparatorProperties.Preprocessing settings;

    public ImagePreprocessor(ComparatorProperties properties) {
        this.settings = properties.getPreprocessing();
        validate(settings);
    }

    private static void validate(ComparatorProperties.Preprocessing settings) {
        if (settings.getCanonicalLongestEdge() <= 0) {
            throw new ConfigurationException("canonical-longest-edge must be positive but was "
                    + settings.getCanonicalLongestEdge());
        }
        if (settings.getClaheClipLimit() <= 0) {
            throw new ConfigurationException("clahe-clip-limit must be positive but was " + settings.getClaheClipLimit());
        }
        if (settings.getClaheTileSize() <= 0) {
            throw new ConfigurationException("clahe-tile-size must be positive but was " + settings.getClaheTileSize());
        }
        requireOddAboveOne("threshold-block-size", settings.getThresholdBlockSize());
        requireOddAboveOne("median-kernel", settings.getMedianKernel());
        if (settings.getSharpenSigma() <= 0) {
            throw new ConfigurationException("sharpen-sigma must be positive but was " + settings.getSharpenSigma());
        }
        if (settings.getSharpenAmount() < 0) {
            throw new ConfigurationException("sharpen-amount must be non-negative but was " + settings.getSharpenAmount());
        }
        if (settings.getDeskewMinDegrees() < 0 || settings.getDeskewMaxDegrees() < settings.getDeskewMinDegrees()) {
            throw new ConfigurationException("Deskew range must satisfy 0 <= min <= max but was ["
                    + settings.getDeskewMinDegrees() + ", " + settings.getDeskewMaxDegrees() + "]");
        }
    }

    private static void requireOddAboveOne(String name, int value) {
        if (value <= 1 || value % 2 == 0) {
            throw new ConfigurationException(name + " must be an odd number greater than 1 but was " + value);
        }
    }

    public NormalizedImage normalize(byte[] imageBytes) {
        return normalize(ImageUtils.decode(imageBytes));
    }

    /**
     * Grayscale, canonical scale, CLAHE, unsharp mask, then median smoothing and an inverted Gaussian
     * adaptive threshold so that ink is 255 in the binary plane. When the ink block is rotated by
     * more than the deskew minimum and less than the deskew maximum, both planes are rotated back
     * and the threshold is taken again. The skeleton is thinned from the final binary plane.
     */
    public NormalizedImage normalize(Mat image) {
        Mat gray = ImageUtils.toGray(image);
        Mat scaled = ImageUtils.resizeToLongestEdge(gray, settings.getCanonicalLongestEdge());
        Mat equalized = equalize(scaled);
        Mat sharpened = sharpen(equalized);
        Mat binary = binarize(sharpened);

        double skew = skewAngle(binary, settings.getDeskewMinInkPixels());
        double magnitude = Math.abs(skew);
        if (magnitude > settings.getDeskewMinDegrees() && magnitude < settings.getDeskewMaxDegrees()) {
            log.debug("Deskewing specimen by {} degrees", skew);
            equalized = rotate(equalized, skew);
            binary = binarize(rotate(sharpened, skew));
        }

        Mat skeleton = Skeletonizer.thin(binary);
        log.debug("Normalized specimen from {}x{} to {}x{}", image.cols(), image.rows(),
                equalized.cols(), equalized.rows());
        return new NormalizedImage(equalized, binary, skeleton, image.cols(), image.rows());
    }

    /**
     * Light normalisation for interactive region comparison: grayscale and CLAHE only, keeping the
     * region at its native size so that pixel coordinates stay meaningful.
     */
    public Mat normalizeRegion(Mat region) {
        return equalize(ImageUtils.toGray(region));
    }

    /**
     * Rotation of the ink block in degrees, positive when its long axis runs down to the right,
     * within [-45, 45]. Of the two edges of the minimum area rectangle the one closer to horizontal
     * is taken as the text direction. Returns 0 when fewer than {@code minInkPixels} pixels are ink.
     */
    static double skewAngle(Mat binary, int minInkPixels) {
        if (opencv_core.countNonZero(binary) < Math.max(1, minInkPixels)) {
            return 0.0;
        }
        Mat locations = new Mat();
        opencv_core.findNonZero(binary, locations);
        RotatedRect box = opencv_imgproc.minAreaRect(locations);
        // width edge runs along (cos a, sin a), height edge along (-sin a, cos a)
        double widthEdge = foldAxial(box.angle());
        double heightEdge = foldAxial(box.angle() + 90.0);
        return Math.abs(widthEdge) <= Math.abs(heightEdge) ? widthEdge : heightEdge;
    }

    private static double foldAxial(double degrees) {
        double folded = degrees % 180.0;
        if (folded > 90.0) {
            folded -= 180.0;
        } else if (folded <= -90.0) {
            folded += 180.0;
        }
        return folded;
    }

    private static Mat rotate(Mat gray, double degrees) {
        Point2f centre = new Point2f(gray.cols() / 2.0f, gray.rows() / 2.0f);
        Mat rotation = opencv_imgproc.getRotationMatrix2D(centre, degrees, 1.0);
        Mat rotated = new Mat();
        opencv_imgproc.warpAffine(gray, rotated, rotation, gray.size(),
                opencv_imgproc.INTER_CUBIC, opencv_core.BORDER_CONSTANT, PAPER);
        return rotated;
    }

    private Mat equalize(Mat gray) {
        Mat equalized = new Mat();
        int tile = settings.getClaheTileSize();
        opencv_imgproc.createCLAHE(settings.getClaheClipLimit(), new Size(tile, tile)).apply(gray, equalized);
        return equalized;
    }

    private Mat sharpen(Mat gray) {
        Mat blurred = new Mat();
        opencv_imgproc.GaussianBlur(gray, blurred, new Size(0, 0), settings.getSharpenSigma());
        Mat sharpened = new Mat();
        double amount = settings.getSharpenAmount();
        opencv_core.addWeighted(gray, 1.0 + amount, blurred, -amount, 0, sharpened);
        return sharpened;
    }

    private Mat binarize(Mat gray) {
        Mat smoothed = new Mat();
        opencv_imgproc.medianBlur(gray, smoothed, settings.getMedianKernel());
        Mat binary = new Mat();
        opencv_imgproc.adaptiveThreshold(smoothed, binary, 255,
                opencv_imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                opencv_imgproc.THRESH_BINARY_INV,
                settings.getThresholdBlockSize(), settings.getThresholdOffset());
        return binary;
    }
}
