package com.example.handwritingcomparator.util;

import com.example.handwritingcomparator.exception.ImageDecodeException;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

/**
 * Codec and raster helpers shared by the engine. Every method returns a new {@link Mat}; inputs are
 * never modified.
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    public static Mat decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }
        Mat image;
        try {
            image = opencv_imgcodecs.imdecode(new Mat(data), opencv_imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException ex) {
            throw new ImageDecodeException("Unable to decode image payload", ex);
        }
        if (image == null || image.empty()) {
            throw new ImageDecodeException("Unable to decode image payload");
        }
        return image;
    }

    public static byte[] encodePng(Mat image) {
        return encode(".png", image, null);
    }

    public static byte[] encodeJpeg(Mat image, int quality) {
        return encode(".jpg", image, new IntPointer(opencv_imgcodecs.IMWRITE_JPEG_QUALITY, quality));
    }

    private static byte[] encode(String extension, Mat image, IntPointer params) {
        BytePointer buffer = new BytePointer();
        try {
            boolean encoded = params == null
                    ? opencv_imgcodecs.imencode(extension, image, buffer)
                    : opencv_imgcodecs.imencode(extension, image, buffer, params);
            if (!encoded) {
                throw new IllegalStateException("Unable to encode image as " + extension);
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            return bytes;
        } finally {
            buffer.close();
        }
    }

    public static Mat toGray(Mat input) {
        Mat gray = new Mat();
        switch (input.channels()) {
            case 1 -> input.copyTo(gray);
            case 4 -> opencv_imgproc.cvtColor(input, gray, opencv_imgproc.COLOR_BGRA2GRAY);
            default -> opencv_imgproc.cvtColor(input, gray, opencv_imgproc.COLOR_BGR2GRAY);
        }
        return gray;
    }

    public static Mat toBgr(Mat input) {
        Mat color = new Mat();
        switch (input.channels()) {
            case 1 -> opencv_imgproc.cvtColor(input, color, opencv_imgproc.COLOR_GRAY2BGR);
            case 4 -> opencv_imgproc.cvtColor(input, color, opencv_imgproc.COLOR_BGRA2BGR);
            default -> input.copyTo(color);
        }
        return color;
    }

    /**
     * Copies a single-channel 8-bit raster into a row-major array.
     */
    public static byte[] pixels(Mat gray) {
        if (gray.channels() != 1) {
            throw new IllegalArgumentException("Expected a single channel image but got " + gray.channels());
        }
        Mat continuous = gray.isContinuous() ? gray : gray.clone();
        byte[] buffer = new byte[continuous.rows() * continuous.cols()];
        continuous.data().get(buffer);
        return buffer;
    }

    public static Mat fromPixels(byte[] pixels, int width, int height) {
        Mat mat = new Mat(height, width, opencv_core.CV_8UC1);
        mat.data().put(pixels);
        return mat;
    }

    /**
     * Scales so that the longest edge equals {@code longestEdge}, using area averaging when shrinking
     * and bicubic interpolation when enlarging.
     */
    public static Mat resizeToLongestEdge(Mat src, int longestEdge) {
        int longest = Math.max(src.cols(), src.rows());
        if (longest == longestEdge) {
            return src.clone();
        }
        double scale = longestEdge / (double) longest;
        int width = Math.max(1, (int) Math.round(src.cols() * scale));
        int height = Math.max(1, (int) Math.round(src.rows() * scale));
        int interpolation = scale < 1.0 ? opencv_imgproc.INTER_AREA : opencv_imgproc.INTER_CUBIC;
        Mat resized = new Mat();
        opencv_imgproc.resize(src, resized, new Size(width, height), 0, 0, interpolation);
        return resized;
    }

    public static Mat resize(Mat src, int width, int height) {
        if (src.cols() == width && src.rows() == height) {
            return src.clone();
        }
        boolean shrinking = width < src.cols() && height < src.rows();
        Mat resized = new Mat();
        opencv_imgproc.resize(src, resized, new Size(width, height), 0, 0,
                shrinking ? opencv_imgproc.INTER_AREA : opencv_imgproc.INTER_LINEAR);
        return resized;
    }

    /**
     * Fits {@code src} inside {@code width x height} without distorting it and pads the remainder,
     * centred, with {@code fill}.
     */
    public static Mat letterbox(Mat src, int width, int height, Scalar fill) {
        if (src.cols() == width && src.rows() == height) {
            return src.clone();
        }
        double r = Math.min(width / (double) src.cols(), height / (double) src.rows());
        int newWidth = Math.max(1, Math.min(width, (int) Math.round(src.cols() * r)));
        int newHeight = Math.max(1, Math.min(height, (int) Math.round(src.rows() * r)));
        Mat resized = resize(src, newWidth, newHeight);
        int dw = width - newWidth;
        int dh = height - newHeight;
        int top = dh / 2;
        int left = dw / 2;
        Mat bordered = new Mat();
        opencv_core.copyMakeBorder(resized, bordered, top, dh - top, left, dw - left, opencv_core.BORDER_CONSTANT, fill);
        return bordered;
    }

    /**
     * Brings two rasters to a shared shape: the larger extent in each direction, each image
     * letterboxed with {@code fill}. The operation treats both inputs identically, so it is symmetric.
     */
    public static Mat[] alignToCommonShape(Mat a, Mat b, Scalar fill) {
        int width = Math.max(a.cols(), b.cols());
        int height = Math.max(a.rows(), b.rows());
        return new Mat[]{letterbox(a, width, height, fill), letterbox(b, width, height, fill)};
    }

    public static Mat thumbnail(Mat src, int maxSize) {
        double scale = Math.min(maxSize / (double) src.cols(), maxSize / (double) src.rows());
        if (scale >= 1.0) {
            return src.clone();
        }
        int width = Math.max(1, (int) (src.cols() * scale));
        int height = Math.max(1, (int) (src.rows() * scale));
        Mat resized = new Mat();
        opencv_imgproc.resize(src, resized, new Size(width, height), 0, 0, opencv_imgproc.INTER_AREA);
        return resized;
    }
}
