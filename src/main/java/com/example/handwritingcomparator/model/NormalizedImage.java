package com.example.handwritingcomparator.model;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Canonically scaled, contrast normalized specimen. {@code gray} feeds the pixel metrics,
 * {@code binary} (ink = 255) feeds the stroke features and {@code skeleton} holds its one pixel wide
 * centre lines. All three share the same dimensions.
 */
public record NormalizedImage(Mat gray, Mat binary, Mat skeleton, int sourceWidth, int sourceHeight) {

    public int width() {
        return gray.cols();
    }

    public int height() {
        return gray.rows();
    }
}
