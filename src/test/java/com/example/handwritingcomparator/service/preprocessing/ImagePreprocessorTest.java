package com.example.handwritingcomparator.service.preprocessing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.ConfigurationException;
import com.example.handwritingcomparator.exception.ImageDecodeException;
import com.example.handwritingcomparator.model.NormalizedImage;
import com.example.handwritingcomparator.support.SpecimenImages;
import com.example.handwritingcomparator.util.ImageUtils;
import java.util.function.Consumer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

class ImagePreprocessorTest {

    private final ImagePreprocessor preprocessor = new ImagePreprocessor(new ComparatorProperties());

    @Test
    void rescalesToCanonicalLongestEdge() {
        NormalizedImage normalized = preprocessor.normalize(SpecimenImages.png(SpecimenImages.handwriting(7, 1024, 512)));

        assertThat(normalized.width()).isEqualTo(512);
        assertThat(normalized.height()).isEqualTo(256);
        assertThat(normalized.sourceWidth()).isEqualTo(1024);
        assertThat(normalized.sourceHeight()).isEqualTo(512);
        assertThat(normalized.gray().channels()).isEqualTo(1);
        assertThat(normalized.binary().cols()).isEqualTo(normalized.gray().cols());
        assertThat(normalized.binary().rows()).isEqualTo(normalized.gray().rows());
    }

    @Test
    void marksInkAsForegroundInBinaryPlane() {
        NormalizedImage handwriting = preprocessor.normalize(SpecimenImages.png(SpecimenImages.handwriting(7, 512, 384)));
        NormalizedImage blank = preprocessor.normalize(SpecimenImages.png(SpecimenImages.blank(512, 384)));

        int inkPixels = opencv_core.countNonZero(handwriting.binary());
        assertThat(inkPixels).isPositive();
        assertThat(inkPixels).isLessThan(512 * 384 / 2);
        assertThat(opencv_core.countNonZero(blank.binary())).isZero();
    }

    @Test
    void sameBytesYieldIdenticalPixels() {
        byte[] specimen = SpecimenImages.png(SpecimenImages.handwriting(11, 640, 480));

        NormalizedImage first = preprocessor.normalize(specimen);
        NormalizedImage second = preprocessor.normalize(specimen);

        assertThat(ImageUtils.pixels(first.gray())).isEqualTo(ImageUtils.pixels(second.gray()));
        assertThat(ImageUtils.pixels(first.binary())).isEqualTo(ImageUtils.pixels(second.binary()));
    }

    @Test
    void regionNormalizationKeepsNativeSize() {
        var region = ImageUtils.decode(SpecimenImages.png(SpecimenImages.handwriting(3, 200, 150)));

        var normalized = preprocessor.normalizeRegion(region);

        assertThat(normalized.cols()).isEqualTo(200);
        assertThat(normalized.rows()).isEqualTo(150);
        assertThat(normalized.channels()).isEqualTo(1);
    }

    @Test
    void skeletonIsThinnedFromBinaryPlane() {
        NormalizedImage normalized = preprocessor.normalize(SpecimenImages.png(SpecimenImages.handwriting(7, 512, 384)));

        int skeletonPixels = opencv_core.countNonZero(normalized.skeleton());
        assertThat(normalized.skeleton().cols()).isEqualTo(normalized.binary().cols());
        assertThat(normalized.skeleton().rows()).isEqualTo(normalized.binary().rows());
        assertThat(skeletonPixels).isPositive().isLessThan(opencv_core.countNonZero(normalized.binary()));
    }

    @Test
    void smallPageRotationIsUndone() {
        byte[] tilted = SpecimenImages.png(SpecimenImages.rotatedLines(512, 384, 5, 4f, 6.0));
        Mat raw = ImageUtils.toGray(ImageUtils.decode(tilted));
        Mat rawInk = new Mat();
        opencv_imgproc.threshold(raw, rawInk, 128, 255, opencv_imgproc.THRESH_BINARY_INV);

        NormalizedImage normalized = preprocessor.normalize(tilted);

        assertThat(ImagePreprocessor.skewAngle(rawInk, 100)).isCloseTo(6.0, within(1.5));
        assertThat(Math.abs(ImagePreprocessor.skewAngle(normalized.binary(), 100))).isLessThan(1.0);
        assertThat(normalized.width()).isEqualTo(512);
        assertThat(normalized.height()).isEqualTo(384);
    }

    @Test
    void largeRotationIsLeftAlone() {
        NormalizedImage normalized = preprocessor.normalize(
                SpecimenImages.png(SpecimenImages.rotatedLines(512, 384, 5, 4f, 20.0)));

        assertThat(ImagePreprocessor.skewAngle(normalized.binary(), 100)).isCloseTo(20.0, within(1.5));
    }

    @Test
    void skewOfSparseInkIsZero() {
        byte[] pixels = new byte[100 * 100];
        pixels[5050] = (byte) 255;

        assertThat(ImagePreprocessor.skewAngle(ImageUtils.fromPixels(pixels, 100, 100), 100)).isZero();
    }

    @Test
    void rejectsEvenOrDegenerateFilterSizes() {
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setThresholdBlockSize(20))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("threshold-block-size");
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setThresholdBlockSize(1))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setMedianKernel(4))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("median-kernel");
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setMedianKernel(0))))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsNonPositiveScaleAndContrastSettings() {
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setCanonicalLongestEdge(0))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("canonical-longest-edge");
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setClaheTileSize(0))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setClaheClipLimit(-1.0))))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new ImagePreprocessor(properties(p -> p.setDeskewMaxDegrees(0.1))))
                .isInstanceOf(ConfigurationException.class);
    }

    private static ComparatorProperties properties(Consumer<ComparatorProperties.Preprocessing> customizer) {
        ComparatorProperties properties = new ComparatorProperties();
        customizer.accept(properties.getPreprocessing());
        return properties;
    }

    @Test
    void undecodablePayloadRaisesImageDecodeException() {
        assertThatThrownBy(() -> preprocessor.normalize(new byte[]{1, 2, 3, 4}))
                .isInstanceOf(ImageDecodeException.class);
    }
}
