package com.example.handwritingcomparator.service.overlay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.GeometryException;
import com.example.handwritingcomparator.model.CropRect;
import com.example.handwritingcomparator.model.CropResult;
import com.example.handwritingcomparator.model.LocalComparisonResult;
import com.example.handwritingcomparator.model.OverlayTransform;
import com.example.handwritingcomparator.service.metrics.SimilarityMetrics;
import com.example.handwritingcomparator.service.preprocessing.ImagePreprocessor;
import com.example.handwritingcomparator.service.visualization.VisualizationGenerator;
import com.example.handwritingcomparator.support.SpecimenImages;
import com.example.handwritingcomparator.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.junit.jupiter.api.Test;

class CropOverlayEngineTest {

    private final ComparatorProperties properties = new ComparatorProperties();
    private final SimilarityMetrics metrics = new SimilarityMetrics(properties);
    private final CropOverlayEngine engine = new CropOverlayEngine(
            new ImagePreprocessor(properties), metrics, new VisualizationGenerator(metrics), properties);

    private final Mat base = ImageUtils.decode(SpecimenImages.png(SpecimenImages.handwriting(11, 400, 300)));

    @Test
    void cropReturnsTransparentAndSolidRenderings() throws IOException {
        CropResult result = engine.crop(base, new CropRect(40, 30, 120, 90));

        assertThat(result.width()).isEqualTo(120);
        assertThat(result.height()).isEqualTo(90);
        assertThat(result.originalX()).isEqualTo(40);
        assertThat(result.originalY()).isEqualTo(30);

        BufferedImage transparent = read(result.croppedTransparent());
        BufferedImage solid = read(result.croppedSolid());
        assertThat(transparent.getWidth()).isEqualTo(120);
        assertThat(transparent.getHeight()).isEqualTo(90);
        assertThat(transparent.getColorModel().hasAlpha()).isTrue();
        assertThat(solid.getColorModel().hasAlpha()).isFalse();
    }

    @Test
    void paperBecomesTransparentInCrop() throws IOException {
        Mat blank = ImageUtils.decode(SpecimenImages.png(SpecimenImages.blank(50, 50)));

        BufferedImage transparent = read(engine.crop(blank, new CropRect(0, 0, 20, 20)).croppedTransparent());

        assertThat(transparent.getRGB(10, 10) >>> 24).isZero();
    }

    @Test
    void cropIsClampedToImageBounds() {
        CropResult result = engine.crop(base, new CropRect(350, 280, 100, 100));

        assertThat(result.originalX()).isEqualTo(350);
        assertThat(result.originalY()).isEqualTo(280);
        assertThat(result.width()).isEqualTo(50);
        assertThat(result.height()).isEqualTo(20);
    }

    @Test
    void overlayCutFromBaseMatchesRegionBeneathIt() {
        Mat overlay = new Mat(base, new Rect(50, 50, 200, 150)).clone();

        LocalComparisonResult result = engine.localCompare(base, overlay, OverlayTransform.translation(50, 50));

        assertThat(result.regionX()).isEqualTo(50);
        assertThat(result.regionY()).isEqualTo(50);
        assertThat(result.regionWidth()).isEqualTo(200);
        assertThat(result.regionHeight()).isEqualTo(150);
        assertThat(result.localSsim()).isGreaterThan(90.0);
        assertThat(result.edgeOverlap()).isGreaterThan(90.0);
        assertThat(result.differenceHeatmap()).isNotEmpty();
        assertThat(result.edgeVisualization()).isNotEmpty();
    }

    @Test
    void misplacedOverlayScoresLowerThanAlignedOne() {
        Mat overlay = new Mat(base, new Rect(50, 50, 200, 150)).clone();

        double aligned = engine.localCompare(base, overlay, OverlayTransform.translation(50, 50)).edgeOverlap();
        double shifted = engine.localCompare(base, overlay, OverlayTransform.translation(120, 20)).edgeOverlap();

        assertThat(shifted).isLessThan(aligned);
    }

    @Test
    void scaleIsClampedAndRegionFitsInsideBase() {
        Mat overlay = new Mat(base, new Rect(0, 0, 200, 150)).clone();

        LocalComparisonResult result = engine.localCompare(base, overlay,
                new OverlayTransform(0, 0, 10.0, 0.0, 1.0, null, null));

        // 3x of 200x150 exceeds the 400x300 base
        assertThat(result.regionWidth()).isEqualTo(400);
        assertThat(result.regionHeight()).isEqualTo(300);
        assertThat(result.regionX()).isZero();
        assertThat(result.regionY()).isZero();
    }

    @Test
    void translationIsClampedIntoBase() {
        Mat overlay = new Mat(base, new Rect(0, 0, 100, 100)).clone();

        LocalComparisonResult result = engine.localCompare(base, overlay, OverlayTransform.translation(1000, -40));

        assertThat(result.regionX()).isEqualTo(300);
        assertThat(result.regionY()).isZero();
        assertThat(result.regionWidth()).isEqualTo(100);
    }

    @Test
    void rotatedOverlayKeepsRegionSize() {
        Mat overlay = new Mat(base, new Rect(100, 100, 120, 80)).clone();

        LocalComparisonResult result = engine.localCompare(base, overlay,
                new OverlayTransform(100, 100, 1.0, 15.0, 0.5, null, null));

        assertThat(result.regionWidth()).isEqualTo(120);
        assertThat(result.regionHeight()).isEqualTo(80);
        assertThat(result.localSsim()).isBetween(0.0, 100.0);
    }

    @Test
    void explicitNonPositiveExtentIsRejected() {
        Mat overlay = new Mat(base, new Rect(0, 0, 100, 100)).clone();

        assertThatThrownBy(() -> engine.localCompare(base, overlay,
                new OverlayTransform(0, 0, 1.0, 0.0, 1.0, 0, 50)))
                .isInstanceOf(GeometryException.class);
    }

    private static BufferedImage read(byte[] png) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(png));
    }
}
