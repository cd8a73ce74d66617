package com.example.handwritingcomparator.service.visualization;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.service.metrics.SimilarityMetrics;
import com.example.handwritingcomparator.support.SpecimenImages;
import com.example.handwritingcomparator.util.ImageUtils;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import javax.imageio.ImageIO;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

class VisualizationGeneratorTest {

    private static final int WHITE = 0xFFFFFF;
    private static final int GREEN = 0x00C800;
    private static final int RED = 0xFF0000;
    private static final int YELLOW = 0xFFFF00;

    private final VisualizationGenerator generator = new VisualizationGenerator(new SimilarityMetrics(new ComparatorProperties()));

    private static Mat gray(BufferedImage image) {
        return ImageUtils.toGray(ImageUtils.decode(SpecimenImages.png(image)));
    }

    @Test
    void heatmapCoversAlignedPairInColour() {
        Mat first = gray(SpecimenImages.handwriting(1, 300, 200));
        Mat second = gray(SpecimenImages.handwriting(2, 260, 240));

        Mat heatmap = generator.differenceHeatmap(first, second);

        assertThat(heatmap.cols()).isEqualTo(300);
        assertThat(heatmap.rows()).isEqualTo(240);
        assertThat(heatmap.channels()).isEqualTo(3);
    }

    @Test
    void identicalEdgesAreDrawnInSharedColourOnly() throws IOException {
        Mat specimen = gray(SpecimenImages.handwriting(5, 240, 160));

        Set<Integer> colours = colours(generator.edgeVisualization(specimen, specimen.clone()));

        assertThat(colours).contains(YELLOW).doesNotContain(GREEN, RED);
        assertThat(colours).containsOnly(WHITE, YELLOW);
    }

    @Test
    void edgesMissingFromSecondImageAreGreen() throws IOException {
        Mat specimen = gray(SpecimenImages.handwriting(5, 240, 160));
        Mat blank = gray(SpecimenImages.blank(240, 160));

        assertThat(colours(generator.edgeVisualization(specimen, blank))).containsOnly(WHITE, GREEN);
        assertThat(colours(generator.edgeVisualization(blank, specimen))).containsOnly(WHITE, RED);
    }

    private static Set<Integer> colours(Mat bgr) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(ImageUtils.encodePng(bgr)));
        Set<Integer> colours = new HashSet<>();
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                colours.add(image.getRGB(x, y) & 0xFFFFFF);
            }
        }
        return colours;
    }
}
