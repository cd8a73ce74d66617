package com.example.handwritingcomparator.service.visualization;

import com.example.handwritingcomparator.service.metrics.SimilarityMetrics;
import com.example.handwritingcomparator.util.ImageUtils;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.springframework.stereotype.Component;

/**
 * Renders the two explanatory images shown next to the scores. Both take grayscale inputs, align
 * them the same way the metrics do and return a BGR image the size of the aligned pair.
 */
@Component
public class VisualizationGenerator {

    private static final Scalar PAPER = new Scalar(255, 255, 255, 0);
    private static final Size DIFFERENCE_BLUR = new Size(11, 11);

    // BGR
    private static final byte[] FIRST_ONLY = {0, (byte) 200, 0};
    private static final byte[] SECOND_ONLY = {0, 0, (byte) 255};
    private static final byte[] BOTH = {0, (byte) 255, (byte) 255};

    private final SimilarityMetrics metrics;

    public VisualizationGenerator(SimilarityMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * JET false colour of the smoothed absolute difference, stretched to the full range and blended
     * half and half with {@code first}. Red marks the most dissimilar areas.
     */
    public Mat differenceHeatmap(Mat first, Mat second) {
        Mat[] aligned = ImageUtils.alignToCommonShape(first, second, PAPER);
        Mat diff = new Mat();
        opencv_core.absdiff(aligned[0], aligned[1], diff);

        Mat smoothed = new Mat();
        opencv_imgproc.GaussianBlur(diff, smoothed, DIFFERENCE_BLUR, 0);

        Mat stretched = new Mat();
        opencv_core.normalize(smoothed, stretched, 0, 255, opencv_core.NORM_MINMAX, opencv_core.CV_8U, new Mat());

        Mat colored = new Mat();
        opencv_imgproc.applyColorMap(stretched, colored, opencv_imgproc.COLORMAP_JET);

        Mat blended = new Mat();
        opencv_core.addWeighted(ImageUtils.toBgr(aligned[0]), 0.5, colored, 0.5, 0, blended);
        return blended;
    }

    /**
     * Edges of both images on white: green where only {@code first} has an edge, red where only
     * {@code second} has one, yellow where they coincide.
     */
    public Mat edgeVisualization(Mat first, Mat second) {
        Mat[] aligned = ImageUtils.alignToCommonShape(first, second, PAPER);
        byte[] edgesFirst = ImageUtils.pixels(metrics.edges(aligned[0]));
        byte[] edgesSecond = ImageUtils.pixels(metrics.edges(aligned[1]));

        int width = aligned[0].cols();
        int height = aligned[0].rows();
        byte[] bgr = new byte[width * height * 3];
        for (int i = 0; i < edgesFirst.length; i++) {
            boolean inFirst = edgesFirst[i] != 0;
            boolean inSecond = edgesSecond[i] != 0;
            byte[] color;
            if (inFirst && inSecond) {
                color = BOTH;
            } else if (inFirst) {
                color = FIRST_ONLY;
            } else if (inSecond) {
                color = SECOND_ONLY;
            } else {
                bgr[i * 3] = (byte) 255;
                bgr[i * 3 + 1] = (byte) 255;
                bgr[i * 3 + 2] = (byte) 255;
                continue;
            }
            System.arraycopy(color, 0, bgr, i * 3, 3);
        }

        Mat visualization = new Mat(height, width, opencv_core.CV_8UC3);
        visualization.data().put(bgr);
        return visualization;
    }
}
