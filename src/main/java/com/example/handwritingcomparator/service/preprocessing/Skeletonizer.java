package com.example.handwritingcomparator.service.preprocessing;

import com.example.handwritingcomparator.util.ImageUtils;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Zhang-Suen thinning. Reduces ink strokes (255 on 0) to one pixel wide centre lines while keeping
 * their connectivity, which is what the stroke width and curvature descriptors walk along.
 */
final class Skeletonizer {

    private Skeletonizer() {
    }

    static Mat thin(Mat binary) {
        int width = binary.cols();
        int height = binary.rows();
        byte[] source = ImageUtils.pixels(binary);
        // one pixel frame of background so that neighbourhood lookups never leave the array
        int stride = width + 2;
        boolean[] ink = new boolean[stride * (height + 2)];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                ink[(y + 1) * stride + x + 1] = source[y * width + x] != 0;
            }
        }

        boolean changed = true;
        boolean[] remove = new boolean[ink.length];
        while (changed) {
            changed = pass(ink, remove, stride, width, height, true);
            changed |= pass(ink, remove, stride, width, height, false);
        }

        byte[] skeleton = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (ink[(y + 1) * stride + x + 1]) {
                    skeleton[y * width + x] = (byte) 255;
                }
            }
        }
        return ImageUtils.fromPixels(skeleton, width, height);
    }

    private static boolean pass(boolean[] ink, boolean[] remove, int stride, int width, int height, boolean first) {
        boolean changed = false;
        for (int y = 1; y <= height; y++) {
            for (int x = 1; x <= width; x++) {
                int i = y * stride + x;
                remove[i] = false;
                if (!ink[i]) {
                    continue;
                }
                // neighbours clockwise from north: P2..P9
                boolean p2 = ink[i - stride];
                boolean p3 = ink[i - stride + 1];
                boolean p4 = ink[i + 1];
                boolean p5 = ink[i + stride + 1];
                boolean p6 = ink[i + stride];
                boolean p7 = ink[i + stride - 1];
                boolean p8 = ink[i - 1];
                boolean p9 = ink[i - stride - 1];

                int neighbours = count(p2) + count(p3) + count(p4) + count(p5)
                        + count(p6) + count(p7) + count(p8) + count(p9);
                if (neighbours < 2 || neighbours > 6) {
                    continue;
                }
                int transitions = transition(p2, p3) + transition(p3, p4) + transition(p4, p5)
                        + transition(p5, p6) + transition(p6, p7) + transition(p7, p8)
                        + transition(p8, p9) + transition(p9, p2);
                if (transitions != 1) {
                    continue;
                }
                boolean deletable = first
                        ? !(p2 && p4 && p6) && !(p4 && p6 && p8)
                        : !(p2 && p4 && p8) && !(p2 && p6 && p8);
                if (deletable) {
                    remove[i] = true;
                    changed = true;
                }
            }
        }
        if (changed) {
            for (int i = 0; i < ink.length; i++) {
                if (remove[i]) {
                    ink[i] = false;
                }
            }
        }
        return changed;
    }

    private static int count(boolean value) {
        return value ? 1 : 0;
    }

    private static int transition(boolean from, boolean to) {
        return !from && to ? 1 : 0;
    }
}
