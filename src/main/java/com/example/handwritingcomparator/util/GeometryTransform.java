package com.example.handwritingcomparator.util;

import com.example.handwritingcomparator.exception.GeometryException;
import com.example.handwritingcomparator.model.CropRect;
import com.example.handwritingcomparator.model.ImageSize;
import com.example.handwritingcomparator.model.PixelPoint;

/**
 * Maps coordinates picked on a displayed (scaled or letterboxed) image back to the native pixel grid.
 * X and Y are scaled independently by {@code source / display} and rounded to the nearest pixel.
 */
public final class GeometryTransform {

    private GeometryTransform() {
    }

    public static PixelPoint mapDisplayToSource(double x, double y, ImageSize displaySize, ImageSize sourceSize) {
        double scaleX = scaleX(displaySize, sourceSize);
        double scaleY = scaleY(displaySize, sourceSize);
        return new PixelPoint((int) Math.round(x * scaleX), (int) Math.round(y * scaleY));
    }

    public static CropRect mapDisplayToSource(CropRect rect, ImageSize displaySize, ImageSize sourceSize) {
        double scaleX = scaleX(displaySize, sourceSize);
        double scaleY = scaleY(displaySize, sourceSize);
        int x = (int) Math.round(rect.x() * scaleX);
        int y = (int) Math.round(rect.y() * scaleY);
        int width = Math.max(1, (int) Math.round(rect.width() * scaleX));
        int height = Math.max(1, (int) Math.round(rect.height() * scaleY));
        return new CropRect(x, y, width, height);
    }

    /**
     * Shrinks and shifts {@code rect} so that it lies inside {@code bounds}. Never fails for a
     * rectangle with positive size; the result is at least one pixel in each direction.
     */
    public static CropRect clamp(CropRect rect, ImageSize bounds) {
        requirePositive(bounds, "Image");
        int x = clamp(rect.x(), 0, bounds.width() - 1);
        int y = clamp(rect.y(), 0, bounds.height() - 1);
        int right = clamp(rect.x() + rect.width(), x + 1, bounds.width());
        int bottom = clamp(rect.y() + rect.height(), y + 1, bounds.height());
        return new CropRect(x, y, right - x, bottom - y);
    }

    private static double scaleX(ImageSize displaySize, ImageSize sourceSize) {
        requirePositive(displaySize, "Display");
        requirePositive(sourceSize, "Source");
        return sourceSize.width() / (double) displaySize.width();
    }

    private static double scaleY(ImageSize displaySize, ImageSize sourceSize) {
        requirePositive(displaySize, "Display");
        requirePositive(sourceSize, "Source");
        return sourceSize.height() / (double) displaySize.height();
    }

    private static void requirePositive(ImageSize size, String label) {
        if (size == null || size.width() <= 0 || size.height() <= 0) {
            throw new GeometryException(label + " size must be positive but was " + size);
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
