package com.example.handwritingcomparator.model;

/**
 * Immutable snapshot of the user's overlay alignment. The region size defaults to the overlay
 * dimensions multiplied by {@code scale} when {@code width}/{@code height} are absent.
 *
 * @param translateX      left edge of the overlay on the base image, in base pixels
 * @param translateY      top edge of the overlay on the base image, in base pixels
 * @param scale           uniform scale applied to the overlay
 * @param rotationDegrees clockwise rotation as seen on screen
 * @param alpha           overlay opacity, informational for rendering
 * @param width           explicit region width, or {@code null}
 * @param height          explicit region height, or {@code null}
 */
public record OverlayTransform(
        double translateX,
        double translateY,
        double scale,
        double rotationDegrees,
        double alpha,
        Integer width,
        Integer height) {

    public static OverlayTransform translation(double translateX, double translateY) {
        return new OverlayTransform(translateX, translateY, 1.0, 0.0, 1.0, null, null);
    }
}
