package com.example.handwritingcomparator.model;

/**
 * Region extracted at native resolution. {@code croppedTransparent} is a PNG with alpha (paper made
 * transparent), {@code croppedSolid} the same pixels on an opaque background.
 */
public record CropResult(
        byte[] croppedTransparent,
        byte[] croppedSolid,
        int width,
        int height,
        int originalX,
        int originalY) {
}
