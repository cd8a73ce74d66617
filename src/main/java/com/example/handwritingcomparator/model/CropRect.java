package com.example.handwritingcomparator.model;

import com.example.handwritingcomparator.exception.GeometryException;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned selection rectangle. Coordinates follow the image pixel grid with the origin in the
 * top-left corner; whether they are display or source pixels depends on where the rectangle came from.
 */
@Schema(description = "Rectangle selected on an image")
public record CropRect(
        @Schema(description = "X coordinate of the top-left corner", example = "50") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "50") int y,
        @Schema(description = "Width in pixels", example = "150") int width,
        @Schema(description = "Height in pixels", example = "100") int height) {

    public CropRect {
        if (width <= 0) {
            throw new GeometryException("Crop width must be positive but was " + width);
        }
        if (height <= 0) {
            throw new GeometryException("Crop height must be positive but was " + height);
        }
    }
}
