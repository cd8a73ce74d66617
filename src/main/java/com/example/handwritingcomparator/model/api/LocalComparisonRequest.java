package com.example.handwritingcomparator.model.api;

import com.example.handwritingcomparator.model.OverlayTransform;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LocalComparisonRequest(
        @Schema(description = "Base64 encoded base image", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String baseImage,
        @Schema(description = "Base64 encoded overlay fragment", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String overlayImage,
        @Schema(description = "Left edge of the overlay on the base image", example = "50") @NotNull Double overlayX,
        @Schema(description = "Top edge of the overlay on the base image", example = "50") @NotNull Double overlayY,
        @Schema(description = "Region width, defaults to the scaled overlay width") Integer overlayWidth,
        @Schema(description = "Region height, defaults to the scaled overlay height") Integer overlayHeight,
        @Schema(description = "Uniform scale, clamped to [0.25, 3]", defaultValue = "1.0") Double overlayScale,
        @Schema(description = "Clockwise rotation in degrees, clamped to [-180, 180]", defaultValue = "0") Double overlayRotation,
        @Schema(description = "Overlay opacity, clamped to [0.1, 1]", defaultValue = "1.0") Double overlayAlpha) {

    public OverlayTransform toTransform() {
        return new OverlayTransform(
                overlayX,
                overlayY,
                overlayScale != null ? overlayScale : 1.0,
                overlayRotation != null ? overlayRotation : 0.0,
                overlayAlpha != null ? overlayAlpha : 1.0,
                overlayWidth,
                overlayHeight);
    }
}
