package com.example.handwritingcomparator.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Selection made on a displayed image. When {@code displayWidth}/{@code displayHeight} are given the
 * crop coordinates are display pixels and are scaled to the source; otherwise they are source pixels.
 */
public record CropRegionRequest(
        @Schema(description = "Base64 encoded source image", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String imageBase64,
        @Schema(example = "50") @NotNull Integer cropX,
        @Schema(example = "50") @NotNull Integer cropY,
        @Schema(example = "150") @NotNull Integer cropWidth,
        @Schema(example = "100") @NotNull Integer cropHeight,
        @Schema(description = "Width of the image as displayed", example = "500") Integer displayWidth,
        @Schema(description = "Height of the image as displayed", example = "500") Integer displayHeight) {
}
