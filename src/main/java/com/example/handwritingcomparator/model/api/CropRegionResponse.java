package com.example.handwritingcomparator.model.api;

import com.example.handwritingcomparator.model.CropResult;
import io.swagger.v3.oas.annotations.media.Schema;

public record CropRegionResponse(
        @Schema(description = "Base64 PNG with transparent paper")
        String croppedImage,
        @Schema(description = "Base64 PNG on an opaque background")
        String croppedSolid,
        int width,
        int height,
        @Schema(description = "Left edge of the region in source pixels")
        int originalX,
        @Schema(description = "Top edge of the region in source pixels")
        int originalY) {

    public static CropRegionResponse from(CropResult result) {
        return new CropRegionResponse(
                ComparisonResponse.encode(result.croppedTransparent()),
                ComparisonResponse.encode(result.croppedSolid()),
                result.width(),
                result.height(),
                result.originalX(),
                result.originalY());
    }
}
