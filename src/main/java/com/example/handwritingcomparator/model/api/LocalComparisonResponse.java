package com.example.handwritingcomparator.model.api;

import com.example.handwritingcomparator.model.LocalComparisonResult;
import io.swagger.v3.oas.annotations.media.Schema;

public record LocalComparisonResponse(
        @Schema(description = "SSIM of the aligned regions in percent") double localSsim,
        @Schema(description = "Edge intersection over union in percent") double edgeOverlap,
        @Schema(description = "Base64 PNG difference heatmap") String differenceHeatmap,
        @Schema(description = "Base64 PNG, base edges green, overlay edges red, shared edges yellow") String edgeVisualization,
        int regionWidth,
        int regionHeight,
        int regionX,
        int regionY) {

    public static LocalComparisonResponse from(LocalComparisonResult result) {
        return new LocalComparisonResponse(
                result.localSsim(),
                result.edgeOverlap(),
                ComparisonResponse.encode(result.differenceHeatmap()),
                ComparisonResponse.encode(result.edgeVisualization()),
                result.regionWidth(),
                result.regionHeight(),
                result.regionX(),
                result.regionY());
    }
}
