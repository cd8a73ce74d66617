package com.example.handwritingcomparator.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record ComparisonRequest(
        @Schema(description = "Base64 encoded questioned document, optionally as a data URL", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String questionedImage,
        @Schema(description = "Base64 encoded known reference sample, optionally as a data URL", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String knownImage,
        @Schema(description = "Whether to request an AI expert opinion", defaultValue = "false")
        Boolean useAiAnalysis) {

    public boolean aiRequested() {
        return Boolean.TRUE.equals(useAiAnalysis);
    }
}
