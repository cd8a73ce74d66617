package com.example.handwritingcomparator.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Summary of a stored comparison")
public record HistoryEntry(
        String id,
        Instant timestamp,
        double compositeScore,
        String verdict,
        String verdictColor,
        @Schema(description = "Base64 JPEG thumbnail of the questioned document")
        String questionedThumb,
        @Schema(description = "Base64 JPEG thumbnail of the known sample")
        String knownThumb) {

    public static HistoryEntry from(ComparisonResponse response) {
        return new HistoryEntry(
                response.id(),
                response.timestamp(),
                response.compositeScore(),
                response.verdict(),
                response.verdictColor(),
                response.questionedImageThumb(),
                response.knownImageThumb());
    }
}
