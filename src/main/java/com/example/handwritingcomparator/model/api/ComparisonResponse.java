package com.example.handwritingcomparator.model.api;

import com.example.handwritingcomparator.model.CompositeResult;
import com.example.handwritingcomparator.model.SubScore;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.Base64;
import java.util.List;

@Schema(description = "Outcome of a full specimen comparison")
public record ComparisonResponse(
        @Schema(description = "Identifier under which the comparison is kept in history")
        String id,
        Instant timestamp,
        @Schema(description = "Base64 JPEG thumbnail of the questioned document")
        String questionedImageThumb,
        @Schema(description = "Base64 JPEG thumbnail of the known sample")
        String knownImageThumb,
        @Schema(description = "Base64 PNG of the normalized questioned document")
        String processedQuestioned,
        @Schema(description = "Base64 PNG of the normalized known sample")
        String processedKnown,
        @Schema(description = "Base64 PNG of the questioned stroke skeleton, white centre lines on black")
        String skeletonQuestioned,
        @Schema(description = "Base64 PNG of the known stroke skeleton, white centre lines on black")
        String skeletonKnown,
        @Schema(description = "Base64 PNG difference heatmap, red marks the largest differences")
        String differenceHeatmap,
        @Schema(description = "Weighted similarity in percent", example = "91.4")
        double compositeScore,
        List<SubScore> subScores,
        @Schema(description = "Human readable verdict", example = "High probability same writer")
        String verdict,
        @Schema(description = "Display colour of the verdict", example = "#22c55e")
        String verdictColor,
        @Schema(description = "Machine readable verdict", example = "MATCH_LIKELY")
        String verdictCode,
        @Schema(description = "Free text opinion of the AI collaborator, when requested and available")
        String aiAnalysis,
        @Schema(description = "Soft failures, e.g. an AI analysis that timed out")
        List<String> warnings,
        @Schema(description = "Version of the weight and threshold table", example = "2")
        String scoreTableVersion) {

    public static ComparisonResponse from(String id,
                                          Instant timestamp,
                                          CompositeResult result,
                                          byte[] questionedThumb,
                                          byte[] knownThumb) {
        return new ComparisonResponse(
                id,
                timestamp,
                encode(questionedThumb),
                encode(knownThumb),
                encode(result.processedQuestioned()),
                encode(result.processedKnown()),
                encode(result.skeletonQuestioned()),
                encode(result.skeletonKnown()),
                encode(result.differenceHeatmap()),
                result.compositeScore(),
                result.subScores(),
                result.verdict().label(),
                result.verdict().color(),
                result.verdict().name(),
                result.aiAnalysis(),
                result.warnings(),
                result.tableVersion());
    }

    static String encode(byte[] image) {
        return image == null ? null : Base64.getEncoder().encodeToString(image);
    }
}
