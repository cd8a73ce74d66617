package com.example.handwritingcomparator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Fused outcome of one comparison. {@code compositeScore} depends only on the non-AI sub-scores
 * unless the scoring table explicitly weights the AI opinion.
 *
 * @param compositeScore       weighted percentage, one decimal place
 * @param verdict              classification of {@code compositeScore}
 * @param subScores            ordered sub-scores
 * @param tableVersion         version of the weight/threshold table that produced the score
 * @param differenceHeatmap    PNG, may be {@code null} before visuals are attached
 * @param processedQuestioned  PNG of the normalized questioned specimen, may be {@code null}
 * @param processedKnown       PNG of the normalized known specimen, may be {@code null}
 * @param skeletonQuestioned   PNG of the questioned stroke skeleton (white on black), may be {@code null}
 * @param skeletonKnown        PNG of the known stroke skeleton (white on black), may be {@code null}
 * @param aiAnalysis           free text from the AI collaborator, or {@code null}
 * @param warnings             soft failures encountered on the way
 */
public record CompositeResult(
        double compositeScore,
        Verdict verdict,
        List<SubScore> subScores,
        String tableVersion,
        byte[] differenceHeatmap,
        byte[] processedQuestioned,
        byte[] processedKnown,
        byte[] skeletonQuestioned,
        byte[] skeletonKnown,
        String aiAnalysis,
        List<String> warnings) {

    public CompositeResult {
        subScores = List.copyOf(subScores);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public CompositeResult withVisuals(byte[] heatmap, byte[] questioned, byte[] known,
                                       byte[] questionedSkeleton, byte[] knownSkeleton) {
        return new CompositeResult(compositeScore, verdict, subScores, tableVersion, heatmap, questioned, known,
                questionedSkeleton, knownSkeleton, aiAnalysis, warnings);
    }

    public CompositeResult withAnalysis(String analysis, List<String> extraWarnings) {
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extraWarnings);
        return new CompositeResult(compositeScore, verdict, subScores, tableVersion, differenceHeatmap,
                processedQuestioned, processedKnown, skeletonQuestioned, skeletonKnown, analysis, merged);
    }
}
