package com.example.handwritingcomparator.service;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.model.CompositeResult;
import com.example.handwritingcomparator.model.CropRect;
import com.example.handwritingcomparator.model.CropResult;
import com.example.handwritingcomparator.model.FeatureVector;
import com.example.handwritingcomparator.model.ImageSize;
import com.example.handwritingcomparator.model.LocalComparisonResult;
import com.example.handwritingcomparator.model.NormalizedImage;
import com.example.handwritingcomparator.model.OverlayTransform;
import com.example.handwritingcomparator.model.SubScore;
import com.example.handwritingcomparator.service.analysis.AnalysisProvider;
import com.example.handwritingcomparator.service.analysis.AnalysisResult;
import com.example.handwritingcomparator.service.features.FeatureExtractor;
import com.example.handwritingcomparator.service.metrics.FeatureKind;
import com.example.handwritingcomparator.service.metrics.SimilarityMetrics;
import com.example.handwritingcomparator.service.overlay.CropOverlayEngine;
import com.example.handwritingcomparator.service.preprocessing.ImagePreprocessor;
import com.example.handwritingcomparator.service.scoring.CompositeScorer;
import com.example.handwritingcomparator.service.visualization.VisualizationGenerator;
import com.example.handwritingcomparator.util.GeometryTransform;
import com.example.handwritingcomparator.util.ImageUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of the comparison engine. Decodes caller supplied bytes, runs the deterministic
 * pipeline and, when asked, collects the AI opinion on a separate executor so that a slow or
 * failing collaborator only ever costs a warning.
 */
@Service
public class ComparisonService {

    private static final Logger log = LoggerFactory.getLogger(ComparisonService.class);

    private static final int THUMBNAIL_SIZE = 150;
    private static final int THUMBNAIL_QUALITY = 85;

    private final ImagePreprocessor preprocessor;
    private final FeatureExtractor featureExtractor;
    private final SimilarityMetrics metrics;
    private final CompositeScorer scorer;
    private final VisualizationGenerator visualization;
    private final CropOverlayEngine overlayEngine;
    private final AnalysisProvider analysisProvider;
    private final Executor analysisExecutor;
    private final Duration analysisTimeout;

    public ComparisonService(ImagePreprocessor preprocessor,
                             FeatureExtractor featureExtractor,
                             SimilarityMetrics metrics,
                             CompositeScorer scorer,
                             VisualizationGenerator visualization,
                             CropOverlayEngine overlayEngine,
                             AnalysisProvider analysisProvider,
                             @Qualifier("analysisExecutor") Executor analysisExecutor,
                             ComparatorProperties properties) {
        this.preprocessor = preprocessor;
        this.featureExtractor = featureExtractor;
        this.metrics = metrics;
        this.scorer = scorer;
        this.visualization = visualization;
        this.overlayEngine = overlayEngine;
        this.analysisProvider = analysisProvider;
        this.analysisExecutor = analysisExecutor;
        this.analysisTimeout = properties.getAnalysis().getTimeout();
    }

    public CompositeResult compare(byte[] questionedBytes, byte[] knownBytes, boolean useAiAnalysis) {
        Mat questioned = ImageUtils.decode(questionedBytes);
        Mat known = ImageUtils.decode(knownBytes);
        log.info("Comparing questioned {}x{} against known {}x{} (AI analysis: {})",
                questioned.cols(), questioned.rows(), known.cols(), known.rows(), useAiAnalysis);

        List<String> warnings = new ArrayList<>();
        CompletableFuture<Optional<AnalysisResult>> opinion = useAiAnalysis
                ? requestOpinion(questionedBytes, knownBytes, warnings)
                : null;

        NormalizedImage normalizedQuestioned = preprocessor.normalize(questioned);
        NormalizedImage normalizedKnown = preprocessor.normalize(known);
        FeatureVector questionedFeatures = featureExtractor.extract(normalizedQuestioned);
        FeatureVector knownFeatures = featureExtractor.extract(normalizedKnown);

        List<SubScore> subScores = new ArrayList<>(deterministicScores(
                normalizedQuestioned, normalizedKnown, questionedFeatures, knownFeatures));

        String aiAnalysis = null;
        if (opinion != null) {
            Optional<AnalysisResult> result = awaitOpinion(opinion, warnings);
            if (result.isPresent()) {
                aiAnalysis = result.get().analysis();
                if (result.get().hasScore()) {
                    subScores.add(SubScore.of(SubScore.AI_DEEP_ANALYSIS, result.get().score(),
                            "Expert-system opinion from " + result.get().provider()));
                }
            }
        }

        CompositeResult result = scorer.score(subScores)
                .withVisuals(
                        ImageUtils.encodePng(visualization.differenceHeatmap(normalizedQuestioned.gray(), normalizedKnown.gray())),
                        ImageUtils.encodePng(normalizedQuestioned.gray()),
                        ImageUtils.encodePng(normalizedKnown.gray()),
                        ImageUtils.encodePng(normalizedQuestioned.skeleton()),
                        ImageUtils.encodePng(normalizedKnown.skeleton()))
                .withAnalysis(aiAnalysis, warnings);
        log.info("Comparison finished with composite {} ({})", result.compositeScore(), result.verdict());
        return result;
    }

    /**
     * Extracts a region. With a {@code displaySize} the rectangle is in display coordinates and is
     * mapped to source pixels first; without one it is already in source pixels.
     */
    public CropResult cropRegion(byte[] imageBytes, CropRect rect, ImageSize displaySize) {
        Mat image = ImageUtils.decode(imageBytes);
        CropRect sourceRect = displaySize == null
                ? rect
                : GeometryTransform.mapDisplayToSource(rect, displaySize, new ImageSize(image.cols(), image.rows()));
        log.debug("Cropping {} (requested {}) from {}x{}", sourceRect, rect, image.cols(), image.rows());
        return overlayEngine.crop(image, sourceRect);
    }

    public LocalComparisonResult localComparison(byte[] baseBytes, byte[] overlayBytes, OverlayTransform transform) {
        Mat base = ImageUtils.decode(baseBytes);
        Mat overlay = ImageUtils.decode(overlayBytes);
        return overlayEngine.localCompare(base, overlay, transform);
    }

    public byte[] thumbnail(byte[] imageBytes) {
        Mat image = ImageUtils.decode(imageBytes);
        return ImageUtils.encodeJpeg(ImageUtils.thumbnail(image, THUMBNAIL_SIZE), THUMBNAIL_QUALITY);
    }

    public String analysisProviderName() {
        return analysisProvider.name();
    }

    private List<SubScore> deterministicScores(NormalizedImage questioned,
                                               NormalizedImage known,
                                               FeatureVector questionedFeatures,
                                               FeatureVector knownFeatures) {
        return List.of(
                SubScore.of(SubScore.MACRO_GEOMETRY,
                        metrics.featureDistance(questionedFeatures, knownFeatures, FeatureKind.GEOMETRY),
                        String.format(Locale.ROOT, "Slant: %.1f° vs %.1f°, Letter ratio: %.2f vs %.2f, Line spacing: %.2f vs %.2f",
                                questionedFeatures.slantAngle(), knownFeatures.slantAngle(),
                                questionedFeatures.sizeRatio(), knownFeatures.sizeRatio(),
                                questionedFeatures.lineSpacing(), knownFeatures.lineSpacing())),
                SubScore.of(SubScore.STROKE_DISTRIBUTION,
                        metrics.featureDistance(questionedFeatures, knownFeatures, FeatureKind.STROKE_WIDTH),
                        String.format(Locale.ROOT, "Stroke width histogram over %d buckets, branch ratio: %.3f vs %.3f, end ratio: %.3f vs %.3f",
                                questionedFeatures.strokeWidthHistogram().size(),
                                questionedFeatures.branchRatio(), knownFeatures.branchRatio(),
                                questionedFeatures.endRatio(), knownFeatures.endRatio())),
                SubScore.of(SubScore.CURVATURE_MATCH,
                        metrics.featureDistance(questionedFeatures, knownFeatures, FeatureKind.CURVATURE),
                        String.format(Locale.ROOT, "Mean turning angle: %.3f vs %.3f rad, spread: %.3f vs %.3f rad",
                                questionedFeatures.curvature().mean(), knownFeatures.curvature().mean(),
                                questionedFeatures.curvature().standardDeviation(),
                                knownFeatures.curvature().standardDeviation())),
                SubScore.of(SubScore.STRUCTURAL_SIMILARITY,
                        metrics.ssim(questioned.gray(), known.gray()),
                        "SSIM of the normalized specimens"),
                SubScore.of(SubScore.CORRELATION,
                        metrics.crossCorrelation(questioned.gray(), known.gray()),
                        "Normalized cross-correlation of pixel intensities"));
    }

    private CompletableFuture<Optional<AnalysisResult>> requestOpinion(byte[] questioned, byte[] known, List<String> warnings) {
        try {
            return CompletableFuture.supplyAsync(() -> analysisProvider.analyze(questioned, known), analysisExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("AI analysis rejected, executor saturated");
            warnings.add("AI analysis skipped: too many analyses in progress");
            return null;
        }
    }

    private Optional<AnalysisResult> awaitOpinion(CompletableFuture<Optional<AnalysisResult>> opinion, List<String> warnings) {
        try {
            Optional<AnalysisResult> result = opinion.get(analysisTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result.isEmpty()) {
                warnings.add("AI analysis unavailable: no analysis provider configured");
            }
            return result;
        } catch (TimeoutException ex) {
            opinion.cancel(true);
            log.warn("AI analysis timed out after {}", analysisTimeout);
            warnings.add("AI analysis timed out after " + analysisTimeout.toSeconds() + "s");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("AI analysis failed: {}", cause.getMessage(), cause);
            warnings.add("AI analysis failed: " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for AI analysis");
            warnings.add("AI analysis interrupted");
        }
        return Optional.empty();
    }
}
