package com.example.handwritingcomparator.config;

import com.example.handwritingcomparator.model.SubScore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "comparator")
public class ComparatorProperties {

    private Preprocessing preprocessing = new Preprocessing();
    private Features features = new Features();
    private Scoring scoring = new Scoring();
    private Overlay overlay = new Overlay();
    private Analysis analysis = new Analysis();
    private History history = new History();

    public Preprocessing getPreprocessing() {
        return preprocessing;
    }

    public void setPreprocessing(Preprocessing preprocessing) {
        this.preprocessing = preprocessing;
    }

    public Features getFeatures() {
        return features;
    }

    public void setFeatures(Features features) {
        this.features = features;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Overlay getOverlay() {
        return overlay;
    }

    public void setOverlay(Overlay overlay) {
        this.overlay = overlay;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public static class Preprocessing {

        private int canonicalLongestEdge = 512;
        private double claheClipLimit = 2.0;
        private int claheTileSize = 8;
        private int thresholdBlockSize = 21;
        private double thresholdOffset = 10;
        private int medianKernel = 3;
        private double sharpenSigma = 3.0;
        private double sharpenAmount = 0.5;
        private double deskewMinDegrees = 0.5;
        private double deskewMaxDegrees = 15.0;
        private int deskewMinInkPixels = 100;

        public int getCanonicalLongestEdge() {
            return canonicalLongestEdge;
        }

        public void setCanonicalLongestEdge(int canonicalLongestEdge) {
            this.canonicalLongestEdge = canonicalLongestEdge;
        }

        public double getClaheClipLimit() {
            return claheClipLimit;
        }

        public void setClaheClipLimit(double claheClipLimit) {
            this.claheClipLimit = claheClipLimit;
        }

        public int getClaheTileSize() {
            return claheTileSize;
        }

        public void setClaheTileSize(int claheTileSize) {
            this.claheTileSize = claheTileSize;
        }

        public int getThresholdBlockSize() {
            return thresholdBlockSize;
        }

        public void setThresholdBlockSize(int thresholdBlockSize) {
            this.thresholdBlockSize = thresholdBlockSize;
        }

        public double getThresholdOffset() {
            return thresholdOffset;
        }

        public void setThresholdOffset(double thresholdOffset) {
            this.thresholdOffset = thresholdOffset;
        }

        public int getMedianKernel() {
            return medianKernel;
        }

        public void setMedianKernel(int medianKernel) {
            this.medianKernel = medianKernel;
        }

        public double getSharpenSigma() {
            return sharpenSigma;
        }

        public void setSharpenSigma(double sharpenSigma) {
            this.sharpenSigma = sharpenSigma;
        }

        public double getSharpenAmount() {
            return sharpenAmount;
        }

        public void setSharpenAmount(double sharpenAmount) {
            this.sharpenAmount = sharpenAmount;
        }

        public double getDeskewMinDegrees() {
            return deskewMinDegrees;
        }

        public void setDeskewMinDegrees(double deskewMinDegrees) {
            this.deskewMinDegrees = deskewMinDegrees;
        }

        public double getDeskewMaxDegrees() {
            return deskewMaxDegrees;
        }

        public void setDeskewMaxDegrees(double deskewMaxDegrees) {
            this.deskewMaxDegrees = deskewMaxDegrees;
        }

        public int getDeskewMinInkPixels() {
            return deskewMinInkPixels;
        }

        public void setDeskewMinInkPixels(int deskewMinInkPixels) {
            this.deskewMinInkPixels = deskewMinInkPixels;
        }
    }

    public static class Features {

        private int strokeWidthBuckets = 16;
        private int minBlobArea = 12;
        private double slantSaturationDegrees = 30.0;
        private double sizeRatioSaturation = 0.5;
        private double lineSpacingSaturation = 2.0;
        private double curvatureSaturation = 0.5;
        private double connectivitySaturation = 0.02;

        public int getStrokeWidthBuckets() {
            return strokeWidthBuckets;
        }

        public void setStrokeWidthBuckets(int strokeWidthBuckets) {
            this.strokeWidthBuckets = strokeWidthBuckets;
        }

        public int getMinBlobArea() {
            return minBlobArea;
        }

        public void setMinBlobArea(int minBlobArea) {
            this.minBlobArea = minBlobArea;
        }

        public double getSlantSaturationDegrees() {
            return slantSaturationDegrees;
        }

        public void setSlantSaturationDegrees(double slantSaturationDegrees) {
            this.slantSaturationDegrees = slantSaturationDegrees;
        }

        public double getSizeRatioSaturation() {
            return sizeRatioSaturation;
        }

        public void setSizeRatioSaturation(double sizeRatioSaturation) {
            this.sizeRatioSaturation = sizeRatioSaturation;
        }

        public double getLineSpacingSaturation() {
            return lineSpacingSaturation;
        }

        public void setLineSpacingSaturation(double lineSpacingSaturation) {
            this.lineSpacingSaturation = lineSpacingSaturation;
        }

        public double getCurvatureSaturation() {
            return curvatureSaturation;
        }

        public void setCurvatureSaturation(double curvatureSaturation) {
            this.curvatureSaturation = curvatureSaturation;
        }

        public double getConnectivitySaturation() {
            return connectivitySaturation;
        }

        public void setConnectivitySaturation(double connectivitySaturation) {
            this.connectivitySaturation = connectivitySaturation;
        }
    }

    /**
     * Weight and verdict tables. Weights are keyed by sub-score name and must sum to 1.0; the AI
     * sub-score is weighted separately through {@link #aiWeight} and only when
     * {@link #includeAiInComposite} is set.
     */
    public static class Scoring {

        private String tableVersion = "2";
        private Map<String, Double> weights = defaultWeights();
        private double aiWeight = 0.35;
        private boolean includeAiInComposite = false;
        private double matchLikelyThreshold = 88.0;
        private double inconclusiveThreshold = 70.0;

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put(SubScore.MACRO_GEOMETRY, 0.20);
            weights.put(SubScore.STROKE_DISTRIBUTION, 0.20);
            weights.put(SubScore.CURVATURE_MATCH, 0.15);
            weights.put(SubScore.STRUCTURAL_SIMILARITY, 0.25);
            weights.put(SubScore.CORRELATION, 0.20);
            return weights;
        }

        public String getTableVersion() {
            return tableVersion;
        }

        public void setTableVersion(String tableVersion) {
            this.tableVersion = tableVersion;
        }

        public Map<String, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Double> weights) {
            this.weights = weights;
        }

        public double getAiWeight() {
            return aiWeight;
        }

        public void setAiWeight(double aiWeight) {
            this.aiWeight = aiWeight;
        }

        public boolean isIncludeAiInComposite() {
            return includeAiInComposite;
        }

        public void setIncludeAiInComposite(boolean includeAiInComposite) {
            this.includeAiInComposite = includeAiInComposite;
        }

        public double getMatchLikelyThreshold() {
            return matchLikelyThreshold;
        }

        public void setMatchLikelyThreshold(double matchLikelyThreshold) {
            this.matchLikelyThreshold = matchLikelyThreshold;
        }

        public double getInconclusiveThreshold() {
            return inconclusiveThreshold;
        }

        public void setInconclusiveThreshold(double inconclusiveThreshold) {
            this.inconclusiveThreshold = inconclusiveThreshold;
        }
    }

    public static class Overlay {

        private double minScale = 0.25;
        private double maxScale = 3.0;
        private double minAlpha = 0.1;
        private double maxAlpha = 1.0;
        private double cannyLow = 50;
        private double cannyHigh = 150;

        public double getMinScale() {
            return minScale;
        }

        public void setMinScale(double minScale) {
            this.minScale = minScale;
        }

        public double getMaxScale() {
            return maxScale;
        }

        public void setMaxScale(double maxScale) {
            this.maxScale = maxScale;
        }

        public double getMinAlpha() {
            return minAlpha;
        }

        public void setMinAlpha(double minAlpha) {
            this.minAlpha = minAlpha;
        }

        public double getMaxAlpha() {
            return maxAlpha;
        }

        public void setMaxAlpha(double maxAlpha) {
            this.maxAlpha = maxAlpha;
        }

        public double getCannyLow() {
            return cannyLow;
        }

        public void setCannyLow(double cannyLow) {
            this.cannyLow = cannyLow;
        }

        public double getCannyHigh() {
            return cannyHigh;
        }

        public void setCannyHigh(double cannyHigh) {
            this.cannyHigh = cannyHigh;
        }
    }

    public static class Analysis {

        private boolean enabled = false;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o";
        private Duration timeout = Duration.ofSeconds(120);
        private int poolSize = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }

    public static class History {

        private int capacity = 100;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }
}
