package com.example.handwritingcomparator.service.scoring;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.exception.ConfigurationException;
import com.example.handwritingcomparator.model.CompositeResult;
import com.example.handwritingcomparator.model.SubScore;
import com.example.handwritingcomparator.model.Verdict;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fuses sub-scores into a weighted percentage and classifies it against a versioned threshold
 * table. The table is validated once, at construction, so a bad configuration stops the
 * application from starting instead of producing odd verdicts later.
 *
 * <p>The AI sub-score is advisory: it is carried through in the result but ignored by the
 * weighting unless {@code include-ai-in-composite} is set. In that case it receives
 * {@code ai-weight} and the deterministic weights are scaled by {@code 1 - ai-weight}.
 */
@Component
public class CompositeScorer {

    private static final Logger log = LoggerFactory.getLogger(CompositeScorer.class);
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private final Map<String, Double> weights;
    private final String tableVersion;
    private final double aiWeight;
    private final boolean includeAi;
    private final double matchLikelyThreshold;
    private final double inconclusiveThreshold;

    public CompositeScorer(ComparatorProperties properties) {
        ComparatorProperties.Scoring scoring = properties.getScoring();
        this.weights = validateWeights(scoring.getWeights());
        this.tableVersion = scoring.getTableVersion();
        this.aiWeight = scoring.getAiWeight();
        this.includeAi = scoring.isIncludeAiInComposite();
        this.matchLikelyThreshold = scoring.getMatchLikelyThreshold();
        this.inconclusiveThreshold = scoring.getInconclusiveThreshold();

        if (aiWeight < 0.0 || aiWeight > 1.0) {
            throw new ConfigurationException("AI weight must lie in [0, 1] but was " + aiWeight);
        }
        if (inconclusiveThreshold < 0.0 || matchLikelyThreshold > 100.0 || inconclusiveThreshold > matchLikelyThreshold) {
            throw new ConfigurationException("Verdict thresholds must satisfy 0 <= inconclusive <= match-likely <= 100 but were "
                    + inconclusiveThreshold + " and " + matchLikelyThreshold);
        }
        log.info("Scoring table v{} loaded (include AI in composite: {})", tableVersion, includeAi);
    }

    public CompositeResult score(List<SubScore> subScores) {
        if (subScores == null || subScores.isEmpty()) {
            throw new ConfigurationException("Cannot score an empty sub-score sequence");
        }

        boolean aiWeighted = includeAi && subScores.stream().anyMatch(SubScore::isAiDerived);
        double deterministicShare = aiWeighted ? 1.0 - aiWeight : 1.0;

        Set<String> seen = new HashSet<>();
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (SubScore subScore : subScores) {
            if (!seen.add(subScore.name())) {
                throw new ConfigurationException("Duplicate sub-score " + subScore.name());
            }
            double weight;
            if (subScore.isAiDerived()) {
                weight = aiWeighted ? aiWeight : 0.0;
            } else {
                Double configured = weights.get(subScore.name());
                if (configured == null) {
                    throw new ConfigurationException("No weight configured for sub-score " + subScore.name());
                }
                weight = configured * deterministicShare;
            }
            weightedSum += weight * subScore.score();
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            throw new ConfigurationException("None of the supplied sub-scores carries a weight");
        }

        // renormalise over the sub-scores actually present
        double composite = SubScore.round(weightedSum / totalWeight);
        Verdict verdict = classify(composite);
        log.debug("Composite {} -> {} from {} sub-scores", composite, verdict, subScores.size());
        return new CompositeResult(composite, verdict, subScores, tableVersion, null, null, null, null, null, null, List.of());
    }

    public Verdict classify(double composite) {
        if (composite >= matchLikelyThreshold) {
            return Verdict.MATCH_LIKELY;
        }
        if (composite >= inconclusiveThreshold) {
            return Verdict.INCONCLUSIVE;
        }
        return Verdict.MATCH_UNLIKELY;
    }

    private static Map<String, Double> validateWeights(Map<String, Double> configured) {
        if (configured == null || configured.isEmpty()) {
            throw new ConfigurationException("Scoring weight table is empty");
        }
        double total = 0.0;
        for (Map.Entry<String, Double> entry : configured.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || weight < 0.0) {
                throw new ConfigurationException("Weight for " + entry.getKey() + " must be non-negative but was " + weight);
            }
            if (SubScore.AI_DEEP_ANALYSIS.equals(entry.getKey())) {
                throw new ConfigurationException("The AI sub-score is weighted through ai-weight, not the weight table");
            }
            total += weight;
        }
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException("Scoring weights must sum to 1.0 but sum to " + total);
        }
        return new LinkedHashMap<>(configured);
    }
}
