package com.newsverdict.service.decision;

import com.newsverdict.core.model.Label;
import com.newsverdict.core.model.Language;
import com.newsverdict.core.model.Regime;
import com.newsverdict.core.model.Reliability;
import com.newsverdict.core.model.Verdict;

import java.util.Objects;

/**
 * Merges model probability, rule adjustment and professional score into a {@link Verdict}.
 *
 * <p>When the model was not consulted, or the text was detected as Hindi or Gujarati, only the rules
 * decide: negative adjustment means Fake and confidence is capped at 75.
 * Otherwise the final score is {@code p - adj*0.6 - prof*0.2} clamped to [0,1]; above 0.5 is Fake,
 * 0.5 and below is Real, and confidence is the distance from 0.5 scaled to [50,100].
 */
public class DecisionCombiner {
    static final double RULE_WEIGHT = 0.6;
    static final double PROFESSIONAL_WEIGHT = 0.2;
    static final double RULES_ONLY_CONFIDENCE_CAP = 75.0;

    public Verdict combine(
            Double fabricationProbability,
            double ruleAdjustment,
            double professionalScore,
            Language detectedLanguage
    ) {
        Objects.requireNonNull(detectedLanguage, "detectedLanguage is required");
        double adjustment = clamp(ruleAdjustment, -1.0, 1.0, 0.0);
        double professional = clamp(professionalScore, 0.0, 1.0, 0.0);

        if (fabricationProbability == null || !detectedLanguage.isScoredDirectly()) {
            Label label = adjustment < 0.0 ? Label.FAKE : Label.REAL;
            double confidence = round2(Math.min(50.0 + Math.abs(adjustment) * 50.0, RULES_ONLY_CONFIDENCE_CAP));
            return new Verdict(label, confidence, Reliability.fromConfidence(confidence), detectedLanguage, Regime.RULES_ONLY);
        }

        double probability = clamp(fabricationProbability, 0.0, 1.0, 0.5);
        double finalScore = finalScore(probability, adjustment, professional);
        Label label = finalScore > 0.5 ? Label.FAKE : Label.REAL;
        double confidence = round2(50.0 + Math.abs(finalScore - 0.5) * 100.0);
        return new Verdict(label, confidence, Reliability.fromConfidence(confidence), detectedLanguage, Regime.MODEL_BACKED);
    }

    static double finalScore(double probability, double adjustment, double professional) {
        return clamp(probability - adjustment * RULE_WEIGHT - professional * PROFESSIONAL_WEIGHT, 0.0, 1.0, 0.5);
    }

    private static double clamp(double value, double min, double max, double ifNaN) {
        if (Double.isNaN(value)) {
            return ifNaN;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
