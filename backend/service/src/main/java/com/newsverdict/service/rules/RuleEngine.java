package com.newsverdict.service.rules;

import java.util.EnumMap;
import java.util.Map;

public class RuleEngine {
    private static final int PROFESSIONAL_INDICATORS = 5;

    public RuleSignal evaluate(String rawText) {
        String text = rawText == null ? "" : rawText;
        String lower = RuleCheck.lower(text);
        Map<RuleCheck, Double> contributions = new EnumMap<>(RuleCheck.class);
        double sum = 0.0;
        for (RuleCheck check : RuleCheck.values()) {
            double weight = check.weight(text, lower);
            contributions.put(check, weight);
            sum += weight;
        }
        double adjustment = Math.max(-1.0, Math.min(1.0, sum));
        return new RuleSignal(adjustment, professionalScore(text, lower), contributions);
    }

    static double professionalScore(String text, String lower) {
        int present = 0;
        if (RuleCheck.hasAttribution(lower)) {
            present++;
        }
        if (RuleCheck.mentionsCredibleSource(lower)) {
            present++;
        }
        if (RuleCheck.DIGIT.matcher(text).find()) {
            present++;
        }
        if (RuleCheck.PROPER_NOUN.matcher(text).find()) {
            present++;
        }
        if (!text.contains("!!")) {
            present++;
        }
        return (double) present / PROFESSIONAL_INDICATORS;
    }
}
