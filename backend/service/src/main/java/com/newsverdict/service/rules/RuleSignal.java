package com.newsverdict.service.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record RuleSignal(double ruleAdjustment, double professionalScore, Map<RuleCheck, Double> contributions) {
    public RuleSignal {
        if (ruleAdjustment < -1.0 || ruleAdjustment > 1.0) {
            throw new IllegalArgumentException("ruleAdjustment must be within [-1,1]");
        }
        if (professionalScore < 0.0 || professionalScore > 1.0) {
            throw new IllegalArgumentException("professionalScore must be within [0,1]");
        }
        contributions = contributions == null || contributions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(contributions));
    }
}
