package com.newsverdict.core.model;

import java.util.Objects;

public record Verdict(
        Label label,
        double confidencePercent,
        Reliability reliability,
        Language detectedLanguage,
        Regime regime
) {
    public Verdict {
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(reliability, "reliability is required");
        Objects.requireNonNull(detectedLanguage, "detectedLanguage is required");
        Objects.requireNonNull(regime, "regime is required");
        if (confidencePercent < 0.0 || confidencePercent > 100.0) {
            throw new IllegalArgumentException("confidencePercent must be within [0,100]");
        }
    }
}
