package com.newsverdict.core.model;

import java.util.Objects;

public record ScoredArticle(
        Article article,
        Double fabricationProbability,
        double ruleAdjustment,
        double professionalScore
) {
    public ScoredArticle {
        Objects.requireNonNull(article, "article is required");
        if (fabricationProbability != null && (fabricationProbability < 0.0 || fabricationProbability > 1.0)) {
            throw new IllegalArgumentException("fabricationProbability must be within [0,1]");
        }
        if (ruleAdjustment < -1.0 || ruleAdjustment > 1.0) {
            throw new IllegalArgumentException("ruleAdjustment must be within [-1,1]");
        }
        if (professionalScore < 0.0 || professionalScore > 1.0) {
            throw new IllegalArgumentException("professionalScore must be within [0,1]");
        }
    }

    public boolean modelConsulted() {
        return fabricationProbability != null;
    }
}
