package com.newsverdict.core.events;

import com.newsverdict.core.model.Label;
import com.newsverdict.core.model.Language;
import com.newsverdict.core.model.Regime;

import java.time.Instant;

public record VerdictIssued(
        Instant timestamp,
        String contentId,
        Label label,
        double confidencePercent,
        Language detectedLanguage,
        Regime regime
) implements Event {
    @Override
    public String type() {
        return "VerdictIssued";
    }
}
