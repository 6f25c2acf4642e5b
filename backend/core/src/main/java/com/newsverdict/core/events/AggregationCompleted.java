package com.newsverdict.core.events;

import java.time.Instant;

public record AggregationCompleted(
        Instant timestamp,
        String query,
        boolean success,
        int articleCount,
        int failedSources,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "AggregationCompleted";
    }
}
