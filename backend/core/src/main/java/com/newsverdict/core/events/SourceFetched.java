package com.newsverdict.core.events;

import java.time.Instant;

public record SourceFetched(
        Instant timestamp,
        String sourceName,
        boolean success,
        int articleCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SourceFetched";
    }
}
