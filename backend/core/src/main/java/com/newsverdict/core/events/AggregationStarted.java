package com.newsverdict.core.events;

import java.time.Instant;

public record AggregationStarted(Instant timestamp, String query, String region, int sourceCount) implements Event {
    @Override
    public String type() {
        return "AggregationStarted";
    }
}
