package com.newsverdict.service.pipeline;

import java.time.Instant;

public record HealthReport(
        String status,
        boolean modelLoaded,
        int sourceCount,
        long classificationCacheSize,
        long fetchCacheSize,
        Instant checkedAt
) {
    public static final String OK = "ok";
    public static final String DEGRADED = "degraded";
}
