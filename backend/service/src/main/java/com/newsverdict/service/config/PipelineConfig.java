package com.newsverdict.service.config;

import com.newsverdict.service.cache.ResponseCache;
import com.newsverdict.service.language.GlossaryTranslator;

import java.time.Duration;

public record PipelineConfig(
        String articleModel,
        String headlineModel,
        String glossary,
        double minCoverage,
        Duration cacheTtl,
        long cacheMaxSize,
        Duration connectTimeout
) {
    public static final String DEFAULT_HEADLINE_MODEL = "classpath:model/headline-model.json";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    public PipelineConfig {
        if (isBlank(articleModel) && isBlank(headlineModel)) {
            headlineModel = DEFAULT_HEADLINE_MODEL;
        }
        glossary = isBlank(glossary) ? GlossaryTranslator.DEFAULT_RESOURCE : glossary;
        minCoverage = minCoverage <= 0.0 ? GlossaryTranslator.DEFAULT_MIN_COVERAGE : minCoverage;
        if (minCoverage > 1.0) {
            throw new IllegalArgumentException("minCoverage must be within (0,1]");
        }
        cacheTtl = cacheTtl == null ? ResponseCache.DEFAULT_TTL : cacheTtl;
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive");
        }
        cacheMaxSize = cacheMaxSize <= 0 ? ResponseCache.DEFAULT_MAXIMUM_SIZE : cacheMaxSize;
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, 0.0, null, 0, null);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
