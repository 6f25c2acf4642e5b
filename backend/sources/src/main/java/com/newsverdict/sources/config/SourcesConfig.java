package com.newsverdict.sources.config;

import java.time.Duration;
import java.util.List;

public record SourcesConfig(
        Duration requestTimeout,
        Duration deadline,
        int perSourceLimit,
        int maxArticles,
        List<ApiSourceConfig> apis,
        List<ScrapeSourceConfig> scrapers
) {
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(5);
    public static final int DEFAULT_PER_SOURCE_LIMIT = 15;
    public static final int DEFAULT_MAX_ARTICLES = 20;

    public SourcesConfig {
        deadline = deadline == null ? DEFAULT_DEADLINE : deadline;
        requestTimeout = requestTimeout == null ? deadline : requestTimeout;
        perSourceLimit = perSourceLimit <= 0 ? DEFAULT_PER_SOURCE_LIMIT : perSourceLimit;
        maxArticles = maxArticles <= 0 ? DEFAULT_MAX_ARTICLES : maxArticles;
        apis = apis == null ? List.of() : List.copyOf(apis);
        scrapers = scrapers == null ? List.of() : List.copyOf(scrapers);
    }
}
