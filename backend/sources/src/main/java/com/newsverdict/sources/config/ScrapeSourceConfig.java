package com.newsverdict.sources.config;

import com.newsverdict.core.model.Language;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public record ScrapeSourceConfig(
        String name,
        String url,
        String selector,
        int maxItems,
        Language languageHint,
        String labelPrefix,
        Set<String> regions
) {
    public static final int DEFAULT_MAX_ITEMS = 5;

    public ScrapeSourceConfig {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(selector, "selector is required");
        maxItems = maxItems <= 0 ? DEFAULT_MAX_ITEMS : maxItems;
        labelPrefix = labelPrefix == null ? "" : labelPrefix;
        regions = regions == null ? Set.of() : regions.stream()
                .map(region -> region.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
