package com.newsverdict.sources.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public record ApiSourceConfig(
        String name,
        String provider,
        String baseUrl,
        String apiKeyEnv,
        String language,
        String country,
        String genericQueryTerm,
        String contextTerms,
        Set<String> regions
) {
    public static final String NEWSAPI = "newsapi";
    public static final String NEWSDATA = "newsdata";

    public ApiSourceConfig {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        provider = provider.toLowerCase(Locale.ROOT);
        language = language == null || language.isBlank() ? "en" : language;
        genericQueryTerm = genericQueryTerm == null || genericQueryTerm.isBlank() ? "India" : genericQueryTerm;
        regions = regions == null ? Set.of() : regions.stream()
                .map(region -> region.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
