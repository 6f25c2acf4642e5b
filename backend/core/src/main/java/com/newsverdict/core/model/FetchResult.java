package com.newsverdict.core.model;

import java.util.List;
import java.util.Objects;

public record FetchResult(
        String sourceName,
        SourceKind sourceKind,
        List<Article> articles,
        SourceError error
) {
    public FetchResult {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(sourceKind, "sourceKind is required");
        articles = articles == null ? List.of() : List.copyOf(articles);
        if (error != null && !articles.isEmpty()) {
            throw new IllegalArgumentException("A failed fetch must not carry articles: " + sourceName);
        }
    }

    public static FetchResult success(String sourceName, SourceKind sourceKind, List<Article> articles) {
        return new FetchResult(sourceName, sourceKind, articles, null);
    }

    public static FetchResult failure(String sourceName, SourceKind sourceKind, SourceError error) {
        return new FetchResult(sourceName, sourceKind, List.of(), Objects.requireNonNull(error, "error is required"));
    }

    public boolean succeeded() {
        return error == null;
    }
}
