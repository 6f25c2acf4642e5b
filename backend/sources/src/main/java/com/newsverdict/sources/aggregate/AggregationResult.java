package com.newsverdict.sources.aggregate;

import com.newsverdict.core.model.Article;
import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record AggregationResult(
        String query,
        List<Article> articles,
        List<FetchResult> results,
        Map<String, SourceError> errors
) {
    public AggregationResult {
        Objects.requireNonNull(query, "query is required");
        articles = List.copyOf(articles);
        results = List.copyOf(results);
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public boolean allSourcesFailed() {
        return results.stream().noneMatch(FetchResult::succeeded);
    }
}
