package com.newsverdict.service.pipeline;

import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.Verdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record FetchOutcome(
        String query,
        List<String> articles,
        List<Verdict> verdicts,
        Map<String, SourceError> sourceErrors
) {
    public FetchOutcome {
        Objects.requireNonNull(query, "query is required");
        articles = List.copyOf(articles);
        verdicts = List.copyOf(verdicts);
        if (articles.size() != verdicts.size()) {
            throw new IllegalArgumentException("Expected one verdict per article, got "
                    + verdicts.size() + " for " + articles.size());
        }
        sourceErrors = Collections.unmodifiableMap(new LinkedHashMap<>(sourceErrors));
    }
}
