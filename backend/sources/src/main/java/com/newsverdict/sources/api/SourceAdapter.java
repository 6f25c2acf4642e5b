package com.newsverdict.sources.api;

import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceKind;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

public interface SourceAdapter {
    String name();

    SourceKind kind();

    default Set<String> regions() {
        return Set.of();
    }

    CompletableFuture<FetchResult> fetch(SourceContext ctx, String query, int limit);
}
