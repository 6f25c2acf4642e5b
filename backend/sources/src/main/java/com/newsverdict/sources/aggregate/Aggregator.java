package com.newsverdict.sources.aggregate;

import com.newsverdict.core.events.AggregationCompleted;
import com.newsverdict.core.events.AggregationStarted;
import com.newsverdict.core.events.AlertRaised;
import com.newsverdict.core.events.SourceFetched;
import com.newsverdict.core.model.Article;
import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.SourceErrorKind;
import com.newsverdict.sources.api.FetchFailures;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.api.SourceContext;
import com.newsverdict.sources.config.SourcesConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Fans a query out to every source concurrently and merges what comes back.
 *
 * <p>Each source gets the same overall deadline. A source that has not answered by then is
 * recorded as a {@link SourceErrorKind#TIMEOUT} failure and anything it returns later is ignored.
 * One failing source never fails the aggregation. The merged list puts API sources ahead of
 * scraped ones, keeps configured order within a kind, drops repeated article ids (first wins) and
 * is capped at {@code maxArticles}. Completion order has no effect on the result.
 */
public class Aggregator {
    private static final Logger LOGGER = Logger.getLogger(Aggregator.class.getName());

    private final List<SourceAdapter> adapters;
    private final SourceContext ctx;
    private final Duration deadline;
    private final int perSourceLimit;
    private final int maxArticles;

    public Aggregator(List<SourceAdapter> adapters, SourceContext ctx, Duration deadline, int perSourceLimit, int maxArticles) {
        this.adapters = List.copyOf(adapters);
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        this.deadline = Objects.requireNonNull(deadline, "deadline is required");
        if (perSourceLimit <= 0 || maxArticles <= 0) {
            throw new IllegalArgumentException("perSourceLimit and maxArticles must be positive");
        }
        this.perSourceLimit = perSourceLimit;
        this.maxArticles = maxArticles;
    }

    public Aggregator(List<SourceAdapter> adapters, SourceContext ctx, SourcesConfig config) {
        this(adapters, ctx, config.deadline(), config.perSourceLimit(), config.maxArticles());
    }

    public List<SourceAdapter> adapters() {
        return adapters;
    }

    public AggregationResult aggregate(String query) {
        return aggregate(query, null);
    }

    public AggregationResult aggregate(String query, String region) {
        Objects.requireNonNull(query, "query is required");
        Instant startedAt = ctx.clock().instant();
        List<SourceAdapter> selected = select(region);
        ctx.eventBus().publish(new AggregationStarted(startedAt, query, region, selected.size()));

        List<CompletableFuture<TimedResult>> tasks = selected.stream()
                .map(adapter -> invoke(adapter, query, startedAt))
                .toList();
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

        List<TimedResult> outcomes = tasks.stream().map(CompletableFuture::join).toList();
        List<FetchResult> results = outcomes.stream().map(TimedResult::result).toList();
        Map<String, SourceError> errors = new LinkedHashMap<>();
        for (TimedResult timed : outcomes) {
            FetchResult result = timed.result();
            ctx.eventBus().publish(new SourceFetched(
                    ctx.clock().instant(),
                    result.sourceName(),
                    result.succeeded(),
                    result.articles().size(),
                    timed.durationMillis()
            ));
            if (!result.succeeded()) {
                errors.put(result.sourceName(), result.error());
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "source",
                        "Source " + result.sourceName() + " failed: " + result.error().kind(),
                        Map.of(
                                "source", result.sourceName(),
                                "kind", result.error().kind().name(),
                                "message", result.error().message()
                        )
                ));
            }
        }

        List<Article> merged = merge(results);
        AggregationResult aggregation = new AggregationResult(query, merged, results, errors);
        long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
        ctx.eventBus().publish(new AggregationCompleted(
                ctx.clock().instant(),
                query,
                !aggregation.allSourcesFailed(),
                merged.size(),
                errors.size(),
                durationMillis
        ));
        LOGGER.info("Aggregated " + merged.size() + " articles for '" + query + "' from "
                + (results.size() - errors.size()) + "/" + results.size() + " sources");
        return aggregation;
    }

    public static List<Article> deduplicate(List<Article> articles) {
        Map<String, Article> byId = new LinkedHashMap<>();
        for (Article article : articles) {
            byId.putIfAbsent(article.id(), article);
        }
        return List.copyOf(byId.values());
    }

    List<Article> merge(List<FetchResult> results) {
        List<Article> ordered = results.stream()
                .sorted(Comparator.comparing(FetchResult::sourceKind))
                .flatMap(result -> result.articles().stream())
                .toList();
        return deduplicate(ordered).stream().limit(maxArticles).toList();
    }

    private List<SourceAdapter> select(String region) {
        if (region == null || region.isBlank()) {
            return adapters;
        }
        String key = region.trim().toLowerCase(Locale.ROOT);
        return adapters.stream()
                .filter(adapter -> adapter.regions().isEmpty() || adapter.regions().contains(key))
                .toList();
    }

    private CompletableFuture<TimedResult> invoke(SourceAdapter adapter, String query, Instant startedAt) {
        CompletableFuture<FetchResult> call;
        try {
            call = Objects.requireNonNull(adapter.fetch(ctx, query, perSourceLimit), "adapter returned no future");
        } catch (RuntimeException ex) {
            call = CompletableFuture.completedFuture(FetchResult.failure(
                    adapter.name(), adapter.kind(), SourceError.of(SourceErrorKind.NETWORK, "Fetch failure: " + FetchFailures.rootMessage(ex))));
        }
        return call
                .exceptionally(error -> FetchResult.failure(adapter.name(), adapter.kind(), FetchFailures.fromThrowable(error)))
                .completeOnTimeout(
                        FetchResult.failure(adapter.name(), adapter.kind(),
                                SourceError.of(SourceErrorKind.TIMEOUT, "No response within " + deadline.toMillis() + " ms")),
                        deadline.toMillis(),
                        TimeUnit.MILLISECONDS
                )
                .thenApply(result -> new TimedResult(result, Duration.between(startedAt, ctx.clock().instant()).toMillis()));
    }

    private record TimedResult(FetchResult result, long durationMillis) {
    }
}
