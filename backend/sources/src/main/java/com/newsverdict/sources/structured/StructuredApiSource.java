package com.newsverdict.sources.structured;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsverdict.core.model.Article;
import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.SourceErrorKind;
import com.newsverdict.core.model.SourceKind;
import com.newsverdict.core.util.JsonUtils;
import com.newsverdict.core.util.TextUtils;
import com.newsverdict.sources.api.FetchFailures;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.api.SourceContext;
import com.newsverdict.sources.config.ApiSourceConfig;
import org.jsoup.Jsoup;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public abstract class StructuredApiSource implements SourceAdapter {
    private static final Logger LOGGER = Logger.getLogger(StructuredApiSource.class.getName());

    static final int CONTENT_PREFIX_CHARS = 200;
    static final int MIN_ARTICLE_CHARS = 50;
    private static final Set<String> GENERIC_QUERIES = Set.of("latest", "news");
    private static final Set<String> UNAUTHORIZED_CODES = Set.of(
            "apikeyinvalid", "apikeymissing", "apikeydisabled", "unauthorized"
    );
    private static final Set<String> RATE_LIMITED_CODES = Set.of("ratelimited", "ratelimitexceeded");

    protected final ApiSourceConfig config;
    private final String apiKey;

    protected StructuredApiSource(ApiSourceConfig config, String apiKey) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public SourceKind kind() {
        return SourceKind.API;
    }

    @Override
    public Set<String> regions() {
        return config.regions();
    }

    @Override
    public CompletableFuture<FetchResult> fetch(SourceContext ctx, String query, int limit) {
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.completedFuture(failure(SourceErrorKind.UNAUTHORIZED,
                    "No API key configured (" + config.apiKeyEnv() + ")"));
        }
        Instant fetchedAt = ctx.clock().instant();
        HttpRequest request = buildRequest(upstreamQuery(query), limit, apiKey)
                .GET()
                .timeout(ctx.requestTimeout())
                .header("Accept", "application/json")
                .build();

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        SourceError sourceError = FetchFailures.fromThrowable(error);
                        LOGGER.warning(name() + " request failed: " + sourceError.message());
                        return FetchResult.failure(name(), kind(), sourceError);
                    }
                    return toResult(response.statusCode(), response.body(), fetchedAt, limit);
                });
    }

    String upstreamQuery(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty() || GENERIC_QUERIES.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return config.genericQueryTerm();
        }
        if (config.contextTerms() == null || config.contextTerms().isBlank()) {
            return trimmed;
        }
        return trimmed + " " + config.contextTerms();
    }

    FetchResult toResult(int statusCode, String body, Instant fetchedAt, int limit) {
        SourceError statusError = FetchFailures.fromStatus(statusCode);
        if (statusError != null) {
            return FetchResult.failure(name(), kind(), statusError);
        }
        Optional<JsonNode> parsed = JsonUtils.tryParse(body);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            return failure(SourceErrorKind.INVALID_RESPONSE, "Response body is not a JSON object");
        }
        JsonNode root = parsed.get();
        if (!successStatus().equals(root.path("status").asText())) {
            return FetchResult.failure(name(), kind(), providerError(errorCode(root), errorMessage(root)));
        }

        List<Article> articles = new ArrayList<>();
        for (ApiEntry entry : entries(root)) {
            if (articles.size() >= limit) {
                break;
            }
            composeText(entry)
                    .map(text -> Article.of(text, name(), kind(), fetchedAt, null))
                    .ifPresent(articles::add);
        }
        if (articles.isEmpty()) {
            return failure(SourceErrorKind.EMPTY_RESULT, "No usable articles in response");
        }
        return FetchResult.success(name(), kind(), articles);
    }

    static Optional<String> composeText(ApiEntry entry) {
        String title = clean(entry.title());
        String description = clean(entry.description());
        if (title.isEmpty() || description.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder()
                .append(clean(entry.sourceLabel())).append(": ")
                .append(title).append(". ")
                .append(description);
        String content = clean(entry.content());
        if (!content.isEmpty()) {
            text.append(' ').append(TextUtils.truncate(content, CONTENT_PREFIX_CHARS));
        }
        return text.length() > MIN_ARTICLE_CHARS ? Optional.of(text.toString()) : Optional.empty();
    }

    static SourceError providerError(String code, String message) {
        String lowered = code == null ? "" : code.toLowerCase(Locale.ROOT);
        String detail = (code == null || code.isBlank() ? "provider error" : code)
                + (message == null || message.isBlank() ? "" : ": " + message);
        if (UNAUTHORIZED_CODES.contains(lowered)) {
            return SourceError.of(SourceErrorKind.UNAUTHORIZED, detail);
        }
        if (RATE_LIMITED_CODES.contains(lowered)) {
            return SourceError.of(SourceErrorKind.RATE_LIMITED, detail);
        }
        return SourceError.of(SourceErrorKind.INVALID_RESPONSE, detail);
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : "";
    }

    protected URI endpoint(String pathAndQuery) {
        String base = config.baseUrl().endsWith("/")
                ? config.baseUrl().substring(0, config.baseUrl().length() - 1)
                : config.baseUrl();
        return URI.create(base + pathAndQuery);
    }

    static String clean(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return Jsoup.parse(value).text();
    }

    private FetchResult failure(SourceErrorKind kind, String message) {
        return FetchResult.failure(name(), kind(), SourceError.of(kind, message));
    }

    protected abstract HttpRequest.Builder buildRequest(String upstreamQuery, int limit, String apiKey);

    protected abstract String successStatus();

    protected abstract List<ApiEntry> entries(JsonNode root);

    protected abstract String errorCode(JsonNode root);

    protected abstract String errorMessage(JsonNode root);

    protected record ApiEntry(String sourceLabel, String title, String description, String content) {
    }
}
