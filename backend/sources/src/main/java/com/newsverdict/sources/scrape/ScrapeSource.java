package com.newsverdict.sources.scrape;

import com.newsverdict.core.model.Article;
import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.SourceKind;
import com.newsverdict.sources.api.FetchFailures;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.api.SourceContext;
import com.newsverdict.sources.config.ScrapeSourceConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public class ScrapeSource implements SourceAdapter {
    private static final Logger LOGGER = Logger.getLogger(ScrapeSource.class.getName());

    static final int MIN_HEADLINE_CHARS = 20;
    static final int MAX_HEADLINE_CHARS = 500;

    private final ScrapeSourceConfig config;

    public ScrapeSource(ScrapeSourceConfig config) {
        this.config = Objects.requireNonNull(config, "config is required");
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SCRAPE;
    }

    @Override
    public Set<String> regions() {
        return config.regions();
    }

    @Override
    public CompletableFuture<FetchResult> fetch(SourceContext ctx, String query, int limit) {
        Instant fetchedAt = ctx.clock().instant();
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.url()))
                .GET()
                .timeout(ctx.requestTimeout())
                .header("User-Agent", "Mozilla/5.0 (compatible; newsverdict/0.1)")
                .build();

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        SourceError sourceError = FetchFailures.fromThrowable(error);
                        LOGGER.warning("Scrape of " + config.url() + " failed: " + sourceError.message());
                        return FetchResult.failure(name(), kind(), sourceError);
                    }
                    if (response.statusCode() >= 400) {
                        return FetchResult.failure(name(), kind(), FetchFailures.fromStatus(response.statusCode()));
                    }
                    List<String> headlines = extractHeadlines(response.body(), Math.min(limit, config.maxItems()));
                    if (headlines.isEmpty()) {
                        LOGGER.warning("Selector '" + config.selector() + "' matched no headlines on " + config.url());
                    }
                    List<Article> articles = headlines.stream()
                            .map(headline -> Article.of(config.labelPrefix() + headline, name(), kind(), fetchedAt, config.languageHint()))
                            .toList();
                    return FetchResult.success(name(), kind(), articles);
                });
    }

    List<String> extractHeadlines(String html, int maxItems) {
        Document doc = Jsoup.parse(html == null ? "" : html, config.url());
        Elements elements;
        try {
            elements = doc.select(config.selector());
        } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
            LOGGER.warning("Invalid selector '" + config.selector() + "' for " + name() + ": " + ex.getMessage());
            return List.of();
        }
        Set<String> headlines = new LinkedHashSet<>();
        for (Element element : elements) {
            if (headlines.size() >= maxItems) {
                break;
            }
            String text = element.text().trim();
            if (text.length() > MIN_HEADLINE_CHARS && text.length() < MAX_HEADLINE_CHARS) {
                headlines.add(text);
            }
        }
        return new ArrayList<>(headlines);
    }
}
