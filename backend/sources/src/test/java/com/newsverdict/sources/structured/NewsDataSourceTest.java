package com.newsverdict.sources.structured;

import com.newsverdict.core.bus.EventBus;
import com.newsverdict.core.model.FetchResult;
import com.newsverdict.core.model.SourceErrorKind;
import com.newsverdict.sources.api.SourceContext;
import com.newsverdict.sources.config.ApiSourceConfig;
import com.newsverdict.sources.support.FixtureServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static com.newsverdict.sources.support.FixtureUtils.fixture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsDataSourceTest {
    private FixtureServer server;
    private SourceContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        server = new FixtureServer();
        ctx = new SourceContext(
                HttpClient.newHttpClient(),
                new EventBus(),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC),
                Duration.ofSeconds(2)
        );
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void parsesResultsAndSkipsEntriesWithoutDescription() {
        server.respond("/api/1/news", 200, "application/json", fixture("fixtures/newsdata-news.json"));

        FetchResult result = source("/").fetch(ctx, "isro", 10).join();

        assertTrue(result.succeeded());
        assertEquals(1, result.articles().size());
        assertEquals("timesofindia: ISRO schedules next PSLV launch from Sriharikota. The Indian Space Research "
                + "Organisation said the launch window opens on March 3. ONLY AVAILABLE IN PAID PLANS",
                result.articles().get(0).text());

        String query = URLDecoder.decode(server.requests().get(0).rawQuery(), StandardCharsets.UTF_8);
        assertTrue(query.contains("apikey=newsdata-key"), query);
        assertTrue(query.contains("q=isro India Gujarat"), query);
        assertTrue(query.contains("country=in"), query);
        assertTrue(query.contains("size=10"), query);
    }

    @Test
    void requestedSizeIsCappedAtProviderMaximum() {
        server.respond("/api/1/news", 200, "application/json", fixture("fixtures/newsdata-news.json"));

        source("/").fetch(ctx, "isro", 500).join();

        assertTrue(server.requests().get(0).rawQuery().contains("size=50"), server.requests().get(0).rawQuery());
    }

    @Test
    void readsErrorCodeFromNestedResults() {
        server.respond("/denied/api/1/news", 200, "application/json", fixture("fixtures/newsdata-error.json"));
        server.respond("/limited/api/1/news", 200, "application/json", fixture("fixtures/newsdata-rate-limited.json"));

        FetchResult denied = source("/denied").fetch(ctx, "latest", 10).join();
        FetchResult limited = source("/limited").fetch(ctx, "latest", 10).join();

        assertEquals(SourceErrorKind.UNAUTHORIZED, denied.error().kind());
        assertTrue(denied.error().message().contains("API key is not valid"));
        assertEquals(SourceErrorKind.RATE_LIMITED, limited.error().kind());
    }

    @Test
    void unreachableHostIsNetworkFailure() {
        ApiSourceConfig config = new ApiSourceConfig("newsdata", ApiSourceConfig.NEWSDATA, "http://localhost:1",
                "NEWSDATA_KEY", "en", "in", null, null, Set.of());

        FetchResult result = new NewsDataSource(config, "newsdata-key").fetch(ctx, "latest", 10).join();

        assertEquals(SourceErrorKind.NETWORK, result.error().kind());
    }

    private StructuredApiSource source(String prefix) {
        ApiSourceConfig config = new ApiSourceConfig("newsdata", ApiSourceConfig.NEWSDATA, server.baseUrl() + prefix,
                "NEWSDATA_KEY", "en", "in", "India", "India Gujarat", Set.of("india", "gujarat"));
        return new NewsDataSource(config, "newsdata-key");
    }
}
