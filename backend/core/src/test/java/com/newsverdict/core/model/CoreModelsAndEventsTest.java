package com.newsverdict.core.model;

import com.newsverdict.core.events.AggregationCompleted;
import com.newsverdict.core.events.AggregationStarted;
import com.newsverdict.core.events.AlertRaised;
import com.newsverdict.core.events.SourceFetched;
import com.newsverdict.core.events.VerdictIssued;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoreModelsAndEventsTest {
    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void articleIdIgnoresCaseAndWhitespaceDifferences() {
        Article a = Article.of("RBI raises  repo rate by 25 bps", "newsapi", SourceKind.API, NOW, null);
        Article b = Article.of("rbi raises repo rate by 25 bps\n", "bbc", SourceKind.SCRAPE, NOW, null);
        Article c = Article.of("RBI cuts repo rate by 25 bps", "newsapi", SourceKind.API, NOW, null);

        assertEquals(a.id(), b.id());
        assertNotEquals(a.id(), c.id());
        assertEquals("RBI raises repo rate by 25 bps", a.text());
    }

    @Test
    void articleUsesLanguageHintWhenGiven() {
        Article hinted = Article.of("Short text", "aajtak", SourceKind.SCRAPE, NOW, Language.HINDI);
        Article detected = Article.of("ગુજરાત સરકારે નવી યોજના જાહેર કરી", "divya", SourceKind.SCRAPE, NOW, null);

        assertEquals(Language.HINDI, hinted.detectedLanguage());
        assertEquals(Language.GUJARATI, detected.detectedLanguage());
    }

    @Test
    void fetchResultRejectsArticlesOnFailure() {
        Article article = Article.of("Some story text here", "newsapi", SourceKind.API, NOW, null);

        FetchResult ok = FetchResult.success("newsapi", SourceKind.API, List.of(article));
        FetchResult failed = FetchResult.failure("newsdata", SourceKind.API, SourceError.of(SourceErrorKind.TIMEOUT, null));

        assertTrue(ok.succeeded());
        assertFalse(failed.succeeded());
        assertEquals("TIMEOUT", failed.error().message());
        assertThrows(IllegalArgumentException.class, () -> new FetchResult(
                "newsapi", SourceKind.API, List.of(article), SourceError.of(SourceErrorKind.NETWORK, "reset")));
    }

    @Test
    void reliabilityBandsFollowConfidence() {
        assertEquals(Reliability.HIGH, Reliability.fromConfidence(95.0));
        assertEquals(Reliability.MEDIUM, Reliability.fromConfidence(85.0));
        assertEquals(Reliability.MEDIUM, Reliability.fromConfidence(78.0));
        assertEquals(Reliability.MEDIUM, Reliability.fromConfidence(70.0));
        assertEquals(Reliability.LOW, Reliability.fromConfidence(55.0));
        assertEquals("Medium", Reliability.MEDIUM.displayName());
    }

    @Test
    void scoredArticleAndVerdictValidateRanges() {
        Article article = Article.of("Some story text here", "newsapi", SourceKind.API, NOW, null);

        assertFalse(new ScoredArticle(article, null, 0.2, 0.4).modelConsulted());
        assertThrows(IllegalArgumentException.class, () -> new ScoredArticle(article, 1.2, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ScoredArticle(article, 0.5, -1.5, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new Verdict(Label.FAKE, 101.0, Reliability.HIGH, Language.ENGLISH, Regime.MODEL_BACKED));
    }

    @Test
    void languageCodesRoundTrip() {
        assertEquals(Language.HINDI, Language.fromCode("hi"));
        assertEquals(Language.GUJARATI, Language.fromCode("GUJARATI"));
        assertEquals(Language.UNKNOWN, Language.fromCode("fr"));
        assertTrue(Language.UNKNOWN.isScoredDirectly());
        assertFalse(Language.HINDI.isScoredDirectly());
    }

    @Test
    void eventsExposeTypeAndPayload() {
        AggregationStarted started = new AggregationStarted(NOW, "latest", "IN", 3);
        AggregationCompleted completed = new AggregationCompleted(NOW, "latest", true, 12, 1, 900);
        SourceFetched fetched = new SourceFetched(NOW, "newsapi", true, 5, 120);
        VerdictIssued verdict = new VerdictIssued(NOW, "abc", Label.FAKE, 88.0, Language.ENGLISH, Regime.MODEL_BACKED);
        AlertRaised alert = new AlertRaised(NOW, "source", "timeout", Map.of("source", "newsdata"));

        assertEquals("AggregationStarted", started.type());
        assertEquals("AggregationCompleted", completed.type());
        assertEquals("SourceFetched", fetched.type());
        assertEquals("VerdictIssued", verdict.type());
        assertEquals("AlertRaised", alert.type());
        assertEquals(12, completed.articleCount());
        assertEquals("newsdata", alert.details().get("source"));
    }
}
