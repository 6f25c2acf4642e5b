package com.newsverdict.service.pipeline;

import com.newsverdict.core.bus.EventBus;
import com.newsverdict.core.events.VerdictIssued;
import com.newsverdict.core.model.Article;
import com.newsverdict.core.model.ScoredArticle;
import com.newsverdict.core.model.Verdict;
import com.newsverdict.core.util.TextUtils;
import com.newsverdict.service.cache.ResponseCache;
import com.newsverdict.service.decision.DecisionCombiner;
import com.newsverdict.service.language.LanguageNormalizer;
import com.newsverdict.service.language.NormalizedText;
import com.newsverdict.service.rules.RuleEngine;
import com.newsverdict.service.rules.RuleSignal;
import com.newsverdict.service.scoring.FeatureScorer;
import com.newsverdict.service.scoring.InsufficientInputException;
import com.newsverdict.sources.aggregate.AggregationResult;
import com.newsverdict.sources.aggregate.Aggregator;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for classification. Callers either get a complete result or a
 * {@link PipelineException} carrying one {@link ErrorKind}.
 */
public class NewsPipeline {
    private static final Logger LOGGER = Logger.getLogger(NewsPipeline.class.getName());

    static final String DEFAULT_QUERY = "latest";

    private final Aggregator aggregator;
    private final LanguageNormalizer normalizer;
    private final FeatureScorer scorer;
    private final RuleEngine ruleEngine;
    private final DecisionCombiner combiner;
    private final ResponseCache<Verdict> verdictCache;
    private final ResponseCache<FetchOutcome> fetchCache;
    private final EventBus eventBus;
    private final Clock clock;

    public NewsPipeline(
            Aggregator aggregator,
            LanguageNormalizer normalizer,
            FeatureScorer scorer,
            RuleEngine ruleEngine,
            DecisionCombiner combiner,
            ResponseCache<Verdict> verdictCache,
            ResponseCache<FetchOutcome> fetchCache,
            EventBus eventBus,
            Clock clock
    ) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.scorer = scorer;
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine is required");
        this.combiner = Objects.requireNonNull(combiner, "combiner is required");
        this.verdictCache = Objects.requireNonNull(verdictCache, "verdictCache is required");
        this.fetchCache = Objects.requireNonNull(fetchCache, "fetchCache is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Verdict classify(String text) {
        String sanitized = InputValidator.validate(text);
        if (scorer == null) {
            throw new PipelineException(ErrorKind.SCORER_UNAVAILABLE, "No classification model is loaded");
        }
        String contentId = Article.contentId(sanitized);
        return verdictCache.getOrCompute(contentId, () -> judgeText(contentId, sanitized));
    }

    public FetchOutcome fetchAndClassify(String query) {
        return fetchAndClassify(query, null);
    }

    public FetchOutcome fetchAndClassify(String query, String region) {
        String effectiveQuery = query == null || query.isBlank() ? DEFAULT_QUERY : query.trim();
        String regionKey = region == null ? "" : region.trim().toLowerCase(Locale.ROOT);
        String cacheKey = "fetch:" + TextUtils.normalizeForId(effectiveQuery) + "|" + regionKey;
        return fetchCache.getOrCompute(cacheKey, () -> fetchFresh(effectiveQuery, regionKey));
    }

    public HealthReport health() {
        boolean modelLoaded = scorer != null;
        return new HealthReport(
                modelLoaded ? HealthReport.OK : HealthReport.DEGRADED,
                modelLoaded,
                aggregator.adapters().size(),
                verdictCache.size(),
                fetchCache.size(),
                clock.instant()
        );
    }

    private FetchOutcome fetchFresh(String query, String region) {
        AggregationResult aggregation = aggregator.aggregate(query, region.isEmpty() ? null : region);
        if (aggregation.articles().isEmpty()) {
            throw new PipelineException(ErrorKind.NO_RESULTS,
                    "No articles for '" + query + "'; source errors: " + aggregation.errors());
        }
        List<Verdict> verdicts = aggregation.articles().stream()
                .map(article -> verdictCache.getOrCompute(article.id(), () -> judgeArticle(article)))
                .toList();
        List<String> texts = aggregation.articles().stream().map(Article::text).toList();
        return new FetchOutcome(query, texts, verdicts, aggregation.errors());
    }

    private Verdict judgeText(String contentId, String text) {
        NormalizedText normalized = normalizer.normalize(text);
        RuleSignal rules = ruleEngine.evaluate(text);
        return issue(contentId, modelProbability(normalized), rules.ruleAdjustment(), rules.professionalScore(), normalized);
    }

    private Verdict judgeArticle(Article article) {
        NormalizedText normalized = normalizer.normalize(article.text(), article.detectedLanguage());
        ScoredArticle scored = score(article, normalized);
        return issue(article.id(), scored.fabricationProbability(), scored.ruleAdjustment(), scored.professionalScore(), normalized);
    }

    private ScoredArticle score(Article article, NormalizedText normalized) {
        RuleSignal rules = ruleEngine.evaluate(article.text());
        return new ScoredArticle(article, modelProbability(normalized), rules.ruleAdjustment(), rules.professionalScore());
    }

    private Verdict issue(String contentId, Double probability, double adjustment, double professional, NormalizedText normalized) {
        Verdict verdict = combiner.combine(
                probability,
                adjustment,
                professional,
                normalized.detectedLanguage()
        );
        eventBus.publish(new VerdictIssued(
                clock.instant(),
                contentId,
                verdict.label(),
                verdict.confidencePercent(),
                verdict.detectedLanguage(),
                verdict.regime()
        ));
        return verdict;
    }

    private Double modelProbability(NormalizedText normalized) {
        if (scorer == null || !normalized.modelSupported()) {
            return null;
        }
        try {
            return scorer.score(normalized.workingText());
        } catch (InsufficientInputException ex) {
            LOGGER.fine(() -> "Scoring skipped: " + ex.getMessage());
            return null;
        }
    }
}
