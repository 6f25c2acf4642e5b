package com.newsverdict.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.newsverdict.core.bus.EventBus;
import com.newsverdict.core.model.Language;
import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.Verdict;
import com.newsverdict.core.util.JsonUtils;
import com.newsverdict.service.cache.ResponseCache;
import com.newsverdict.service.config.ConfigLoader;
import com.newsverdict.service.config.PipelineConfig;
import com.newsverdict.service.decision.DecisionCombiner;
import com.newsverdict.service.http.HttpClientFactory;
import com.newsverdict.service.language.GlossaryTranslator;
import com.newsverdict.service.language.LanguageNormalizer;
import com.newsverdict.service.pipeline.FetchOutcome;
import com.newsverdict.service.pipeline.LocalizedLabels;
import com.newsverdict.service.pipeline.NewsPipeline;
import com.newsverdict.service.pipeline.PipelineException;
import com.newsverdict.service.rules.RuleEngine;
import com.newsverdict.service.scoring.FabricationModel;
import com.newsverdict.service.scoring.FeatureScorer;
import com.newsverdict.service.stats.PipelineStats;
import com.newsverdict.sources.aggregate.Aggregator;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.api.SourceContext;
import com.newsverdict.sources.config.SourcesConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String USAGE = "usage: newsverdict classify <text> | fetch [query] [region] | health";

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("NEWSVERDICT_CONFIG_DIR", "config"));

        Clock clock = Clock.systemUTC();
        EventBus eventBus = new EventBus();
        PipelineStats stats = new PipelineStats(eventBus);
        NewsPipeline pipeline = buildPipeline(configDir, env, eventBus, clock);

        System.exit(run(args, pipeline, stats, System.out, System.err));
    }

    static NewsPipeline buildPipeline(Path configDir, Map<String, String> env, EventBus eventBus, Clock clock) {
        PipelineConfig pipelineConfig = ConfigLoader.loadPipeline(configDir);
        SourcesConfig sourcesConfig = ConfigLoader.loadSources(configDir);

        HttpClient httpClient = HttpClientFactory.create(pipelineConfig.connectTimeout());
        SourceContext context = new SourceContext(httpClient, eventBus, clock, sourcesConfig.requestTimeout());
        List<SourceAdapter> adapters = ConfigLoader.buildAdapters(sourcesConfig, env::get);
        Aggregator aggregator = new Aggregator(adapters, context, sourcesConfig);

        LanguageNormalizer normalizer = new LanguageNormalizer(
                GlossaryTranslator.fromResource(pipelineConfig.glossary(), pipelineConfig.minCoverage()));

        return new NewsPipeline(
                aggregator,
                normalizer,
                loadScorer(pipelineConfig, configDir),
                new RuleEngine(),
                new DecisionCombiner(),
                new ResponseCache<>(clock, pipelineConfig.cacheTtl(), pipelineConfig.cacheMaxSize()),
                new ResponseCache<>(clock, pipelineConfig.cacheTtl(), pipelineConfig.cacheMaxSize()),
                eventBus,
                clock
        );
    }

    static FeatureScorer loadScorer(PipelineConfig config, Path configDir) {
        try {
            FabricationModel articleModel = ConfigLoader.loadModel(config.articleModel(), configDir);
            FabricationModel headlineModel = ConfigLoader.loadModel(config.headlineModel(), configDir);
            return new FeatureScorer(articleModel, headlineModel);
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOGGER.warning("Classification model unavailable: " + e.getMessage());
            return null;
        }
    }

    static int run(String[] args, NewsPipeline pipeline, PipelineStats stats, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return 2;
        }
        try {
            switch (args[0]) {
                case "classify" -> {
                    if (args.length < 2) {
                        err.println(USAGE);
                        return 2;
                    }
                    String text = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
                    print(out, verdictView(pipeline.classify(text)));
                }
                case "fetch" -> {
                    String query = args.length > 1 ? args[1] : null;
                    String region = args.length > 2 ? args[2] : null;
                    print(out, fetchView(pipeline.fetchAndClassify(query, region)));
                }
                case "health" -> {
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("health", pipeline.health());
                    view.put("stats", stats.snapshot());
                    print(out, view);
                }
                default -> {
                    err.println(USAGE);
                    return 2;
                }
            }
            return 0;
        } catch (PipelineException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", e.kind().name());
            error.put("message", e.getMessage());
            print(err, error);
            return 1;
        }
    }

    static Map<String, Object> verdictView(Verdict verdict) {
        Language language = verdict.detectedLanguage();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("prediction", LocalizedLabels.label(verdict.label(), language));
        view.put("label", verdict.label());
        view.put("confidence", verdict.confidencePercent());
        view.put("reliability", LocalizedLabels.reliability(verdict.reliability(), language));
        view.put("language", language.code());
        view.put("regime", verdict.regime());
        return view;
    }

    static Map<String, Object> fetchView(FetchOutcome outcome) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (int i = 0; i < outcome.articles().size(); i++) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("article", outcome.articles().get(i));
            entry.putAll(verdictView(outcome.verdicts().get(i)));
            results.add(entry);
        }
        Map<String, Object> errors = new LinkedHashMap<>();
        for (Map.Entry<String, SourceError> error : outcome.sourceErrors().entrySet()) {
            errors.put(error.getKey(), error.getValue().kind() + ": " + error.getValue().message());
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("query", outcome.query());
        view.put("total", results.size());
        view.put("results", results);
        view.put("sourceErrors", errors);
        return view;
    }

    private static void print(PrintStream stream, Object value) {
        try {
            stream.println(JsonUtils.prettyWriter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed writing output", e);
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not read logging.properties: " + e.getMessage());
        }
    }
}
