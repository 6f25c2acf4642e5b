package com.newsverdict.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.newsverdict.core.util.JsonUtils;
import com.newsverdict.service.scoring.FabricationModel;
import com.newsverdict.service.scoring.ModelLoader;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.config.ApiSourceConfig;
import com.newsverdict.sources.config.ScrapeSourceConfig;
import com.newsverdict.sources.config.SourcesConfig;
import com.newsverdict.sources.scrape.ScrapeSource;
import com.newsverdict.sources.structured.NewsApiSource;
import com.newsverdict.sources.structured.NewsDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());
    private static final String CLASSPATH_PREFIX = "classpath:";

    private ConfigLoader() {
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        Path path = configDir.resolve("pipeline.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + "; using default pipeline settings");
            return PipelineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static SourcesConfig loadSources(Path configDir) {
        return read(configDir.resolve("sources.json"), new TypeReference<>() {
        });
    }

    public static List<SourceAdapter> buildAdapters(SourcesConfig config, Function<String, String> environment) {
        List<SourceAdapter> adapters = new ArrayList<>();
        for (ApiSourceConfig api : config.apis()) {
            String apiKey = api.apiKeyEnv() == null ? null : environment.apply(api.apiKeyEnv());
            if (apiKey == null || apiKey.isBlank()) {
                LOGGER.warning("Source " + api.name() + " has no API key in " + api.apiKeyEnv() + "; it will report UNAUTHORIZED");
            }
            adapters.add(switch (api.provider()) {
                case ApiSourceConfig.NEWSAPI -> new NewsApiSource(api, apiKey);
                case ApiSourceConfig.NEWSDATA -> new NewsDataSource(api, apiKey);
                default -> throw new IllegalStateException("Unknown provider '" + api.provider() + "' for source " + api.name());
            });
        }
        for (ScrapeSourceConfig scraper : config.scrapers()) {
            adapters.add(new ScrapeSource(scraper));
        }
        return adapters;
    }

    public static FabricationModel loadModel(String location, Path configDir) {
        if (location == null || location.isBlank()) {
            return null;
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return ModelLoader.loadResource(location.substring(CLASSPATH_PREFIX.length()));
        }
        return ModelLoader.load(configDir.resolve(location));
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
