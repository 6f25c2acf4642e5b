package com.newsverdict.service.config;

import com.newsverdict.core.model.SourceKind;
import com.newsverdict.service.scoring.FabricationModel;
import com.newsverdict.sources.api.SourceAdapter;
import com.newsverdict.sources.config.ScrapeSourceConfig;
import com.newsverdict.sources.config.SourcesConfig;
import com.newsverdict.sources.structured.NewsApiSource;
import com.newsverdict.sources.structured.NewsDataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.newsverdict.sources.support.FixtureUtils.fixturePath;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @TempDir
    Path emptyDir;

    @Test
    void loadsSourcesWithDefaults() {
        SourcesConfig config = ConfigLoader.loadSources(fixturePath("config/valid"));

        assertEquals(Duration.ofSeconds(3), config.deadline());
        assertEquals(Duration.ofSeconds(3), config.requestTimeout());
        assertEquals(10, config.perSourceLimit());
        assertEquals(SourcesConfig.DEFAULT_MAX_ARTICLES, config.maxArticles());
        assertEquals("newsapi", config.apis().get(0).provider());
        assertEquals("India", config.apis().get(0).genericQueryTerm());

        ScrapeSourceConfig divya = config.scrapers().get(0);
        assertEquals(ScrapeSourceConfig.DEFAULT_MAX_ITEMS, divya.maxItems());
        assertEquals(Set.of("gujarat"), divya.regions());
        assertEquals("gu", divya.languageHint().code());
    }

    @Test
    void buildsAdaptersApiFirstInConfiguredOrder() {
        SourcesConfig config = ConfigLoader.loadSources(fixturePath("config/valid"));

        List<SourceAdapter> adapters = ConfigLoader.buildAdapters(config, Map.of("NEWSAPI_KEY", "k1")::get);

        assertEquals(List.of("newsapi", "newsdata", "divya"), adapters.stream().map(SourceAdapter::name).toList());
        assertInstanceOf(NewsApiSource.class, adapters.get(0));
        assertInstanceOf(NewsDataSource.class, adapters.get(1));
        assertEquals(SourceKind.SCRAPE, adapters.get(2).kind());
    }

    @Test
    void unknownProviderFailsFast() {
        SourcesConfig config = ConfigLoader.loadSources(fixturePath("config/unknown-provider"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ConfigLoader.buildAdapters(config, name -> null));
        assertTrue(ex.getMessage().contains("gnews"));
    }

    @Test
    void malformedSourcesFileNamesThePath() {
        Path dir = fixturePath("config/broken");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(ex.getMessage().contains(dir.resolve("sources.json").toString()));
    }

    @Test
    void missingSourcesFileFails() {
        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(emptyDir));
    }

    @Test
    void loadsPipelineSettings() {
        PipelineConfig config = ConfigLoader.loadPipeline(fixturePath("config/valid"));

        assertEquals(Duration.ofMinutes(2), config.cacheTtl());
        assertEquals(50, config.cacheMaxSize());
        assertEquals(0.75, config.minCoverage(), 1e-9);
        assertEquals(PipelineConfig.DEFAULT_HEADLINE_MODEL, config.headlineModel());
        assertNull(config.articleModel());
    }

    @Test
    void missingPipelineFileMeansDefaults() {
        assertEquals(PipelineConfig.defaults(), ConfigLoader.loadPipeline(emptyDir));
        assertEquals(Duration.ofMinutes(5), PipelineConfig.defaults().cacheTtl());
    }

    @Test
    void invalidPipelineValueFailsFast() {
        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadPipeline(fixturePath("config/broken")));
    }

    @Test
    void modelsLoadFromClasspathOrConfigDirectory() {
        FabricationModel bundled = ConfigLoader.loadModel(PipelineConfig.DEFAULT_HEADLINE_MODEL, emptyDir);
        FabricationModel fromFile = ConfigLoader.loadModel("tiny-model.json", fixturePath("config/model-file"));

        assertTrue(bundled.probabilityFake("shocking hoax") > 0.5);
        assertEquals(1.0 / (1.0 + Math.exp(-3.0)), fromFile.probabilityFake("hoax"), 1e-9);
        assertNull(ConfigLoader.loadModel(" ", emptyDir));
        assertThrows(IllegalStateException.class, () -> ConfigLoader.loadModel("missing.json", emptyDir));
    }
}
