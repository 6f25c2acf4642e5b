package com.newsverdict.service.language;

import com.fasterxml.jackson.core.type.TypeReference;
import com.newsverdict.core.model.Language;
import com.newsverdict.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class GlossaryTranslator implements Translator {
    public static final String DEFAULT_RESOURCE = "glossary/glossary.json";
    public static final double DEFAULT_MIN_COVERAGE = 0.6;

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{M}\\p{Nd}]+");

    private final Map<Language, Map<String, String>> glossaries;
    private final double minCoverage;

    public GlossaryTranslator(Map<Language, Map<String, String>> glossaries, double minCoverage) {
        if (minCoverage <= 0.0 || minCoverage > 1.0) {
            throw new IllegalArgumentException("minCoverage must be within (0,1]");
        }
        Map<Language, Map<String, String>> copy = new EnumMap<>(Language.class);
        glossaries.forEach((language, entries) -> copy.put(language, Map.copyOf(entries)));
        this.glossaries = copy;
        this.minCoverage = minCoverage;
    }

    public static GlossaryTranslator fromResource(String resource, double minCoverage) {
        try (InputStream in = GlossaryTranslator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Glossary resource not found: " + resource);
            }
            Map<String, Map<String, String>> raw = JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
            Map<Language, Map<String, String>> glossaries = new EnumMap<>(Language.class);
            raw.forEach((code, entries) -> glossaries.put(Language.fromCode(code), entries));
            return new GlossaryTranslator(glossaries, minCoverage);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading glossary from classpath:" + resource, e);
        }
    }

    @Override
    public String translate(String text, Language from, Language to) throws TranslationException {
        if (to != Language.ENGLISH) {
            throw new TranslationException("Glossary only translates into English, not " + to.displayName());
        }
        Map<String, String> glossary = glossaries.get(from);
        if (glossary == null || glossary.isEmpty()) {
            throw new TranslationException("No glossary for " + from.displayName());
        }

        List<String> output = new ArrayList<>();
        int tokens = 0;
        int covered = 0;
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            tokens++;
            String mapped = glossary.get(token.toLowerCase(Locale.ROOT));
            if (mapped != null) {
                covered++;
                if (!mapped.isEmpty()) {
                    output.add(mapped);
                }
            } else if (token.chars().allMatch(Character::isDigit)) {
                covered++;
                output.add(token);
            }
        }
        if (tokens == 0) {
            throw new TranslationException("Nothing to translate");
        }
        double coverage = (double) covered / tokens;
        if (coverage < minCoverage) {
            throw new TranslationException(String.format(Locale.ROOT,
                    "Glossary covered %.0f%% of %s tokens, need %.0f%%", coverage * 100, from.displayName(), minCoverage * 100));
        }
        return String.join(" ", output);
    }
}
