package com.newsverdict.service.language;

import com.newsverdict.core.lang.LanguageDetector;
import com.newsverdict.core.model.Language;

import java.util.Objects;
import java.util.logging.Logger;

public class LanguageNormalizer {
    private static final Logger LOGGER = Logger.getLogger(LanguageNormalizer.class.getName());

    private final Translator translator;

    public LanguageNormalizer(Translator translator) {
        this.translator = Objects.requireNonNull(translator, "translator is required");
    }

    public NormalizedText normalize(String text) {
        return normalize(text, null);
    }

    public NormalizedText normalize(String text, Language languageHint) {
        String input = text == null ? "" : text;
        Language detected = languageHint == null ? LanguageDetector.detect(input) : languageHint;
        if (detected.isScoredDirectly()) {
            return new NormalizedText(input, detected, Language.WORKING, false);
        }
        try {
            String mapped = translator.translate(input, detected, Language.WORKING);
            return new NormalizedText(mapped, detected, Language.WORKING, true);
        } catch (TranslationException | RuntimeException ex) {
            LOGGER.fine(() -> "Falling back to rules only for " + detected.displayName() + " text: " + ex.getMessage());
            return new NormalizedText(input, detected, detected, false);
        }
    }
}
