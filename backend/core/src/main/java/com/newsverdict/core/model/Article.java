package com.newsverdict.core.model;

import com.newsverdict.core.lang.LanguageDetector;
import com.newsverdict.core.util.HashingUtils;
import com.newsverdict.core.util.TextUtils;

import java.time.Instant;
import java.util.Objects;

public record Article(
        String id,
        String text,
        String sourceName,
        SourceKind sourceKind,
        Instant fetchedAt,
        Language detectedLanguage
) {
    public Article {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(sourceKind, "sourceKind is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(detectedLanguage, "detectedLanguage is required");
    }

    public static Article of(String text, String sourceName, SourceKind sourceKind, Instant fetchedAt, Language languageHint) {
        String cleaned = TextUtils.collapseWhitespace(text);
        Language language = languageHint == null ? LanguageDetector.detect(cleaned) : languageHint;
        return new Article(contentId(cleaned), cleaned, sourceName, sourceKind, fetchedAt, language);
    }

    public static String contentId(String text) {
        return HashingUtils.sha256(TextUtils.normalizeForId(text));
    }
}
