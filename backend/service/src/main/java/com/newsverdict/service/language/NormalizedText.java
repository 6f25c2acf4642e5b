package com.newsverdict.service.language;

import com.newsverdict.core.model.Language;

import java.util.Objects;

public record NormalizedText(String workingText, Language detectedLanguage, Language workingLanguage, boolean translated) {
    public NormalizedText {
        Objects.requireNonNull(workingText, "workingText is required");
        Objects.requireNonNull(detectedLanguage, "detectedLanguage is required");
        Objects.requireNonNull(workingLanguage, "workingLanguage is required");
    }

    public boolean modelSupported() {
        return detectedLanguage.isScoredDirectly();
    }
}
