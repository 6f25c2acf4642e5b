package com.newsverdict.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Language {
    ENGLISH("en", "English"),
    HINDI("hi", "Hindi"),
    GUJARATI("gu", "Gujarati"),
    UNKNOWN("und", "Unknown");

    public static final Language WORKING = ENGLISH;

    private final String code;
    private final String displayName;

    Language(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isWorkingLanguage() {
        return this == WORKING;
    }

    public boolean isScoredDirectly() {
        return this == WORKING || this == UNKNOWN;
    }

    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String lowered = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(lowered) || language.name().equalsIgnoreCase(lowered)) {
                return language;
            }
        }
        return UNKNOWN;
    }
}
