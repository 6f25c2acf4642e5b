package com.newsverdict.core.model;

public enum Regime {
    RULES_ONLY,
    MODEL_BACKED
}
