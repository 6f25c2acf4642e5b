package com.newsverdict.core.model;

import java.util.Locale;

public enum Reliability {
    HIGH,
    MEDIUM,
    LOW;

    static final double HIGH_ABOVE = 85.0;
    static final double MEDIUM_FROM = 70.0;

    public static Reliability fromConfidence(double confidencePercent) {
        if (confidencePercent > HIGH_ABOVE) {
            return HIGH;
        }
        if (confidencePercent >= MEDIUM_FROM) {
            return MEDIUM;
        }
        return LOW;
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
