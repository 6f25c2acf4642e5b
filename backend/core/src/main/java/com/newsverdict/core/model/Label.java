package com.newsverdict.core.model;

public enum Label {
    REAL("Real News"),
    FAKE("Fake News");

    private final String displayName;

    Label(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
