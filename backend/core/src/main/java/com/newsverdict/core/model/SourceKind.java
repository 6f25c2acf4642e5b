package com.newsverdict.core.model;

public enum SourceKind {
    API,
    SCRAPE
}
