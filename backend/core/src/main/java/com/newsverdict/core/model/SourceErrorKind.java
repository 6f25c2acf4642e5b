package com.newsverdict.core.model;

public enum SourceErrorKind {
    UNAUTHORIZED,
    RATE_LIMITED,
    NETWORK,
    TIMEOUT,
    EMPTY_RESULT,
    INVALID_RESPONSE
}
