package com.newsverdict.service.pipeline;

public enum ErrorKind {
    INPUT_TOO_SHORT,
    INPUT_TOO_LONG,
    SCORER_UNAVAILABLE,
    NO_RESULTS
}
