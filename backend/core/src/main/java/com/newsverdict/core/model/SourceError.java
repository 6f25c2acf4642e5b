package com.newsverdict.core.model;

import java.util.Objects;

public record SourceError(SourceErrorKind kind, String message) {
    public SourceError {
        Objects.requireNonNull(kind, "kind is required");
        message = message == null ? kind.name() : message;
    }

    public static SourceError of(SourceErrorKind kind, String message) {
        return new SourceError(kind, message);
    }
}
