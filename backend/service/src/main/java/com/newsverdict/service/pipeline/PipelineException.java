package com.newsverdict.service.pipeline;

import java.util.Objects;

public class PipelineException extends RuntimeException {
    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
    }

    public ErrorKind kind() {
        return kind;
    }
}
