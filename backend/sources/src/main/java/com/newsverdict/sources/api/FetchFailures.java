package com.newsverdict.sources.api;

import com.newsverdict.core.model.SourceError;
import com.newsverdict.core.model.SourceErrorKind;

import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

public final class FetchFailures {
    private FetchFailures() {
    }

    public static SourceError fromThrowable(Throwable error) {
        Throwable root = rootCause(error);
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException) {
            return SourceError.of(SourceErrorKind.TIMEOUT, "Request timed out");
        }
        String rootText = rootMessage(root);
        if (rootText.toLowerCase(Locale.ROOT).contains("timed out")) {
            return SourceError.of(SourceErrorKind.TIMEOUT, "Request timed out: " + rootText);
        }
        return SourceError.of(SourceErrorKind.NETWORK, "Fetch failure: " + rootText);
    }

    public static SourceError fromStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return null;
        }
        if (statusCode == 401 || statusCode == 403) {
            return SourceError.of(SourceErrorKind.UNAUTHORIZED, "HTTP status " + statusCode);
        }
        if (statusCode == 429) {
            return SourceError.of(SourceErrorKind.RATE_LIMITED, "HTTP status 429");
        }
        return SourceError.of(SourceErrorKind.NETWORK, "HTTP status " + statusCode);
    }

    public static String rootMessage(Throwable throwable) {
        Throwable root = rootCause(throwable);
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
