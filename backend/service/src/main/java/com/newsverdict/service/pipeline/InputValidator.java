package com.newsverdict.service.pipeline;

import com.newsverdict.core.util.TextUtils;

public final class InputValidator {
    public static final int MIN_CHARS = 10;
    public static final int MAX_CHARS = 10_000;
    static final int MIN_ALPHANUMERICS = 5;

    private InputValidator() {
    }

    public static String validate(String text) {
        String sanitized = TextUtils.sanitize(text);
        if (sanitized.length() < MIN_CHARS) {
            throw new PipelineException(ErrorKind.INPUT_TOO_SHORT,
                    "Text too short (minimum " + MIN_CHARS + " characters)");
        }
        if (sanitized.length() > MAX_CHARS) {
            throw new PipelineException(ErrorKind.INPUT_TOO_LONG,
                    "Text too long (maximum " + MAX_CHARS + " characters)");
        }
        long alphanumerics = sanitized.codePoints().filter(Character::isLetterOrDigit).count();
        if (alphanumerics < MIN_ALPHANUMERICS) {
            throw new PipelineException(ErrorKind.INPUT_TOO_SHORT,
                    "Text must contain at least " + MIN_ALPHANUMERICS + " letters or digits");
        }
        return sanitized;
    }
}
