package com.newsverdict.core.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String normalizeForId(String text) {
        String composed = Normalizer.normalize(text == null ? "" : text, Normalizer.Form.NFKC);
        return collapseWhitespace(composed.toLowerCase(Locale.ROOT));
    }

    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return collapseWhitespace(text.replace("\u0000", ""));
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
