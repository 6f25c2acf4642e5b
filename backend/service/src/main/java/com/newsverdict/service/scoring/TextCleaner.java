package com.newsverdict.service.scoring;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextCleaner {
    private static final Pattern URL = Pattern.compile("https?://\\S+|www\\.\\S+");
    private static final Pattern HTML_TAG = Pattern.compile("<.*?>");
    private static final Pattern EMAIL = Pattern.compile("\\S+@\\S+");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TOKEN_LENGTH = 3;

    static final Set<String> STOPWORDS = Set.of(
            "i", "me", "my", "myself", "we", "our", "ours", "ourselves", "you", "you're",
            "you've", "you'll", "you'd", "your", "yours", "yourself", "yourselves", "he",
            "him", "his", "himself", "she", "she's", "her", "hers", "herself", "it", "it's",
            "its", "itself", "they", "them", "their", "theirs", "themselves", "what", "which",
            "who", "whom", "this", "that", "that'll", "these", "those", "am", "is", "are",
            "was", "were", "be", "been", "being", "have", "has", "had", "having", "do", "does",
            "did", "doing", "a", "an", "the", "and", "but", "if", "or", "because", "as", "until",
            "while", "of", "at", "by", "for", "with", "about", "against", "between", "into",
            "through", "during", "before", "after", "above", "below", "to", "from", "up", "down",
            "in", "out", "on", "off", "over", "under", "again", "further", "then", "once"
    );

    private TextCleaner() {
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        lowered = URL.matcher(lowered).replaceAll("");
        lowered = HTML_TAG.matcher(lowered).replaceAll("");
        lowered = EMAIL.matcher(lowered).replaceAll("");
        lowered = NON_LETTER.matcher(lowered).replaceAll(" ");
        lowered = WHITESPACE.matcher(lowered).replaceAll(" ").trim();
        if (lowered.isEmpty()) {
            return "";
        }
        return Arrays.stream(lowered.split(" "))
                .filter(token -> token.length() >= MIN_TOKEN_LENGTH && !STOPWORDS.contains(token))
                .collect(Collectors.joining(" "));
    }
}
