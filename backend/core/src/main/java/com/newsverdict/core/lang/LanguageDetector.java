package com.newsverdict.core.lang;

import com.newsverdict.core.model.Language;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Script-range and token-set language identification for the closed set in {@link Language}.
 *
 * <p>Letters are counted per Unicode script and the script with the most letters wins; a tie
 * between an Indic script and Latin goes to the Indic script, Gujarati before Devanagari. Latin
 * text is only called English when it contains English function words, so French or Spanish
 * headlines come back as {@link Language#UNKNOWN} rather than being mislabelled.
 */
public final class LanguageDetector {
    private static final int MIN_TOKENS_TO_JUDGE = 3;
    private static final Pattern LATIN_TOKEN = Pattern.compile("\\p{IsLatin}+");
    private static final Set<String> ENGLISH_MARKERS = Set.of(
            "the", "and", "of", "to", "is", "are", "was", "were", "for", "on", "with", "by", "at",
            "from", "that", "this", "it", "its", "as", "be", "has", "have", "had", "will", "after",
            "over", "says", "said", "new", "not", "but", "they", "their", "who", "which", "into",
            "amid", "than", "been", "about", "more", "you", "your", "can"
    );

    private LanguageDetector() {
    }

    public static Language detect(String text) {
        if (text == null || text.isBlank()) {
            return Language.WORKING;
        }
        ScriptCounts counts = countScripts(text);
        if (counts.total() == 0) {
            return Language.WORKING;
        }
        int indicMax = Math.max(counts.gujarati(), counts.devanagari());
        if (indicMax > 0 && indicMax >= counts.latin() && indicMax >= counts.other()) {
            return counts.gujarati() >= counts.devanagari() ? Language.GUJARATI : Language.HINDI;
        }
        if (counts.other() > counts.latin()) {
            return Language.UNKNOWN;
        }
        return looksEnglish(text) ? Language.ENGLISH : Language.UNKNOWN;
    }

    static ScriptCounts countScripts(String text) {
        int gujarati = 0;
        int devanagari = 0;
        int latin = 0;
        int other = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (!isLetterLike(codePoint)) {
                continue;
            }
            Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
            switch (script) {
                case GUJARATI -> gujarati++;
                case DEVANAGARI -> devanagari++;
                case LATIN -> latin++;
                case COMMON, INHERITED -> {
                }
                default -> other++;
            }
        }
        return new ScriptCounts(gujarati, devanagari, latin, other);
    }

    private static boolean looksEnglish(String text) {
        Matcher matcher = LATIN_TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        int tokens = 0;
        while (matcher.find()) {
            tokens++;
            if (ENGLISH_MARKERS.contains(matcher.group())) {
                return true;
            }
        }
        return tokens < MIN_TOKENS_TO_JUDGE;
    }

    // Indic vowel signs are combining marks, not letters.
    private static boolean isLetterLike(int codePoint) {
        if (Character.isLetter(codePoint)) {
            return true;
        }
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK;
    }

    record ScriptCounts(int gujarati, int devanagari, int latin, int other) {
        int total() {
            return gujarati + devanagari + latin + other;
        }
    }
}
