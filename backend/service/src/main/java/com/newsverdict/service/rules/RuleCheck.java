package com.newsverdict.service.rules;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public enum RuleCheck {
    UPPERCASE_RATIO {
        @Override
        double weight(String text, String lower) {
            int upper = 0;
            int cased = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (Character.isUpperCase(c)) {
                    upper++;
                    cased++;
                } else if (Character.isLowerCase(c)) {
                    cased++;
                }
            }
            if (cased < MIN_CASED_LETTERS) {
                return 0.0;
            }
            double ratio = (double) upper / cased;
            if (ratio > 0.6) {
                return -0.5;
            }
            return ratio > 0.3 ? -0.25 : 0.0;
        }
    },
    PUNCTUATION_DENSITY {
        @Override
        double weight(String text, String lower) {
            if (PUNCTUATION_RUN.matcher(text).find()) {
                return -0.4;
            }
            int words = wordCount(text);
            long marks = text.chars().filter(c -> c == '!' || c == '?').count();
            if (words > 0 && (double) marks / words > 0.2) {
                return -0.2;
            }
            return text.contains("!!") ? -0.1 : 0.0;
        }
    },
    CREDIBLE_SOURCE {
        @Override
        double weight(String text, String lower) {
            return mentionsCredibleSource(lower) ? 0.4 : 0.0;
        }
    },
    SENSATIONAL_LEXICON {
        @Override
        double weight(String text, String lower) {
            String normalized = lower.replace('’', '\'');
            if (CLICKBAIT_PHRASES.stream().anyMatch(normalized::contains)) {
                return -0.6;
            }
            long hits = SENSATIONAL_WORD.matcher(normalized).results().count()
                    + SENSATIONAL_INDIC.stream().filter(normalized::contains).count();
            return Math.max(-0.6, -0.3 * hits);
        }
    },
    QUANTITATIVE_CLAIM {
        @Override
        double weight(String text, String lower) {
            if (QUANTITY_WITH_UNIT.matcher(lower).find()) {
                return 0.25;
            }
            return DIGIT.matcher(text).find() ? 0.1 : 0.0;
        }
    },
    ATTRIBUTION {
        @Override
        double weight(String text, String lower) {
            return hasAttribution(lower) ? 0.2 : 0.0;
        }
    };

    static final int MIN_CASED_LETTERS = 12;

    static final Pattern PUNCTUATION_RUN = Pattern.compile("!{3,}|\\?{3,}");
    static final Pattern DIGIT = Pattern.compile("\\p{Nd}");
    static final Pattern PROPER_NOUN = Pattern.compile("\\b\\p{Lu}\\p{Ll}+\\b|[\\u0900-\\u097F\\u0A80-\\u0AFF]");

    static final Pattern QUANTITY_WITH_UNIT = Pattern.compile(
            "[$₹€£]\\s?\\p{Nd}"
                    + "|\\b(?:rs\\.?|inr|usd)\\s?\\p{Nd}"
                    + "|\\p{Nd}[\\p{Nd},.]*\\s?(?:%|percent\\b|per cent\\b|crore|lakh|million|billion|trillion|thousand"
                    + "|km\\b|kg\\b|tonnes?\\b|mw\\b|gw\\b|bps\\b|basis points|rupees|dollars|करोड़|लाख|કરોડ|લાખ)");

    private static final Pattern CREDIBLE_LATIN = Pattern.compile("\\b(?:"
            + "reuters|ap news|associated press|bbc|cnn|nbc|times of india|indian express|hindustan times|the hindu"
            + "|ndtv|india today|economic times|bloomberg|guardian|washington post|new york times|wall street journal"
            + "|press trust of india|pti|ani)\\b");
    private static final List<String> CREDIBLE_INDIC = List.of(
            "रॉयटर्स", "एनडीटीवी", "बीबीसी", "पीटीआई", "રોઇટર્સ", "એનડીટીવી", "બીબીસી", "પીટીઆઈ"
    );

    private static final List<String> CLICKBAIT_PHRASES = List.of(
            "you won't believe", "doctors hate this", "one weird trick", "click here now", "miracle cure",
            "what happens next will shock", "number 7 will", "share before deleted", "they don't want you to know"
    );
    private static final Pattern SENSATIONAL_WORD = Pattern.compile("\\b(?:"
            + "shocking|unbelievable|bombshell|exposed|outrageous|secret|hoax|conspiracy|miracle|banned|viral"
            + "|horrifying|jaw-dropping|mind-blowing)\\b");
    private static final List<String> SENSATIONAL_INDIC = List.of(
            "सनसनीखेज", "चौंकाने वाला", "चौंकाने वाली", "ચોંકાવનારું", "ચોંકાવનારી"
    );

    private static final List<String> ATTRIBUTION_PHRASES = List.of(
            "according to", "said in a statement", "reported by", "sources said", "announced today",
            "in an interview", "press release", "official statement", "told reporters",
            "के अनुसार", "ने कहा", "અનુસાર", "જણાવ્યું"
    );

    abstract double weight(String text, String lower);

    static boolean mentionsCredibleSource(String lower) {
        return CREDIBLE_LATIN.matcher(lower).find() || CREDIBLE_INDIC.stream().anyMatch(lower::contains);
    }

    static boolean hasAttribution(String lower) {
        return ATTRIBUTION_PHRASES.stream().anyMatch(lower::contains);
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
