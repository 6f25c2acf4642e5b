package com.newsverdict.service.pipeline;

import com.newsverdict.core.model.Label;
import com.newsverdict.core.model.Language;
import com.newsverdict.core.model.Reliability;

import java.util.Map;

public final class LocalizedLabels {
    private static final Map<String, Map<Language, String>> TRANSLATIONS = Map.of(
            "Fake News", Map.of(Language.HINDI, "फर्जी खबर", Language.GUJARATI, "ખોટા સમાચાર"),
            "Real News", Map.of(Language.HINDI, "सच्ची खबर", Language.GUJARATI, "સાચા સમાચાર"),
            "High", Map.of(Language.HINDI, "उच्च", Language.GUJARATI, "ઉચ્ચ"),
            "Medium", Map.of(Language.HINDI, "मध्यम", Language.GUJARATI, "મધ્યમ"),
            "Low", Map.of(Language.HINDI, "कम", Language.GUJARATI, "નીચું"),
            "Confidence", Map.of(Language.HINDI, "विश्वास", Language.GUJARATI, "વિશ્વાસ"),
            "Reliability", Map.of(Language.HINDI, "विश्वसनीयता", Language.GUJARATI, "વિશ્વસનીયતા")
    );

    private LocalizedLabels() {
    }

    public static String label(Label label, Language language) {
        return translate(label.displayName(), language);
    }

    public static String reliability(Reliability reliability, Language language) {
        return translate(reliability.displayName(), language);
    }

    public static String translate(String key, Language language) {
        Map<Language, String> byLanguage = TRANSLATIONS.get(key);
        if (byLanguage == null) {
            return key;
        }
        return byLanguage.getOrDefault(language, key);
    }
}
