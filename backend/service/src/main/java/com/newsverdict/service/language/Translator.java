package com.newsverdict.service.language;

import com.newsverdict.core.model.Language;

public interface Translator {
    String translate(String text, Language from, Language to) throws TranslationException;
}
