package com.newsverdict.service.language;

import com.newsverdict.core.model.Language;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlossaryTranslatorTest {
    private final GlossaryTranslator bundled =
            GlossaryTranslator.fromResource(GlossaryTranslator.DEFAULT_RESOURCE, GlossaryTranslator.DEFAULT_MIN_COVERAGE);

    @Test
    void translatesFullyCoveredHindi() throws TranslationException {
        assertEquals("government new education policy announcement",
                bundled.translate("सरकार ने नई शिक्षा नीति की घोषणा की", Language.HINDI, Language.ENGLISH));
    }

    @Test
    void translatesFullyCoveredGujarati() throws TranslationException {
        assertEquals("gujarat government new scheme announced",
                bundled.translate("ગુજરાત સરકારે નવી યોજના જાહેર કરી", Language.GUJARATI, Language.ENGLISH));
    }

    @Test
    void lowCoverageFails() {
        TranslationException ex = assertThrows(TranslationException.class,
                () -> bundled.translate("सरकार ने अज्ञात शब्दों वाला लंबा वाक्य लिखा", Language.HINDI, Language.ENGLISH));
        assertTrue(ex.getMessage().contains("Hindi"));
    }

    @Test
    void digitsCountAsCoveredAndPassThrough() throws TranslationException {
        GlossaryTranslator translator = new GlossaryTranslator(Map.of(Language.HINDI, Map.of("करोड़", "crore")), 1.0);

        assertEquals("500 crore", translator.translate("500 करोड़", Language.HINDI, Language.ENGLISH));
    }

    @Test
    void onlyTranslatesIntoEnglish() {
        assertThrows(TranslationException.class,
                () -> bundled.translate("सरकार", Language.HINDI, Language.GUJARATI));
    }

    @Test
    void missingGlossaryOrEmptyTextFails() {
        GlossaryTranslator hindiOnly = new GlossaryTranslator(Map.of(Language.HINDI, Map.of("सरकार", "government")), 0.5);

        assertThrows(TranslationException.class, () -> hindiOnly.translate("ગુજરાત", Language.GUJARATI, Language.ENGLISH));
        assertThrows(TranslationException.class, () -> hindiOnly.translate(" ... ", Language.HINDI, Language.ENGLISH));
    }

    @Test
    void rejectsInvalidCoverageThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new GlossaryTranslator(Map.of(), 0.0));
        assertThrows(IllegalArgumentException.class, () -> new GlossaryTranslator(Map.of(), 1.5));
    }

    @Test
    void missingResourceFailsFast() {
        assertThrows(IllegalStateException.class, () -> GlossaryTranslator.fromResource("glossary/none.json", 0.6));
    }
}
