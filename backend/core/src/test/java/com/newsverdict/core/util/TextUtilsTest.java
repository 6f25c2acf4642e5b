package com.newsverdict.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TextUtilsTest {
    @Test
    void sanitizeRemovesNulBytesAndCollapsesWhitespace() {
        assertEquals("Breaking news today", TextUtils.sanitize("  Breaking\u0000 news\n\t today  "));
        assertEquals("", TextUtils.sanitize(null));
    }

    @Test
    void normalizeForIdIgnoresCaseSpacingAndCompatibilityForms() {
        String a = TextUtils.normalizeForId("RBI  raises   repo rate");
        String b = TextUtils.normalizeForId("rbi raises repo rate ");
        String fullWidth = TextUtils.normalizeForId("ＲＢＩ raises repo rate");

        assertEquals(a, b);
        assertEquals(a, fullWidth);
    }

    @Test
    void truncateKeepsShortTextIntact() {
        assertEquals("abc", TextUtils.truncate("abc", 10));
        assertEquals("ab", TextUtils.truncate("abc", 2));
    }
}
