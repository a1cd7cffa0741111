package me.go_gradually.voicerelay.domain.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextUtilsTest {

    @Test
    void trimToLength_returnsOriginalWhenShortEnough() {
        assertEquals("abc", TextUtils.trimToLength("abc", 5));
    }

    @Test
    void trimToLength_truncatesAtMaxMinusOne() {
        assertEquals("abcd", TextUtils.trimToLength("abcdef", 5));
    }

    @Test
    void trimToLength_returnsEmptyForNull() {
        assertEquals("", TextUtils.trimToLength(null, 5));
    }

    @Test
    void countWords_splitsOnWhitespaceRuns() {
        assertEquals(3, TextUtils.countWords("  hello   there\tworld "));
        assertEquals(0, TextUtils.countWords("   "));
        assertEquals(0, TextUtils.countWords(null));
    }

    @Test
    void isBlank_treatsNullAndWhitespaceAsBlank() {
        assertTrue(TextUtils.isBlank(null));
        assertTrue(TextUtils.isBlank(" \t"));
        assertFalse(TextUtils.isBlank("a"));
    }
}
