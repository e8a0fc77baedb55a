package com.rulebook.runtime;

import com.rulebook.exception.EvaluationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaRuntime.
 */
class FormulaRuntimeTest {

    @Test
    @DisplayName("Should treat only Boolean.TRUE as true")
    void shouldTestIdentity() {
        assertTrue(FormulaRuntime.isTrue(Boolean.TRUE));
        assertFalse(FormulaRuntime.isTrue(null));
        assertFalse(FormulaRuntime.isTrue(1L));
        assertFalse(FormulaRuntime.isTrue("true"));
        assertEquals(Boolean.TRUE, FormulaRuntime.not(null));
    }

    @Test
    @DisplayName("Should compare integers of any width as equal values")
    void shouldNormalizeIntegers() {
        assertEquals(Boolean.TRUE, FormulaRuntime.eq(1, 1L));
        assertEquals(Boolean.TRUE, FormulaRuntime.eq(null, null));
        assertEquals(Boolean.FALSE, FormulaRuntime.eq(1L, "1"));
        assertEquals(Boolean.TRUE, FormulaRuntime.ne(null, ""));
    }

    @Test
    @DisplayName("Should return false for ordering with null")
    void shouldOrderWithNull() {
        assertEquals(Boolean.FALSE, FormulaRuntime.lt(null, 1L));
        assertEquals(Boolean.FALSE, FormulaRuntime.gte(1L, null));
        assertEquals(Boolean.TRUE, FormulaRuntime.lte("a", "b"));
    }

    @Test
    @DisplayName("Should substitute null in arithmetic")
    void shouldSubstituteNull() {
        assertEquals(5L, FormulaRuntime.add(null, 5L));
        assertEquals(0L, FormulaRuntime.multiply(null, 5L));
        assertEquals(9L, FormulaRuntime.divide(9L, 0L));
        assertEquals(9L, FormulaRuntime.divide(9L, null));
        assertEquals(-3L, FormulaRuntime.divide(-7L, 2L));
        assertEquals(0L, FormulaRuntime.negate(null));
    }

    @Test
    @DisplayName("Should render canonical text")
    void shouldRenderText() {
        assertEquals("true1x", FormulaRuntime.concat(true, 1L, null, "x"));
        assertEquals("", FormulaRuntime.concat());
        assertEquals(3L, FormulaRuntime.len(123));
    }

    @Test
    @DisplayName("Should change case independently of the default locale")
    void shouldIgnoreDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("TITLE", FormulaRuntime.upper("title"));
            assertEquals("title", FormulaRuntime.lower("TITLE"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    @DisplayName("Should find from a clamped start position")
    void shouldFind() {
        assertEquals(2L, FormulaRuntime.find("b", "abc"));
        assertEquals(0L, FormulaRuntime.find("a", "abc", 2L));
        assertEquals(1L, FormulaRuntime.find("a", "abc", -4L));
        assertEquals(0L, FormulaRuntime.find("a", null));
    }

    @Test
    @DisplayName("Should reject values outside the formula types")
    void shouldRejectUnsupportedTypes() {
        assertThrows(EvaluationException.class, () -> FormulaRuntime.add(1.5, 1L));
        assertThrows(EvaluationException.class, () -> FormulaRuntime.add(true, 1L));
        assertThrows(EvaluationException.class, () -> FormulaRuntime.lt("a", 1L));
        assertThrows(EvaluationException.class, () -> FormulaRuntime.text(new Object()));
    }
}
