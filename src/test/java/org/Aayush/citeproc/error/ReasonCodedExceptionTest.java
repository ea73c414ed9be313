package org.Aayush.citeproc.error;

import org.Aayush.citeproc.core.CiteprocEngine;
import org.Aayush.citeproc.core.CiteprocException;
import org.Aayush.citeproc.style.StyleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ReasonCodedException Tests")
class ReasonCodedExceptionTest {

    @Test
    @DisplayName("Message: engine and style failures share the bracketed reason code format")
    void testSharedMessageFormat() {
        ReasonCodedException engine = new CiteprocException(CiteprocEngine.REASON_UNKNOWN_LOCALE, "no locale for 'xx'");
        ReasonCodedException style = new StyleException(StyleException.REASON_UNDEFINED_MACRO, "text[macro=author]",
                "undefined macro 'author'");

        assertEquals("[CITEPROC_UNKNOWN_LOCALE] no locale for 'xx'", engine.getMessage());
        assertEquals("[STYLE_UNDEFINED_MACRO] undefined macro 'author' at text[macro=author]", style.getMessage());
        assertEquals(StyleException.REASON_UNDEFINED_MACRO, style.reasonCode());
    }

    @Test
    @DisplayName("Message: style failures without an element omit the location")
    void testStyleWithoutElement() {
        StyleException ex = new StyleException(StyleException.REASON_LAYOUT_REQUIRED, null, "citation layout is required");

        assertEquals("[STYLE_LAYOUT_REQUIRED] citation layout is required", ex.getMessage());
        assertNull(ex.element());
    }

    @Test
    @DisplayName("Cause: wrapped style failures stay reachable")
    void testCauseIsKept() {
        StyleException cause = new StyleException(StyleException.REASON_MACRO_CYCLE, "macro[a]", "cycle");
        CiteprocException wrapped = new CiteprocException(CiteprocEngine.REASON_STYLE_INVALID, cause.getMessage(), cause);

        assertSame(cause, wrapped.getCause());
        assertEquals(CiteprocEngine.REASON_STYLE_INVALID, wrapped.reasonCode());
    }

    @Test
    @DisplayName("Validation: blank or missing reason codes and messages are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CiteprocException(" ", "message"));
        assertThrows(NullPointerException.class, () -> new CiteprocException(null, "message"));
        assertThrows(NullPointerException.class, () -> new CiteprocException("CODE", null));
        assertThrows(NullPointerException.class, () -> new StyleException("CODE", "group", null));
    }
}
