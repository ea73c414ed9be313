package org.Aayush.citeproc.diagnostics;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable non-fatal diagnostic returned alongside rendered output.
 */
@Value
@Builder
public class Diagnostic {
    public static final String CODE_MISSING_VARIABLE = "DATA_MISSING_VARIABLE";
    public static final String CODE_NON_NUMERIC = "DATA_NON_NUMERIC";
    public static final String CODE_LOCALE_FALLBACK = "DATA_LOCALE_FALLBACK";
    public static final String CODE_UNKNOWN_REFERENCE = "DATA_UNKNOWN_REFERENCE";
    public static final String CODE_DISAMBIGUATION_INCOMPLETE = "DISAMBIGUATION_INCOMPLETE";

    DiagnosticKind kind;
    /** Stable diagnostic code. */
    String code;
    String message;
    /** Reference the diagnostic concerns, nullable. */
    String referenceId;

    /**
     * Creates a data warning.
     */
    public static Diagnostic dataWarning(String code, String referenceId, String message) {
        return Diagnostic.builder()
                .kind(DiagnosticKind.DATA_WARNING)
                .code(code)
                .referenceId(referenceId)
                .message(message)
                .build();
    }

    /**
     * Creates a disambiguation-incomplete diagnostic.
     */
    public static Diagnostic disambiguationIncomplete(String referenceId, String message) {
        return Diagnostic.builder()
                .kind(DiagnosticKind.DISAMBIGUATION_INCOMPLETE)
                .code(CODE_DISAMBIGUATION_INCOMPLETE)
                .referenceId(referenceId)
                .message(message)
                .build();
    }
}
