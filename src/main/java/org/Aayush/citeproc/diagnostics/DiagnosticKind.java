package org.Aayush.citeproc.diagnostics;

/**
 * Recoverable diagnostic categories. Fatal style problems are thrown, never reported here.
 */
public enum DiagnosticKind {
    /** Data problem recovered during evaluation (missing variable, non-numeric number, locale fallback). */
    DATA_WARNING,
    /** Pass budget or strategy list exhausted with ambiguity remaining. */
    DISAMBIGUATION_INCOMPLETE
}
