package org.Aayush.citeproc.style;

/**
 * Term forms with the CSL lookup fallback chain.
 */
public enum TermForm {
    LONG,
    SHORT,
    VERB,
    VERB_SHORT,
    SYMBOL;

    /**
     * Returns the next form to try when this one is missing, or null after {@link #LONG}.
     */
    public TermForm fallback() {
        return switch (this) {
            case VERB_SHORT -> VERB;
            case SYMBOL -> SHORT;
            case VERB, SHORT -> LONG;
            case LONG -> null;
        };
    }
}
