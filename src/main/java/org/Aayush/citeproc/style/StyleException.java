package org.Aayush.citeproc.style;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.citeproc.error.ReasonCodedException;

/**
 * Fatal style error with a deterministic reason code and the offending element's identity.
 */
@Getter
@Accessors(fluent = true)
public final class StyleException extends ReasonCodedException {
    public static final String REASON_UNDEFINED_MACRO = "STYLE_UNDEFINED_MACRO";
    public static final String REASON_UNDEFINED_TERM = "STYLE_UNDEFINED_TERM";
    public static final String REASON_MACRO_CYCLE = "STYLE_MACRO_CYCLE";
    public static final String REASON_INVALID_NESTING = "STYLE_INVALID_NESTING";
    public static final String REASON_LAYOUT_REQUIRED = "STYLE_LAYOUT_REQUIRED";

    /** Offending element description, nullable. */
    private final String element;

    /**
     * Creates a reason-coded style failure.
     *
     * @param reasonCode deterministic reason code.
     * @param element offending element description, nullable.
     * @param message descriptive error message.
     */
    public StyleException(String reasonCode, String element, String message) {
        super(reasonCode, element == null || message == null ? message : message + " at " + element, null);
        this.element = element;
    }
}
