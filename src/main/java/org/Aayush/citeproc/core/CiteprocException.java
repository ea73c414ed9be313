package org.Aayush.citeproc.core;

import org.Aayush.citeproc.error.ReasonCodedException;

/**
 * Reason-coded failure of {@link CiteprocEngine}.
 */
public final class CiteprocException extends ReasonCodedException {

    public CiteprocException(String reasonCode, String message) {
        super(reasonCode, message, null);
    }

    /**
     * Creates a reason-coded engine failure with a cause, typically a {@link
     * org.Aayush.citeproc.style.StyleException} raised while validating or evaluating the style.
     */
    public CiteprocException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
