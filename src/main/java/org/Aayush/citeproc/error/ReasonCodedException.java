package org.Aayush.citeproc.error;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Unchecked failure carrying a deterministic reason code.
 *
 * <p>Messages read {@code [REASON_CODE] detail}, so callers can match on the code and still log
 * a readable line.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class ReasonCodedException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode deterministic reason code, non-blank.
     * @param detail descriptive error message.
     * @param cause underlying cause, nullable.
     */
    protected ReasonCodedException(String reasonCode, String detail, Throwable cause) {
        super(formatMessage(reasonCode, detail), cause);
        this.reasonCode = reasonCode;
    }

    private static String formatMessage(String reasonCode, String detail) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + code + "] " + Objects.requireNonNull(detail, "message");
    }
}
