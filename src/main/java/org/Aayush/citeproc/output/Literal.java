package org.Aayush.citeproc.output;

import java.util.Objects;

/**
 * Rendered leaf string.
 *
 * @param text non-empty text.
 */
public record Literal(String text) implements Output {

    public Literal {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public Kind kind() {
        return Kind.LITERAL;
    }
}
