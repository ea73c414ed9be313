package org.Aayush.citeproc.output;

import java.util.Objects;

/**
 * Content destined for a footnote.
 *
 * @param child note content.
 */
public record InNote(Output child) implements Output {

    public InNote {
        Objects.requireNonNull(child, "child");
    }

    @Override
    public Kind kind() {
        return Kind.IN_NOTE;
    }
}
