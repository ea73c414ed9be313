package org.Aayush.citeproc.output;

import java.util.List;
import java.util.Objects;

/**
 * Group whose children are joined and styled at render time.
 *
 * @param formatting formatting metadata, including the join delimiter.
 * @param children non-null children.
 */
public record Formatted(Formatting formatting, List<Output> children) implements Output {

    public Formatted {
        Objects.requireNonNull(formatting, "formatting");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public Kind kind() {
        return Kind.FORMATTED;
    }
}
