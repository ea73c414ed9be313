package org.Aayush.citeproc.output;

import java.util.List;
import java.util.Objects;

/**
 * Hyperlink wrapper.
 *
 * @param target link target.
 * @param children linked content.
 */
public record Linked(String target, List<Output> children) implements Output {

    public Linked {
        Objects.requireNonNull(target, "target");
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    @Override
    public Kind kind() {
        return Kind.LINKED;
    }
}
