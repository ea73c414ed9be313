package org.Aayush.citeproc.output;

import java.util.Objects;

/**
 * Semantic marker around a subtree; renders as its child.
 *
 * @param tag marker.
 * @param child tagged content.
 */
public record Tagged(Tag tag, Output child) implements Output {

    public Tagged {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(child, "child");
    }

    @Override
    public Kind kind() {
        return Kind.TAGGED;
    }
}
