package org.Aayush.citeproc.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Formatting-deferred evaluation result.
 *
 * <p>The node set is closed: {@link NullOutput}, {@link Literal}, {@link Formatted},
 * {@link Linked}, {@link InNote} and {@link Tagged}. Build nodes through the static factories,
 * which enforce the emptiness rules:</p>
 * <ul>
 * <li>an empty literal is {@code Null};</li>
 * <li>{@code Null} children are dropped, and a group left without children is {@code Null};</li>
 * <li>tagging or linking {@code Null} yields {@code Null}.</li>
 * </ul>
 */
public interface Output {

    /**
     * Returns the node kind for exhaustive switches.
     */
    Kind kind();

    /**
     * Returns true for the {@code Null} node.
     */
    default boolean isNull() {
        return kind() == Kind.NULL;
    }

    static Output nullOutput() {
        return NullOutput.INSTANCE;
    }

    static Output literal(String text) {
        if (text == null || text.isEmpty()) {
            return NullOutput.INSTANCE;
        }
        return new Literal(text);
    }

    /**
     * Creates a formatted group, dropping {@code Null} children.
     */
    static Output formatted(Formatting formatting, List<Output> children) {
        List<Output> kept = nonNull(children);
        if (kept.isEmpty()) {
            return NullOutput.INSTANCE;
        }
        return new Formatted(formatting == null ? Formatting.EMPTY : formatting, kept);
    }

    /**
     * Creates an unformatted sequence; a single surviving child is returned unwrapped.
     */
    static Output sequence(List<Output> children) {
        List<Output> kept = nonNull(children);
        if (kept.isEmpty()) {
            return NullOutput.INSTANCE;
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        return new Formatted(Formatting.EMPTY, kept);
    }

    static Output linked(String target, List<Output> children) {
        List<Output> kept = nonNull(children);
        if (kept.isEmpty()) {
            return NullOutput.INSTANCE;
        }
        if (target == null || target.isBlank()) {
            return sequence(kept);
        }
        return new Linked(target, kept);
    }

    static Output inNote(Output child) {
        if (child == null || child.isNull()) {
            return NullOutput.INSTANCE;
        }
        return new InNote(child);
    }

    static Output tagged(Tag tag, Output child) {
        if (child == null || child.isNull()) {
            return NullOutput.INSTANCE;
        }
        return new Tagged(Objects.requireNonNull(tag, "tag"), child);
    }

    private static List<Output> nonNull(List<Output> children) {
        Objects.requireNonNull(children, "children");
        List<Output> kept = new ArrayList<>(children.size());
        for (Output child : children) {
            if (child != null && !child.isNull()) {
                kept.add(child);
            }
        }
        return kept;
    }

    enum Kind {
        NULL,
        LITERAL,
        FORMATTED,
        LINKED,
        IN_NOTE,
        TAGGED
    }
}
