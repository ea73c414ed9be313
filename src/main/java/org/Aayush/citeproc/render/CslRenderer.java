package org.Aayush.citeproc.render;

import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * Output-format primitives used by {@link OutputRenderer}.
 *
 * <p>Implementations only wrap and join already-resolved content. Delimiters, affixes, quotes
 * and punctuation collisions are resolved by {@link OutputRenderer} before any primitive runs,
 * so every format shares the same text.</p>
 *
 * @param <R> rendered representation, for example {@link String}.
 */
public interface CslRenderer<R> {

    /**
     * Registry id of this renderer ("plain", "html").
     */
    String id();

    R empty();

    /**
     * Renders plain text, escaping it as the format requires.
     */
    R text(String text);

    R concat(List<R> parts);

    boolean isEmpty(R value);

    R fontStyle(R content, Formatting.FontStyle style);

    R fontWeight(R content, Formatting.FontWeight weight);

    R fontVariant(R content, Formatting.FontVariant variant);

    R textDecoration(R content, Formatting.TextDecoration decoration);

    R verticalAlign(R content, Formatting.VerticalAlign align);

    R display(R content, Formatting.Display display);

    R link(R content, String target);

    /**
     * Wraps content placed in a footnote.
     */
    R note(R content);
}
