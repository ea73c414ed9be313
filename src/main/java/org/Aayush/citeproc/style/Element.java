package org.Aayush.citeproc.style;

import org.Aayush.citeproc.output.Formatting;

/**
 * One node of an immutable style tree.
 */
public interface Element {

    ElementKind kind();

    /**
     * Returns the element formatting, never null.
     */
    Formatting getFormatting();

    /**
     * Returns a short identity used in style error messages, for example {@code text[macro=author]}.
     */
    String describe();
}
