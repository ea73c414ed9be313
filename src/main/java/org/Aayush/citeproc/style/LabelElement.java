package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

/**
 * {@code <label>}: renders the term matching a variable, pluralized by its content.
 */
@Value
@Builder
public class LabelElement implements Element {
    /** Variable to label; ignored inside names, where the names variable is used. */
    String variable;
    @Builder.Default
    TermForm form = TermForm.LONG;
    @Builder.Default
    Plural plural = Plural.CONTEXTUAL;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    @Override
    public ElementKind kind() {
        return ElementKind.LABEL;
    }

    @Override
    public String describe() {
        return "label[variable=" + variable + "]";
    }

    public enum Plural {
        CONTEXTUAL,
        ALWAYS,
        NEVER
    }
}
