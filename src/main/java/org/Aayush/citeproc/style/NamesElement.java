package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * {@code <names>}: renders one or more name variables, falling back to a substitute list.
 */
@Value
@Builder
public class NamesElement implements Element {
    @Singular
    List<String> variables;
    /** Options of the {@code <name>} child; null when the element has none. */
    NameOptions name;
    /** Optional {@code <label>} child. */
    LabelElement label;
    /** True when the label precedes the names. */
    boolean labelBeforeName;
    /** Ordered {@code <substitute>} children. */
    @Singular("substituteElement")
    List<Element> substitute;
    /** Formatting; the delimiter joins the lists of different variables. */
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    @Override
    public ElementKind kind() {
        return ElementKind.NAMES;
    }

    @Override
    public String describe() {
        return "names[variable=" + String.join(" ", variables) + "]";
    }
}
