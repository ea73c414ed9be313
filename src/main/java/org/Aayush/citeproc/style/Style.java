package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable parsed style: options, macros and layouts. Shared read-only by all evaluations.
 */
@Value
@Builder(toBuilder = true)
public class Style {
    @Builder.Default
    StyleClass styleClass = StyleClass.IN_TEXT;
    @Builder.Default
    StyleOptions options = StyleOptions.defaults();
    /** Style-level inherited name options, nullable. */
    NameOptions nameOptions;
    @Singular
    Map<String, List<Element>> macros;
    Layout citation;
    /** Bibliography layout, nullable. */
    Layout bibliography;
    /** Default locale tag declared by the style, nullable. */
    String defaultLocale;

    /**
     * Returns a macro body, or null when undefined.
     */
    public List<Element> macro(String name) {
        return name == null ? null : macros.get(name);
    }

    /**
     * Returns true when any layout or macro renders the variable through a text element.
     */
    public boolean rendersVariable(String variable) {
        boolean[] found = new boolean[1];
        StyleWalker.walk(this, element -> {
            if (element.kind() == ElementKind.TEXT) {
                TextElement text = (TextElement) element;
                if (text.getSource() == TextElement.Source.VARIABLE && variable.equals(text.getValue())) {
                    found[0] = true;
                }
            }
        });
        return found[0];
    }
}
