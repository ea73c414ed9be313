package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * {@code <group>}: renders its children, or nothing when all consulted variables are empty.
 */
@Value
@Builder
public class GroupElement implements Element {
    @Singular
    List<Element> elements;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    public static GroupElement of(String delimiter, Element... elements) {
        return GroupElement.builder()
                .formatting(Formatting.delimited(delimiter))
                .elements(List.of(elements))
                .build();
    }

    @Override
    public ElementKind kind() {
        return ElementKind.GROUP;
    }

    @Override
    public String describe() {
        return "group[" + elements.size() + " children]";
    }
}
