package org.Aayush.citeproc.style;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.function.Consumer;

/**
 * Depth-first traversal over every element of a style (layouts and macro bodies).
 */
@UtilityClass
public class StyleWalker {

    /**
     * Visits every element reachable from the layouts and macros, without following macro calls.
     */
    public void walk(Style style, Consumer<Element> visitor) {
        if (style.getCitation() != null) {
            walkAll(style.getCitation().getElements(), visitor);
        }
        if (style.getBibliography() != null) {
            walkAll(style.getBibliography().getElements(), visitor);
        }
        for (List<Element> body : style.getMacros().values()) {
            walkAll(body, visitor);
        }
    }

    /**
     * Visits a list of elements and their descendants.
     */
    public void walkAll(List<Element> elements, Consumer<Element> visitor) {
        for (Element element : elements) {
            walkElement(element, visitor);
        }
    }

    private void walkElement(Element element, Consumer<Element> visitor) {
        visitor.accept(element);
        switch (element.kind()) {
            case GROUP -> walkAll(((GroupElement) element).getElements(), visitor);
            case NAMES -> walkAll(((NamesElement) element).getSubstitute(), visitor);
            case CHOOSE -> {
                for (ChooseBranch branch : ((ChooseElement) element).getBranches()) {
                    walkAll(branch.getElements(), visitor);
                }
            }
            default -> {
            }
        }
    }
}
