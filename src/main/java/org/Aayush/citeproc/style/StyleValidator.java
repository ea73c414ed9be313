package org.Aayush.citeproc.style;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural checks run once when an engine is bound to a style.
 *
 * <p>Checks, each failing with a {@link StyleException}:</p>
 * <ul>
 * <li>a citation layout exists;</li>
 * <li>every macro call and macro sort key names a defined macro;</li>
 * <li>macros do not call themselves, directly or transitively;</li>
 * <li>an else branch is the last branch of its choose;</li>
 * <li>substitute lists do not nest further substitutes;</li>
 * <li>sort keys name exactly one of variable or macro.</li>
 * </ul>
 */
public final class StyleValidator {

    /**
     * Validates the style tree.
     *
     * @param style style to validate.
     * @throws StyleException when the tree is malformed.
     */
    public void validate(Style style) {
        Objects.requireNonNull(style, "style");
        if (style.getCitation() == null) {
            throw new StyleException(StyleException.REASON_LAYOUT_REQUIRED, "style", "citation layout is required");
        }
        validateSortKeys(style, style.getCitation());
        if (style.getBibliography() != null) {
            validateSortKeys(style, style.getBibliography());
        }
        StyleWalker.walk(style, element -> validateElement(style, element));
        validateMacroGraph(style);
    }

    private void validateElement(Style style, Element element) {
        switch (element.kind()) {
            case TEXT -> {
                TextElement text = (TextElement) element;
                if (text.getSource() == TextElement.Source.MACRO && style.macro(text.getValue()) == null) {
                    throw new StyleException(
                            StyleException.REASON_UNDEFINED_MACRO,
                            text.describe(),
                            "undefined macro '" + text.getValue() + "'"
                    );
                }
            }
            case CHOOSE -> {
                List<ChooseBranch> branches = ((ChooseElement) element).getBranches();
                for (int i = 0; i < branches.size() - 1; i++) {
                    if (branches.get(i).isElse()) {
                        throw new StyleException(
                                StyleException.REASON_INVALID_NESTING,
                                element.describe(),
                                "else branch must be the last branch of choose"
                        );
                    }
                }
            }
            case NAMES -> {
                for (Element substitute : ((NamesElement) element).getSubstitute()) {
                    if (substitute.kind() == ElementKind.NAMES
                            && !((NamesElement) substitute).getSubstitute().isEmpty()) {
                        throw new StyleException(
                                StyleException.REASON_INVALID_NESTING,
                                substitute.describe(),
                                "substitute must not contain a names element with its own substitute"
                        );
                    }
                }
            }
            default -> {
            }
        }
    }

    private void validateSortKeys(Style style, Layout layout) {
        for (SortKey key : layout.getSortKeys()) {
            boolean hasVariable = key.getVariable() != null && !key.getVariable().isBlank();
            boolean hasMacro = key.getMacro() != null && !key.getMacro().isBlank();
            if (hasVariable == hasMacro) {
                throw new StyleException(
                        StyleException.REASON_INVALID_NESTING,
                        key.describe(),
                        "sort key must name exactly one of variable or macro"
                );
            }
            if (hasMacro && style.macro(key.getMacro()) == null) {
                throw new StyleException(
                        StyleException.REASON_UNDEFINED_MACRO,
                        key.describe(),
                        "undefined macro '" + key.getMacro() + "'"
                );
            }
        }
    }

    private void validateMacroGraph(Style style) {
        Set<String> finished = new HashSet<>();
        for (String macro : style.getMacros().keySet()) {
            visitMacro(style, macro, new ArrayDeque<>(), finished);
        }
    }

    private void visitMacro(Style style, String macro, Deque<String> path, Set<String> finished) {
        if (finished.contains(macro)) {
            return;
        }
        if (path.contains(macro)) {
            throw new StyleException(
                    StyleException.REASON_MACRO_CYCLE,
                    "macro[" + macro + "]",
                    "macro cycle " + String.join(" -> ", path) + " -> " + macro
            );
        }
        path.addLast(macro);
        for (String callee : calledMacros(style.getMacros(), macro)) {
            visitMacro(style, callee, path, finished);
        }
        path.removeLast();
        finished.add(macro);
    }

    private Set<String> calledMacros(Map<String, List<Element>> macros, String macro) {
        Set<String> callees = new LinkedHashSet<>();
        List<Element> body = macros.get(macro);
        if (body == null) {
            return callees;
        }
        StyleWalker.walkAll(body, element -> {
            if (element.kind() == ElementKind.TEXT) {
                TextElement text = (TextElement) element;
                if (text.getSource() == TextElement.Source.MACRO) {
                    callees.add(text.getValue());
                }
            }
        });
        return callees;
    }
}
