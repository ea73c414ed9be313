package org.Aayush.citeproc.sort;

import org.Aayush.citeproc.eval.EvalContext;
import org.Aayush.citeproc.eval.EvalMode;
import org.Aayush.citeproc.eval.Evaluator;
import org.Aayush.citeproc.eval.NumberFormatter;
import org.Aayush.citeproc.eval.SortKeys;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.OutputRenderer;
import org.Aayush.citeproc.render.PlainTextRenderer;
import org.Aayush.citeproc.style.SortKey;
import org.Aayush.citeproc.style.TextElement;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Orders items by layout sort keys.
 *
 * <p>Each key yields a string per item: a variable key reads the variable directly (names,
 * dates and numbers get dedicated key forms), a macro key renders the macro in
 * {@link EvalMode#SORT} mode as plain text. Empty keys sort last in both directions, and ties
 * keep the input order.</p>
 */
public final class ReferenceSorter {
    private static final String CITATION_NUMBER = "citation-number";

    private final Evaluator evaluator;
    private final PlainTextRenderer plainText = new PlainTextRenderer();

    public ReferenceSorter(Evaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Returns a sorted copy of {@code items}.
     *
     * @param items items to order.
     * @param keys sort keys, in priority order; an empty list keeps the input order.
     * @param contexts builds the evaluation context of an item; the mode is forced to SORT.
     * @param <T> item type.
     * @return sorted copy.
     */
    public <T> List<T> sort(List<T> items, List<SortKey> keys, Function<T, EvalContext> contexts) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(contexts, "contexts");
        if (keys.isEmpty() || items.size() < 2) {
            return new ArrayList<>(items);
        }
        List<Keyed<T>> keyed = new ArrayList<>(items.size());
        Collator collator = null;
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            EvalContext ctx = contexts.apply(item).toBuilder().mode(EvalMode.SORT).build();
            if (collator == null) {
                collator = collatorFor(ctx);
            }
            List<String> values = new ArrayList<>(keys.size());
            for (SortKey key : keys) {
                values.add(keyValue(key, ctx));
            }
            keyed.add(new Keyed<>(item, i, values));
        }
        keyed.sort(comparator(keys, collator));
        List<T> sorted = new ArrayList<>(keyed.size());
        for (Keyed<T> entry : keyed) {
            sorted.add(entry.item());
        }
        return sorted;
    }

    /**
     * Computes one key value, null when empty.
     */
    String keyValue(SortKey key, EvalContext ctx) {
        if (key.getMacro() != null) {
            Output output = evaluator.evaluate(TextElement.macro(key.getMacro()), ctx);
            String text = new OutputRenderer<>(plainText, ctx.locale()).render(output);
            return SortKeys.text(text);
        }
        String variable = key.getVariable();
        Reference reference = ctx.reference();
        if (CITATION_NUMBER.equals(variable)) {
            int number = ctx.cite().getCitationNumber();
            return number > 0 ? SortKeys.number(Integer.toString(number)) : null;
        }
        List<Name> names = reference.names(variable);
        if (!names.isEmpty()) {
            return nameKey(names);
        }
        if (reference.date(variable) != null) {
            return SortKeys.date(reference.date(variable));
        }
        String value = reference.variable(variable);
        if (value == null) {
            return null;
        }
        return NumberFormatter.isNumeric(value) ? SortKeys.number(value) : SortKeys.text(value);
    }

    private static String nameKey(List<Name> names) {
        StringBuilder key = new StringBuilder();
        for (Name name : names) {
            if (key.length() > 0) {
                key.append("  ");
            }
            if (name.isLiteral()) {
                key.append(name.getLiteral());
                continue;
            }
            key.append(nullToEmpty(name.getFamily()))
                    .append(' ').append(nullToEmpty(name.getNonDroppingParticle()))
                    .append(' ').append(nullToEmpty(name.getDroppingParticle()))
                    .append(' ').append(nullToEmpty(name.getGiven()));
        }
        return SortKeys.text(key.toString());
    }

    private static <T> Comparator<Keyed<T>> comparator(List<SortKey> keys, Collator collator) {
        return (left, right) -> {
            for (int i = 0; i < keys.size(); i++) {
                String a = left.values().get(i);
                String b = right.values().get(i);
                if (a == null && b == null) {
                    continue;
                }
                if (a == null) {
                    return 1;
                }
                if (b == null) {
                    return -1;
                }
                int cmp = collator.compare(a, b);
                if (cmp != 0) {
                    return keys.get(i).isDescending() ? -cmp : cmp;
                }
            }
            return Integer.compare(left.index(), right.index());
        };
    }

    private static Collator collatorFor(EvalContext ctx) {
        Collator collator = Collator.getInstance(Locale.forLanguageTag(ctx.locale().lang()));
        collator.setStrength(Collator.SECONDARY);
        return collator;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record Keyed<T>(T item, int index, List<String> values) {
    }
}
