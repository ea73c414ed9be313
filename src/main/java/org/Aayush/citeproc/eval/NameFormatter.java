package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.NameOptions.DelimiterPrecedes;
import org.Aayush.citeproc.style.Position;
import org.Aayush.citeproc.style.StyleOptions.DemoteParticle;
import org.Aayush.citeproc.style.TermForm;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders one name variable's list: truncation, per-name ordering and list delimiters.
 */
final class NameFormatter {
    static final String DEFAULT_DELIMITER = ", ";
    static final String DEFAULT_SORT_SEPARATOR = ", ";
    static final String DEFAULT_ET_AL_TERM = "et-al";
    static final String ELLIPSIS = "…";

    private final Evaluator evaluator;

    NameFormatter(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Returns how many names of a list are shown, after et-al rules and hints.
     */
    int shownCount(int total, NameOptions options, EvalContext ctx) {
        if (ctx.mode() == EvalMode.SORT) {
            return total;
        }
        boolean subsequent = ctx.isCitation() && ctx.cite().getPosition() != Position.FIRST;
        Integer min = subsequent && options.getEtAlSubsequentMin() != null
                ? options.getEtAlSubsequentMin()
                : options.getEtAlMin();
        Integer useFirst = subsequent && options.getEtAlSubsequentUseFirst() != null
                ? options.getEtAlSubsequentUseFirst()
                : options.getEtAlUseFirst();
        int shown = total;
        if (min != null && useFirst != null && total >= min && useFirst < total) {
            shown = Math.max(1, useFirst);
        }
        Integer hinted = ctx.isCitation() ? ctx.hints().getEtAlNames() : null;
        if (hinted != null) {
            shown = Math.min(total, Math.max(shown, hinted));
        }
        return shown;
    }

    /**
     * Renders a name list, or {@code Null} when it is empty.
     */
    Output format(String variable, List<Name> names, NameOptions options, EvalContext ctx, String element) {
        if (names.isEmpty()) {
            return Output.nullOutput();
        }
        int total = names.size();
        int shown = shownCount(total, options, ctx);
        boolean truncated = shown < total;
        boolean useLast = truncated && Boolean.TRUE.equals(options.getEtAlUseLast()) && shown <= total - 2;
        String delimiter = options.getDelimiter() == null ? DEFAULT_DELIMITER : options.getDelimiter();

        List<Output> rendered = new ArrayList<>(shown);
        for (int i = 0; i < shown; i++) {
            rendered.add(formatName(names.get(i), i, options, ctx));
        }

        Output list;
        if (useLast) {
            Output last = Output.formatted(Formatting.delimited(" "), List.of(
                    Output.literal(ELLIPSIS),
                    formatName(names.get(total - 1), total - 1, options, ctx)));
            list = Output.formatted(Formatting.delimited(delimiter), append(rendered, last));
        } else if (truncated) {
            list = joinWithTail(rendered, etAl(options, ctx, element), delimiter,
                    precedes(options.getDelimiterPrecedesEtAl(), shown, 2, isInverted(shown - 1, options, ctx)));
        } else if (shown > 1 && options.getAnd() != null) {
            Output last = Output.formatted(Formatting.delimited(" "), List.of(
                    andTerm(options, ctx, element),
                    rendered.get(shown - 1)));
            list = joinWithTail(rendered.subList(0, shown - 1), last, delimiter,
                    precedes(options.getDelimiterPrecedesLast(), shown, 3, isInverted(shown - 2, options, ctx)));
        } else {
            list = Output.formatted(Formatting.delimited(delimiter), rendered);
        }
        Formatting nameFormatting = options.getNameFormatting() == null
                ? Formatting.EMPTY
                : options.getNameFormatting().toBuilder().delimiter(null).build();
        return Output.tagged(Tag.names(variable, names), Output.formatted(nameFormatting, List.of(list)));
    }

    /**
     * Renders one name, tagged with the name it came from.
     */
    Output formatName(Name name, int index, NameOptions options, EvalContext ctx) {
        if (name.isLiteral()) {
            return Output.tagged(Tag.name(name), Output.literal(name.getLiteral()));
        }
        NameHint hint = ctx.isCitation() ? ctx.hints().nameHint(name) : null;
        String given = givenText(name, index, options, ctx, hint);
        Output body;
        if (given == null) {
            body = part(name.familyWithParticle(), options.getFamilyFormatting());
        } else if (isInverted(index, options, ctx)) {
            body = invertedName(name, given, options, ctx);
        } else {
            String family = join(" ", name.getDroppingParticle(), name.familyWithParticle());
            body = Output.formatted(Formatting.delimited(" "), List.of(
                    part(given, options.getGivenFormatting()),
                    part(family, options.getFamilyFormatting())));
            if (hasText(name.getSuffix())) {
                body = Output.formatted(Formatting.delimited(name.isCommaSuffix() ? ", " : " "),
                        List.of(body, Output.literal(name.getSuffix())));
            }
        }
        return Output.tagged(Tag.name(name), body);
    }

    boolean isInverted(int index, NameOptions options, EvalContext ctx) {
        if (index < 0) {
            return false;
        }
        if (ctx.mode() == EvalMode.SORT) {
            return true;
        }
        NameOptions.SortOrder order = options.getNameAsSortOrder();
        return order == NameOptions.SortOrder.ALL || (order == NameOptions.SortOrder.FIRST && index == 0);
    }

    private Output invertedName(Name name, String given, NameOptions options, EvalContext ctx) {
        DemoteParticle demote = ctx.style().getOptions().getDemoteNonDroppingParticle();
        boolean demoted = ctx.mode() == EvalMode.SORT
                ? demote != DemoteParticle.NEVER
                : demote == DemoteParticle.DISPLAY_AND_SORT;
        String family = demoted ? name.getFamily() : name.familyWithParticle();
        String givenBlock = join(" ", given, name.getDroppingParticle(), demoted ? name.getNonDroppingParticle() : null);
        String separator = options.getSortSeparator() == null ? DEFAULT_SORT_SEPARATOR : options.getSortSeparator();
        List<Output> parts = new ArrayList<>(3);
        parts.add(part(family, options.getFamilyFormatting()));
        parts.add(part(givenBlock, options.getGivenFormatting()));
        if (hasText(name.getSuffix())) {
            parts.add(Output.literal(name.getSuffix()));
        }
        return Output.formatted(Formatting.delimited(separator), parts);
    }

    /**
     * Returns the given-name text to print, or null for a family-only (short) rendering.
     */
    private String givenText(Name name, int index, NameOptions options, EvalContext ctx, NameHint hint) {
        String given = name.getGiven() == null ? "" : name.getGiven();
        boolean addGiven = hint != null && hint.addsGivenName(index);
        boolean addInitials = hint != null && hint.addsInitials(index);
        boolean shortForm = options.getForm() == NameOptions.Form.SHORT;
        if (shortForm && !addGiven && !addInitials) {
            return null;
        }
        if (addGiven) {
            return given;
        }
        boolean hyphen = ctx.style().getOptions().isInitializeWithHyphen();
        String initializeWith = options.getInitializeWith();
        if (shortForm) {
            return GivenNames.initialize(given,
                    initializeWith == null ? GivenNames.DEFAULT_INITIALIZE_WITH : initializeWith, true, hyphen);
        }
        if (initializeWith != null) {
            return GivenNames.initialize(given, initializeWith, !Boolean.FALSE.equals(options.getInitialize()), hyphen);
        }
        return given;
    }

    private Output etAl(NameOptions options, EvalContext ctx, String element) {
        String termName = options.getEtAlTerm() == null ? DEFAULT_ET_AL_TERM : options.getEtAlTerm();
        String value = evaluator.resolveTerm(termName, TermForm.LONG, false, ctx, element);
        return Output.tagged(Tag.term(termName),
                Output.formatted(options.getEtAlFormatting(), List.of(Output.literal(value))));
    }

    private Output andTerm(NameOptions options, EvalContext ctx, String element) {
        TermForm form = options.getAnd() == NameOptions.And.SYMBOL ? TermForm.SYMBOL : TermForm.LONG;
        return Output.tagged(Tag.term("and"), Output.literal(evaluator.resolveTerm("and", form, false, ctx, element)));
    }

    private static Output joinWithTail(List<Output> head, Output tail, String delimiter, boolean delimiterBeforeTail) {
        if (delimiterBeforeTail) {
            return Output.formatted(Formatting.delimited(delimiter), append(head, tail));
        }
        return Output.formatted(Formatting.delimited(" "), List.of(
                Output.formatted(Formatting.delimited(delimiter), head),
                tail));
    }

    private static boolean precedes(DelimiterPrecedes rule, int count, int contextualMinimum, boolean previousInverted) {
        DelimiterPrecedes effective = rule == null ? DelimiterPrecedes.CONTEXTUAL : rule;
        return switch (effective) {
            case CONTEXTUAL -> count >= contextualMinimum;
            case AFTER_INVERTED_NAME -> previousInverted;
            case ALWAYS -> true;
            case NEVER -> false;
        };
    }

    private static Output part(String text, Formatting formatting) {
        return Output.formatted(formatting, List.of(Output.literal(text)));
    }

    private static List<Output> append(List<Output> head, Output tail) {
        List<Output> all = new ArrayList<>(head.size() + 1);
        all.addAll(head);
        all.add(tail);
        return all;
    }

    private static String join(String separator, String... parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            if (!hasText(part)) {
                continue;
            }
            if (out.length() > 0) {
                out.append(separator);
            }
            out.append(part);
        }
        return out.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
