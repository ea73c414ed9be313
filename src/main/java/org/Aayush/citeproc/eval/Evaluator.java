package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.locale.BuiltInLocales;
import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.reference.CitationLabel;
import org.Aayush.citeproc.style.ChooseBranch;
import org.Aayush.citeproc.style.ChooseElement;
import org.Aayush.citeproc.style.DateElement;
import org.Aayush.citeproc.style.Element;
import org.Aayush.citeproc.style.GroupElement;
import org.Aayush.citeproc.style.LabelElement;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.NamesElement;
import org.Aayush.citeproc.style.NumberElement;
import org.Aayush.citeproc.style.StyleException;
import org.Aayush.citeproc.style.StyleOptions;
import org.Aayush.citeproc.style.TermForm;
import org.Aayush.citeproc.style.TextElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns style elements into {@link Output} trees for one reference.
 *
 * <p>Evaluation is pure with respect to the reference, style and locale; the only effects are
 * on the context's per-item render state and diagnostics. Undefined macros, undefined terms and
 * runaway macro recursion raise {@link StyleException}; missing or malformed data yields
 * {@code Null} (or the raw text) plus a data warning.</p>
 */
public final class Evaluator {
    public static final int MAX_MACRO_DEPTH = 64;

    static final String YEAR_SUFFIX = "year-suffix";
    static final String CITATION_NUMBER = "citation-number";
    static final String FIRST_REFERENCE_NOTE_NUMBER = "first-reference-note-number";
    static final String PAGE = "page";
    static final String TITLE = "title";
    static final String URL = "URL";
    static final String DOI = "DOI";
    static final String DOI_RESOLVER = "https://doi.org/";

    private final NamesEvaluator names;
    private final DateFormatter dates;
    private final ConditionEvaluator conditions;

    public Evaluator() {
        this.names = new NamesEvaluator(this);
        this.dates = new DateFormatter(this);
        this.conditions = new ConditionEvaluator();
    }

    /**
     * Evaluates a layout's elements as one unformatted sequence. The layout's own formatting is
     * applied by the caller, per item or per citation.
     */
    public Output evaluateLayout(Layout layout, EvalContext ctx) {
        Objects.requireNonNull(layout, "layout");
        return Output.formatted(Formatting.EMPTY, evaluateAll(layout.getElements(), ctx));
    }

    public List<Output> evaluateAll(List<Element> elements, EvalContext ctx) {
        List<Output> outputs = new ArrayList<>(elements.size());
        for (Element element : elements) {
            outputs.add(evaluate(element, ctx));
        }
        return outputs;
    }

    /**
     * Evaluates one element.
     *
     * @throws StyleException when the element refers to an undefined macro or term.
     */
    public Output evaluate(Element element, EvalContext ctx) {
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(ctx, "ctx");
        return switch (element.kind()) {
            case TEXT -> evaluateText((TextElement) element, ctx);
            case NUMBER -> evaluateNumber((NumberElement) element, ctx);
            case LABEL -> evaluateLabel((LabelElement) element, ctx);
            case NAMES -> names.evaluate((NamesElement) element, ctx);
            case DATE -> dates.evaluate((DateElement) element, ctx);
            case GROUP -> evaluateGroup((GroupElement) element, ctx);
            case CHOOSE -> evaluateChoose((ChooseElement) element, ctx);
        };
    }

    private Output evaluateText(TextElement text, EvalContext ctx) {
        return switch (text.getSource()) {
            case VARIABLE -> evaluateTextVariable(text, ctx);
            case MACRO -> evaluateMacro(text, ctx);
            case TERM -> {
                String value = resolveTerm(text.getValue(), text.getForm(), text.isPlural(), ctx, text.describe());
                yield Output.tagged(Tag.term(text.getValue()),
                        Output.formatted(text.getFormatting(), List.of(Output.literal(value))));
            }
            case VALUE -> Output.formatted(text.getFormatting(), List.of(Output.literal(text.getValue())));
        };
    }

    /**
     * A macro call behaves as an implicit group: it is suppressed when it consulted variables
     * and all of them were empty.
     */
    private Output evaluateMacro(TextElement text, EvalContext ctx) {
        List<Element> body = ctx.style().macro(text.getValue());
        if (body == null) {
            throw new StyleException(StyleException.REASON_UNDEFINED_MACRO, text.describe(),
                    "undefined macro '" + text.getValue() + "'");
        }
        if (ctx.macroDepth() >= MAX_MACRO_DEPTH) {
            throw new StyleException(StyleException.REASON_MACRO_CYCLE, text.describe(),
                    "macro nesting exceeds " + MAX_MACRO_DEPTH);
        }
        VariableTracker scope = new VariableTracker();
        List<Output> outputs = evaluateAll(body, ctx.enterMacro().withTracker(scope));
        scope.mergeInto(ctx.tracker());
        if (scope.suppresses()) {
            return Output.nullOutput();
        }
        return Output.formatted(text.getFormatting(), outputs);
    }

    private Output evaluateTextVariable(TextElement text, EvalContext ctx) {
        String variable = text.getValue();
        Formatting formatting = text.getFormatting();
        switch (variable) {
            case YEAR_SUFFIX -> {
                int suffix = ctx.hints().getYearSuffix();
                ctx.tracker().record(variable, suffix > 0);
                if (suffix == 0) {
                    return Output.nullOutput();
                }
                ctx.state().markYearSuffixRendered();
                return Output.formatted(formatting, List.of(yearSuffix(suffix)));
            }
            case CITATION_NUMBER -> {
                int number = ctx.cite().getCitationNumber();
                ctx.tracker().record(variable, number > 0);
                if (number <= 0) {
                    return Output.nullOutput();
                }
                return Output.tagged(Tag.citationNumber(number),
                        Output.formatted(formatting, List.of(Output.literal(Integer.toString(number)))));
            }
            case ConditionEvaluator.LOCATOR -> {
                String locator = ctx.cite().getLocator();
                ctx.tracker().record(variable, locator != null && !locator.isBlank());
                return Output.tagged(Tag.locator(),
                        Output.formatted(formatting, List.of(Output.literal(locatorText(locator, ctx)))));
            }
            case CitationLabel.VARIABLE -> {
                return evaluateCitationLabel(formatting, ctx);
            }
            case FIRST_REFERENCE_NOTE_NUMBER -> {
                Integer note = ctx.cite().getFirstReferenceNoteNumber();
                ctx.tracker().record(variable, note != null);
                return note == null
                        ? Output.nullOutput()
                        : Output.formatted(formatting, List.of(Output.literal(note.toString())));
            }
            default -> {
                return evaluateOrdinaryVariable(text, ctx);
            }
        }
    }

    /**
     * Explicit or generated label; an implicit year suffix attaches to it ("Doe65a").
     */
    private Output evaluateCitationLabel(Formatting formatting, EvalContext ctx) {
        if (ctx.state().isQuashed(CitationLabel.VARIABLE)) {
            ctx.tracker().record(CitationLabel.VARIABLE, false);
            return Output.nullOutput();
        }
        ctx.tracker().record(CitationLabel.VARIABLE, true);
        Output label = Output.literal(CitationLabel.of(ctx.reference()));
        int suffix = ctx.hints().getYearSuffix();
        if (suffix > 0 && ctx.implicitYearSuffix() && ctx.mode() != EvalMode.SORT && !ctx.state().yearSuffixRendered()) {
            ctx.state().markYearSuffixRendered();
            label = Output.sequence(List.of(label, yearSuffix(suffix)));
        }
        return Output.formatted(formatting, List.of(label));
    }

    private Output evaluateOrdinaryVariable(TextElement text, EvalContext ctx) {
        String variable = text.getValue();
        String value = textValue(variable, text.getForm(), ctx);
        ctx.tracker().record(variable, value != null);
        if (value == null) {
            if (!ctx.state().isQuashed(variable)) {
                ctx.diagnostics().warn(Diagnostic.CODE_MISSING_VARIABLE, ctx.referenceId(),
                        "missing variable '" + variable + "'");
            }
            return Output.nullOutput();
        }
        Formatting formatting = text.getFormatting();
        return switch (variable) {
            case PAGE -> Output.formatted(formatting, List.of(Output.literal(pageText(value, ctx))));
            case TITLE -> Output.tagged(Tag.title(), Output.formatted(formatting, List.of(Output.literal(value))));
            case URL -> Output.formatted(formatting, List.of(Output.linked(value, List.of(Output.literal(value)))));
            case DOI -> Output.formatted(formatting, List.of(
                    Output.linked(doiTarget(value), List.of(Output.literal(value)))));
            default -> Output.formatted(formatting, List.of(Output.literal(value)));
        };
    }

    /**
     * Short form prefers the {@code -short} companion variable ("title-short").
     */
    private String textValue(String variable, TermForm form, EvalContext ctx) {
        if (ctx.state().isQuashed(variable)) {
            return null;
        }
        if (form == TermForm.SHORT) {
            String shortValue = ctx.reference().variable(variable + "-short");
            if (shortValue != null) {
                return shortValue;
            }
        }
        return ctx.reference().variable(variable);
    }

    private Output evaluateNumber(NumberElement number, EvalContext ctx) {
        String variable = number.getVariable();
        String value = ConditionEvaluator.LOCATOR.equals(variable)
                ? ctx.cite().getLocator()
                : textValue(variable, TermForm.LONG, ctx);
        ctx.tracker().record(variable, value != null && !value.isBlank());
        if (value == null || value.isBlank()) {
            if (!ConditionEvaluator.LOCATOR.equals(variable) && !ctx.state().isQuashed(variable)) {
                ctx.diagnostics().warn(Diagnostic.CODE_MISSING_VARIABLE, ctx.referenceId(),
                        "missing number variable '" + variable + "'");
            }
            return Output.nullOutput();
        }
        if (!NumberFormatter.isNumeric(value)) {
            ctx.diagnostics().warn(Diagnostic.CODE_NON_NUMERIC, ctx.referenceId(),
                    "variable '" + variable + "' is not numeric: " + value);
            return Output.formatted(number.getFormatting(), List.of(Output.literal(value)));
        }
        if (ctx.mode() == EvalMode.SORT) {
            return Output.literal(SortKeys.number(value));
        }
        CslLocale locale = ctx.locale();
        String delimiter = locale.pageRangeDelimiter();
        String text = switch (number.getForm()) {
            case NUMERIC -> isPageLike(variable, ctx)
                    ? pageText(value, ctx)
                    : NumberFormatter.formatRanges(value, delimiter, null);
            case ORDINAL -> NumberFormatter.transformNumbers(value, delimiter, n -> NumberFormatter.ordinal(n, locale));
            case LONG_ORDINAL -> NumberFormatter.transformNumbers(value, delimiter,
                    n -> NumberFormatter.longOrdinal(n, locale));
            case ROMAN -> NumberFormatter.transformNumbers(value, delimiter, NumberFormatter::roman);
        };
        Output output = Output.formatted(number.getFormatting(), List.of(Output.literal(text)));
        return ConditionEvaluator.LOCATOR.equals(variable) ? Output.tagged(Tag.locator(), output) : output;
    }

    private Output evaluateLabel(LabelElement label, EvalContext ctx) {
        String variable = label.getVariable();
        boolean locator = ConditionEvaluator.LOCATOR.equals(variable);
        String value = locator ? ctx.cite().getLocator() : textValue(variable, TermForm.LONG, ctx);
        if (value == null || value.isBlank()) {
            return Output.nullOutput();
        }
        String termName = locator ? ctx.cite().effectiveLabel() : variable;
        boolean plural = switch (label.getPlural()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case CONTEXTUAL -> contextualPlural(variable, value);
        };
        String term = optionalTerm(termName, label.getForm(), plural, ctx);
        return Output.tagged(Tag.term(termName),
                Output.formatted(label.getFormatting(), List.of(Output.literal(term))));
    }

    private static boolean contextualPlural(String variable, String value) {
        if (variable.startsWith("number-of-")) {
            String digits = value.trim();
            return digits.matches("\\d{1,9}") && Integer.parseInt(digits) > 1;
        }
        return NumberFormatter.isPlural(value);
    }

    /**
     * A group renders nothing when it consulted variables and all were empty; otherwise its
     * non-empty children are joined by its delimiter.
     */
    private Output evaluateGroup(GroupElement group, EvalContext ctx) {
        VariableTracker scope = new VariableTracker();
        List<Output> outputs = evaluateAll(group.getElements(), ctx.withTracker(scope));
        scope.mergeInto(ctx.tracker());
        if (scope.suppresses()) {
            return Output.nullOutput();
        }
        return Output.formatted(group.getFormatting(), outputs);
    }

    private Output evaluateChoose(ChooseElement choose, EvalContext ctx) {
        for (ChooseBranch branch : choose.getBranches()) {
            if (conditions.matches(branch, ctx)) {
                return Output.sequence(evaluateAll(branch.getElements(), ctx));
            }
        }
        return Output.nullOutput();
    }

    /**
     * Resolves a term the style requires.
     *
     * @throws StyleException when neither the locale chain nor the root locale defines it.
     */
    String resolveTerm(String name, TermForm form, boolean plural, EvalContext ctx, String element) {
        String value = optionalTerm(name, form, plural, ctx);
        if (value == null) {
            throw new StyleException(StyleException.REASON_UNDEFINED_TERM, element,
                    "term '" + name + "' is not defined for locale " + ctx.locale().lang());
        }
        return value;
    }

    /**
     * Resolves a term, warning when the text comes from a locale of another language.
     *
     * @return term text, or null when no locale defines it.
     */
    String optionalTerm(String name, TermForm form, boolean plural, EvalContext ctx) {
        CslLocale locale = ctx.locale();
        CslLocale.TermLookup lookup = locale.lookup(name, form, plural);
        if (lookup == null) {
            lookup = BuiltInLocales.enUs().lookup(name, form, plural);
            if (lookup == null) {
                return null;
            }
        }
        if (!primaryLanguage(lookup.sourceLang()).equals(primaryLanguage(locale.lang()))) {
            ctx.diagnostics().warn(Diagnostic.CODE_LOCALE_FALLBACK, ctx.referenceId(),
                    "term '" + name + "' missing from " + locale.lang() + ", using " + lookup.sourceLang());
        }
        return lookup.value();
    }

    /**
     * Year-suffix letters tagged so disambiguation and renderers can find them.
     */
    Output yearSuffix(int ordinal) {
        return Output.tagged(Tag.yearSuffix(ordinal), Output.literal(NumberFormatter.yearSuffixLetters(ordinal)));
    }

    private String locatorText(String locator, EvalContext ctx) {
        if (locator == null) {
            return null;
        }
        return PAGE.equals(ctx.cite().effectiveLabel()) ? pageText(locator, ctx) : locator;
    }

    private boolean isPageLike(String variable, EvalContext ctx) {
        return PAGE.equals(variable)
                || (ConditionEvaluator.LOCATOR.equals(variable) && PAGE.equals(ctx.cite().effectiveLabel()));
    }

    private static String pageText(String value, EvalContext ctx) {
        StyleOptions.PageRangeFormat format = ctx.style().getOptions().getPageRangeFormat();
        return NumberFormatter.formatRanges(value, ctx.locale().pageRangeDelimiter(), format);
    }

    private static String doiTarget(String doi) {
        return doi.startsWith("http://") || doi.startsWith("https://") ? doi : DOI_RESOLVER + doi;
    }

    private static String primaryLanguage(String tag) {
        String lower = tag.toLowerCase(Locale.ROOT);
        int dash = lower.indexOf('-');
        return dash < 0 ? lower : lower.substring(0, dash);
    }
}
