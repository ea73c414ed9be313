package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.locale.LocalizedDateFormat;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.reference.CslDate;
import org.Aayush.citeproc.reference.DateParts;
import org.Aayush.citeproc.style.DateElement;
import org.Aayush.citeproc.style.DatePart;
import org.Aayush.citeproc.style.TermForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates {@code <date>}: localized and inline parts, seasons, eras and collapsed ranges.
 */
final class DateFormatter {
    static final String DEFAULT_RANGE_DELIMITER = "–";
    private static final int FIRST_SEASON = 21;
    private static final int LAST_SEASON = 24;

    private final Evaluator evaluator;

    DateFormatter(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    Output evaluate(DateElement element, EvalContext ctx) {
        String variable = element.getVariable();
        CslDate date = ctx.reference().date(variable);
        if (date == null) {
            ctx.tracker().record(variable, false);
            ctx.diagnostics().warn(Diagnostic.CODE_MISSING_VARIABLE, ctx.referenceId(),
                    "missing date variable '" + variable + "'");
            return Output.nullOutput();
        }
        if (ctx.mode() == EvalMode.SORT) {
            String key = SortKeys.date(date);
            ctx.tracker().record(variable, key != null);
            return Output.literal(key);
        }
        Output body;
        boolean showsYear;
        if (date.hasLiteral()) {
            body = Output.literal(date.getLiteral());
            showsYear = true;
        } else if (date.startParts() == null) {
            body = Output.literal(date.getRaw());
            showsYear = true;
        } else {
            String[] delimiter = new String[1];
            List<DatePart> parts = resolveParts(element, ctx, delimiter);
            DateParts end = date.endParts();
            body = end == null
                    ? Output.formatted(Formatting.delimited(delimiter[0]), renderEach(date.startParts(), parts, ctx, false))
                    : renderRange(date.startParts(), end, parts, delimiter[0], ctx);
            showsYear = parts.stream().anyMatch(part -> part.getName() == DatePart.Name.YEAR);
        }
        ctx.tracker().record(variable, !body.isNull());
        if (body.isNull()) {
            return body;
        }
        if (showsYear) {
            body = withImplicitYearSuffix(body, ctx);
        }
        return Output.tagged(Tag.date(variable), Output.formatted(element.getFormatting(), List.of(body)));
    }

    private List<DatePart> resolveParts(DateElement element, EvalContext ctx, String[] delimiter) {
        List<DatePart> parts = new ArrayList<>();
        LocalizedDateFormat localized = element.getForm() == null ? null : ctx.locale().dateFormat(element.getForm());
        if (localized != null) {
            for (DatePart part : localized.getParts()) {
                if (element.getDateParts().includes(part.getName())) {
                    parts.add(part.overriddenBy(inlinePart(element, part.getName())));
                }
            }
            delimiter[0] = element.getDelimiter() != null ? element.getDelimiter() : localized.getDelimiter();
        } else {
            parts.addAll(element.getParts());
            delimiter[0] = element.getDelimiter();
        }
        if (parts.isEmpty()) {
            parts.add(DatePart.of(DatePart.Name.YEAR));
        }
        return parts;
    }

    private static DatePart inlinePart(DateElement element, DatePart.Name name) {
        for (DatePart part : element.getParts()) {
            if (part.getName() == name) {
                return part;
            }
        }
        return null;
    }

    /**
     * Renders a range by collapsing the parts both ends share: only the contiguous block of
     * differing parts is repeated around the range delimiter.
     */
    private Output renderRange(DateParts start, DateParts end, List<DatePart> parts, String delimiter, EvalContext ctx) {
        int low = -1;
        int high = -1;
        DatePart widest = null;
        for (int i = 0; i < parts.size(); i++) {
            DatePart part = parts.get(i);
            if (!Objects.equals(component(start, part.getName()), component(end, part.getName()))) {
                low = low < 0 ? i : low;
                high = i;
                if (widest == null || part.getName().ordinal() < widest.getName().ordinal()) {
                    widest = part;
                }
            }
        }
        if (widest == null) {
            return Output.formatted(Formatting.delimited(delimiter), renderEach(start, parts, ctx, false));
        }
        if (widest.getName() == DatePart.Name.YEAR) {
            low = 0;
            high = parts.size() - 1;
        }
        String rangeDelimiter = widest.getRangeDelimiter() == null ? DEFAULT_RANGE_DELIMITER : widest.getRangeDelimiter();
        List<DatePart> block = parts.subList(low, high + 1);
        Output range = Output.formatted(Formatting.delimited(rangeDelimiter), List.of(
                Output.formatted(Formatting.delimited(delimiter), renderEach(start, block, ctx, true)),
                Output.formatted(Formatting.delimited(delimiter), renderEach(end, block, ctx, false))));

        List<Output> all = new ArrayList<>(renderEach(start, parts.subList(0, low), ctx, false));
        all.add(range);
        all.addAll(renderEach(start, parts.subList(high + 1, parts.size()), ctx, false));
        return Output.formatted(Formatting.delimited(delimiter), all);
    }

    private List<Output> renderEach(DateParts date, List<DatePart> parts, EvalContext ctx, boolean dropLastSuffix) {
        List<String> values = new ArrayList<>(parts.size());
        int last = -1;
        for (int i = 0; i < parts.size(); i++) {
            String value = partValue(parts.get(i), date, ctx);
            values.add(value);
            if (value != null) {
                last = i;
            }
        }
        List<Output> outputs = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            if (values.get(i) == null) {
                continue;
            }
            Formatting formatting = parts.get(i).getFormatting();
            if (dropLastSuffix && i == last) {
                formatting = formatting.toBuilder().suffix(null).build();
            }
            outputs.add(Output.formatted(formatting, List.of(Output.literal(values.get(i)))));
        }
        return outputs;
    }

    private String partValue(DatePart part, DateParts date, EvalContext ctx) {
        DatePart.Form form = part.getForm();
        return switch (part.getName()) {
            case YEAR -> date.year() == null ? null : yearText(date.year(), form, ctx);
            case MONTH -> date.month() == null ? null : monthText(date.month(), form, ctx);
            case DAY -> date.day() == null || date.month() == null ? null : dayText(date.day(), form, ctx);
        };
    }

    private String yearText(int year, DatePart.Form form, EvalContext ctx) {
        if (year < 0) {
            return -year + evaluator.resolveTerm("bc", TermForm.LONG, false, ctx, "date-part[year]");
        }
        if (form == DatePart.Form.SHORT) {
            return String.format("%02d", year % 100);
        }
        if (year < 1000) {
            return year + evaluator.resolveTerm("ad", TermForm.LONG, false, ctx, "date-part[year]");
        }
        return Integer.toString(year);
    }

    private String monthText(int month, DatePart.Form form, EvalContext ctx) {
        if (month >= FIRST_SEASON && month <= LAST_SEASON) {
            return evaluator.resolveTerm(String.format("season-%02d", month - 20), TermForm.LONG, false, ctx,
                    "date-part[month]");
        }
        if (month < 1 || month > 12) {
            return null;
        }
        DatePart.Form effective = form == null ? DatePart.Form.LONG : form;
        return switch (effective) {
            case NUMERIC -> Integer.toString(month);
            case NUMERIC_LEADING_ZEROS -> String.format("%02d", month);
            case SHORT -> evaluator.resolveTerm(String.format("month-%02d", month), TermForm.SHORT, false, ctx,
                    "date-part[month]");
            case LONG, ORDINAL -> evaluator.resolveTerm(String.format("month-%02d", month), TermForm.LONG, false, ctx,
                    "date-part[month]");
        };
    }

    private String dayText(int day, DatePart.Form form, EvalContext ctx) {
        DatePart.Form effective = form == null ? DatePart.Form.NUMERIC : form;
        return switch (effective) {
            case NUMERIC_LEADING_ZEROS -> String.format("%02d", day);
            case ORDINAL -> ctx.locale().limitDayOrdinalsToDay1() && day != 1
                    ? Integer.toString(day)
                    : NumberFormatter.ordinal(day, ctx.locale());
            default -> Integer.toString(day);
        };
    }

    private Output withImplicitYearSuffix(Output body, EvalContext ctx) {
        int suffix = ctx.hints().getYearSuffix();
        if (suffix == 0 || !ctx.implicitYearSuffix() || ctx.mode() == EvalMode.SORT || ctx.state().yearSuffixRendered()) {
            return body;
        }
        ctx.state().markYearSuffixRendered();
        return Output.sequence(List.of(body, evaluator.yearSuffix(suffix)));
    }

    private static Integer component(DateParts date, DatePart.Name name) {
        return switch (name) {
            case YEAR -> date.year();
            case MONTH -> date.month();
            case DAY -> date.day();
        };
    }
}
