package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

/**
 * {@code <date-part>}: one component of a date rendering.
 */
@Value
@Builder(toBuilder = true)
public class DatePart {
    Name name;
    /** Null means the part default (long month, numeric day). */
    Form form;
    /** Delimiter used when this part differs across a date range, nullable. */
    String rangeDelimiter;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    public static DatePart of(Name name) {
        return DatePart.builder().name(name).build();
    }

    public static DatePart of(Name name, Form form) {
        return DatePart.builder().name(name).form(form).build();
    }

    /**
     * Returns this part with the inline override's non-default attributes applied.
     */
    public DatePart overriddenBy(DatePart inline) {
        if (inline == null) {
            return this;
        }
        DatePartBuilder builder = toBuilder();
        if (inline.form != null) {
            builder.form(inline.form);
        }
        if (inline.rangeDelimiter != null) {
            builder.rangeDelimiter(inline.rangeDelimiter);
        }
        if (inline.formatting != null && !Formatting.EMPTY.equals(inline.formatting)) {
            builder.formatting(inline.formatting);
        }
        return builder.build();
    }

    public enum Name {
        YEAR,
        MONTH,
        DAY
    }

    public enum Form {
        LONG,
        SHORT,
        NUMERIC,
        NUMERIC_LEADING_ZEROS,
        ORDINAL
    }
}
