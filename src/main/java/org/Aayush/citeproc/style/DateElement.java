package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * {@code <date>}: renders a date variable from inline parts or a localized format.
 */
@Value
@Builder
public class DateElement implements Element {
    String variable;
    /** Localized form; null for a non-localized date built from {@link #parts}. */
    Form form;
    @Builder.Default
    PartsFilter dateParts = PartsFilter.YEAR_MONTH_DAY;
    /** Inline parts, or overrides of the localized parts. */
    @Singular
    List<DatePart> parts;
    /** Delimiter between parts, nullable (localized formats supply their own). */
    String delimiter;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    @Override
    public ElementKind kind() {
        return ElementKind.DATE;
    }

    @Override
    public String describe() {
        return "date[variable=" + variable + "]";
    }

    public enum Form {
        TEXT,
        NUMERIC
    }

    public enum PartsFilter {
        YEAR,
        YEAR_MONTH,
        YEAR_MONTH_DAY;

        public boolean includes(DatePart.Name name) {
            return switch (name) {
                case YEAR -> true;
                case MONTH -> this != YEAR;
                case DAY -> this == YEAR_MONTH_DAY;
            };
        }
    }
}
