package org.Aayush.citeproc.reference;

import lombok.Builder;
import lombok.Value;

/**
 * Date variable value: a single date, a range, a literal, or an unparsed raw string.
 */
@Value
@Builder
public class CslDate {
    /** Start endpoint, nullable for literal or raw dates. */
    DateParts start;
    /** End endpoint for ranges, nullable. */
    DateParts end;
    /** Season 1..4 applied when the start has no month, nullable. */
    Integer season;
    /** True for approximate dates ("circa"). */
    boolean circa;
    /** Verbatim text that always wins over structured parts. */
    String literal;
    /** Unparsed fallback text. */
    String raw;

    public static CslDate of(int year) {
        return CslDate.builder().start(DateParts.ofYear(year)).build();
    }

    public static CslDate of(int year, int month, int day) {
        return CslDate.builder().start(new DateParts(year, month, day)).build();
    }

    public static CslDate range(DateParts start, DateParts end) {
        return CslDate.builder().start(start).end(end).build();
    }

    public static CslDate literal(String literal) {
        return CslDate.builder().literal(literal).build();
    }

    /**
     * Returns structured start parts with the season folded into the month, or null.
     */
    public DateParts startParts() {
        if (start == null || start.isEmpty()) {
            return null;
        }
        if (season != null && start.month() == null) {
            return new DateParts(start.year(), 20 + season, start.day());
        }
        return start;
    }

    /**
     * Returns structured end parts when this is a real range, or null.
     */
    public DateParts endParts() {
        if (end == null || end.isEmpty() || end.equals(start)) {
            return null;
        }
        return end;
    }

    /**
     * Returns true when a literal is present.
     */
    public boolean hasLiteral() {
        return literal != null && !literal.isBlank();
    }
}
