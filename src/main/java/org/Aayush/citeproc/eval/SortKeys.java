package org.Aayush.citeproc.eval;

import lombok.experimental.UtilityClass;
import org.Aayush.citeproc.reference.CslDate;
import org.Aayush.citeproc.reference.DateParts;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparable string forms of variable values for sorting.
 */
@UtilityClass
public class SortKeys {
    private static final int YEAR_OFFSET = 100_000_000;
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern TEXT_SEPARATORS = Pattern.compile("[\\s\"“”‘’'«»,()\\[\\]]+");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");

    /**
     * Returns {@code P} followed by a 9-digit offset year and 2-digit month and day, so that
     * BC years sort before AD years; null for dates without structured parts.
     */
    public String date(CslDate date) {
        if (date == null) {
            return null;
        }
        DateParts start = date.startParts();
        if (start == null) {
            return date.hasLiteral() ? text(date.getLiteral()) : null;
        }
        int year = start.year() == null ? 0 : start.year();
        int month = start.month() == null || start.month() > 12 ? 0 : start.month();
        int day = start.day() == null ? 0 : start.day();
        return String.format(Locale.ROOT, "P%09d%02d%02d", year + YEAR_OFFSET, month, day);
    }

    /**
     * Zero-pads the first number of a numeric value; falls back to the text key.
     */
    public String number(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = FIRST_NUMBER.matcher(value);
        if (!NumberFormatter.isNumeric(value) || !matcher.find() || matcher.group().length() > 18) {
            return text(value);
        }
        return String.format(Locale.ROOT, "%019d", Long.parseLong(matcher.group()));
    }

    /**
     * Strips markup and quote marks, collapses separators and lowercases; null when nothing is left.
     */
    public String text(String value) {
        if (value == null) {
            return null;
        }
        String stripped = HTML_TAG.matcher(value).replaceAll("");
        String normalized = TEXT_SEPARATORS.matcher(stripped).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }
}
