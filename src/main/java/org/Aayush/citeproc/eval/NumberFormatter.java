package org.Aayush.citeproc.eval;

import lombok.experimental.UtilityClass;
import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.style.StyleOptions.PageRangeFormat;
import org.Aayush.citeproc.style.TermForm;

import java.util.function.LongFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric tests and number rendering: ranges, ordinals, roman numerals and year-suffix letters.
 */
@UtilityClass
public class NumberFormatter {
    private static final String TOKEN = "\\p{L}*\\d+\\p{L}*";
    private static final String SEPARATOR = "(?:\\s*[-–—,&]\\s*|\\s+and\\s+)";
    private static final Pattern NUMERIC = Pattern.compile("^\\s*" + TOKEN + "(?:" + SEPARATOR + TOKEN + ")*\\s*$");
    private static final Pattern PLURAL = Pattern.compile(".*\\d\\p{L}*" + SEPARATOR + "\\p{L}*\\d.*");
    private static final Pattern RANGE = Pattern.compile("^(\\p{L}*)(\\d+)\\s*[-–—]+\\s*(\\p{L}*)(\\d+)$");
    private static final Pattern CHUNK_SEPARATOR = Pattern.compile("\\s*([,&])\\s*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern HYPHEN = Pattern.compile("\\s*[-–—]+\\s*");
    private static final int MAX_ROMAN = 3999;
    private static final int LONG_ORDINAL_LIMIT = 10;

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    /**
     * Returns true when the value is a number, a number with letter affixes, or a list or range
     * of such numbers.
     */
    public boolean isNumeric(String value) {
        return value != null && NUMERIC.matcher(value).matches();
    }

    /**
     * Returns true when the value holds more than one number ("1-3", "2, 5", "4 & 6").
     */
    public boolean isPlural(String value) {
        return value != null && PLURAL.matcher(value).matches();
    }

    /**
     * Rewrites the ranges in a page-like value.
     *
     * <p>Hyphens between numbers become {@code delimiter}; the end of each range is abbreviated
     * according to {@code format} (null leaves the digits as written). An escaped hyphen
     * ({@code \-}) is kept literally and suppresses range handling for its chunk.</p>
     */
    public String formatRanges(String value, String delimiter, PageRangeFormat format) {
        if (value == null) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        Matcher separators = CHUNK_SEPARATOR.matcher(value);
        int start = 0;
        while (separators.find()) {
            out.append(formatChunk(value.substring(start, separators.start()), delimiter, format));
            out.append(separators.group(1).equals(",") ? ", " : " & ");
            start = separators.end();
        }
        out.append(formatChunk(value.substring(start), delimiter, format));
        return out.toString();
    }

    /**
     * Applies {@code render} to every number in the value and normalizes range hyphens.
     */
    public String transformNumbers(String value, String delimiter, LongFunction<String> render) {
        Matcher digits = DIGITS.matcher(value);
        StringBuilder out = new StringBuilder();
        while (digits.find()) {
            String group = digits.group();
            String replacement = group.length() > 18 ? group : render.apply(Long.parseLong(group));
            digits.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        digits.appendTail(out);
        return HYPHEN.matcher(out).replaceAll(Matcher.quoteReplacement(delimiter));
    }

    /**
     * Renders an ordinal using the locale's {@code ordinal-NN} terms.
     *
     * <p>Two-digit terms ({@code ordinal-11}) win over last-digit terms ({@code ordinal-01}),
     * which win over the generic {@code ordinal} term. A generic term defined nearer in the
     * locale chain wins over digit terms inherited from a fallback locale.</p>
     */
    public String ordinal(long number, CslLocale locale) {
        return number + ordinalSuffix(number, locale);
    }

    /**
     * Renders a long ordinal ("first") for 1 to 10, and a short ordinal otherwise.
     */
    public String longOrdinal(long number, CslLocale locale) {
        if (number >= 1 && number <= LONG_ORDINAL_LIMIT) {
            String term = locale.term(String.format("long-ordinal-%02d", number), TermForm.LONG, false);
            if (term != null) {
                return term;
            }
        }
        return ordinal(number, locale);
    }

    /**
     * Renders a lowercase roman numeral for 1 to 3999, and the arabic number otherwise.
     */
    public String roman(long number) {
        if (number < 1 || number > MAX_ROMAN) {
            return Long.toString(number);
        }
        StringBuilder out = new StringBuilder();
        long remaining = number;
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (remaining >= ROMAN_VALUES[i]) {
                out.append(ROMAN_SYMBOLS[i]);
                remaining -= ROMAN_VALUES[i];
            }
        }
        return out.toString();
    }

    /**
     * Returns the year-suffix letters for a 1-based ordinal: a..z, then aa, ab, ...
     */
    public String yearSuffixLetters(int ordinal) {
        if (ordinal <= 0) {
            throw new IllegalArgumentException("year suffix ordinal must be > 0");
        }
        StringBuilder out = new StringBuilder();
        int remaining = ordinal;
        while (remaining > 0) {
            remaining--;
            out.insert(0, (char) ('a' + remaining % 26));
            remaining /= 26;
        }
        return out.toString();
    }

    /**
     * Abbreviates the end of a numeric range.
     *
     * @param start first number, digits only.
     * @param end second number, digits only, possibly already abbreviated.
     * @param format target format, nullable.
     * @return end digits to print.
     */
    public String abbreviateRangeEnd(String start, String end, PageRangeFormat format) {
        if (format == null || start.length() > 18 || end.length() > 18) {
            return end;
        }
        String expanded = end.length() < start.length()
                ? start.substring(0, start.length() - end.length()) + end
                : end;
        if (Long.parseLong(expanded) < Long.parseLong(start)) {
            return end;
        }
        return switch (format) {
            case EXPANDED -> expanded;
            case MINIMAL -> minimal(start, expanded, 1);
            case MINIMAL_TWO -> minimal(start, expanded, 2);
            case CHICAGO -> chicago(start, expanded);
        };
    }

    private String formatChunk(String chunk, String delimiter, PageRangeFormat format) {
        String trimmed = chunk.trim();
        if (trimmed.contains("\\-")) {
            return trimmed.replace("\\-", "-");
        }
        Matcher range = RANGE.matcher(trimmed);
        if (!range.matches()) {
            return trimmed;
        }
        String startPrefix = range.group(1);
        String startDigits = range.group(2);
        String endPrefix = range.group(3);
        String endDigits = range.group(4);
        if (!endPrefix.isEmpty() && !endPrefix.equals(startPrefix)) {
            return startPrefix + startDigits + delimiter + endPrefix + endDigits;
        }
        return startPrefix + startDigits + delimiter + endPrefix + abbreviateRangeEnd(startDigits, endDigits, format);
    }

    private String minimal(String start, String end, int minDigits) {
        if (start.length() != end.length()) {
            return end;
        }
        int firstDifference = 0;
        while (firstDifference < end.length() && start.charAt(firstDifference) == end.charAt(firstDifference)) {
            firstDifference++;
        }
        String kept = end.substring(Math.min(firstDifference, end.length() - 1));
        if (kept.length() < minDigits && end.length() >= minDigits) {
            return end.substring(end.length() - minDigits);
        }
        return kept;
    }

    private String chicago(String start, String end) {
        long first = Long.parseLong(start);
        if (first < 100 || first % 100 == 0) {
            return end;
        }
        if (first % 100 < 10) {
            return minimal(start, end, 1);
        }
        if (start.length() == 4 && minimal(start, end, 1).length() >= 3) {
            return end;
        }
        return minimal(start, end, 2);
    }

    private String ordinalSuffix(long number, CslLocale locale) {
        long lastTwo = Math.abs(number) % 100;
        CslLocale.TermLookup generic = locale.lookup("ordinal", TermForm.LONG, false);
        CslLocale.TermLookup specific = null;
        if (lastTwo >= 10) {
            specific = locale.lookup(String.format("ordinal-%02d", lastTwo), TermForm.LONG, false);
        }
        if (specific == null) {
            specific = locale.lookup(String.format("ordinal-%02d", lastTwo % 10), TermForm.LONG, false);
        }
        if (specific != null && (generic == null || !specific.fromFallback() || generic.fromFallback())) {
            return specific.value();
        }
        return generic == null ? "" : generic.value();
    }
}
