package org.Aayush.citeproc.reference;

/**
 * Year/month/day triple of one date endpoint. Month values 21..24 encode seasons.
 *
 * @param year year, negative for BC, nullable.
 * @param month month 1..12 or season 21..24, nullable.
 * @param day day of month, nullable.
 */
public record DateParts(Integer year, Integer month, Integer day) {

    /**
     * Returns true when no component is set.
     */
    public boolean isEmpty() {
        return year == null && month == null && day == null;
    }

    /**
     * Creates a year-only endpoint.
     */
    public static DateParts ofYear(int year) {
        return new DateParts(year, null, null);
    }
}
