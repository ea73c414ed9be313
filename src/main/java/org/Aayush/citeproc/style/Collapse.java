package org.Aayush.citeproc.style;

/**
 * Citation {@code collapse} modes.
 */
public enum Collapse {
    NONE,
    /** Runs of consecutive citation numbers become ranges ("1–3"). */
    CITATION_NUMBER,
    /** Cites sharing names print the names once ("Doe 1999, 2001"). */
    YEAR,
    /** As {@link #YEAR}; same-year cites also print only their year suffix ("Doe 1999a, b"). */
    YEAR_SUFFIX,
    /** As {@link #YEAR_SUFFIX}; three or more consecutive suffixes become a range ("a–c"). */
    YEAR_SUFFIX_RANGED;

    public boolean byNames() {
        return this == YEAR || this == YEAR_SUFFIX || this == YEAR_SUFFIX_RANGED;
    }

    public boolean collapsesYearSuffixes() {
        return this == YEAR_SUFFIX || this == YEAR_SUFFIX_RANGED;
    }
}
