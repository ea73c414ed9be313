package org.Aayush.citeproc.style;

/**
 * Bibliography {@code second-field-align} values: the first rendered field of an entry sits in a
 * left margin column, the rest of the entry follows inline.
 */
public enum SecondFieldAlign {
    FLUSH,
    MARGIN
}
