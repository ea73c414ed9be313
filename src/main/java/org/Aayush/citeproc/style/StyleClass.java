package org.Aayush.citeproc.style;

/**
 * Style class: in-text citations or footnote citations.
 */
public enum StyleClass {
    IN_TEXT,
    NOTE
}
