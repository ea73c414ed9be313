package org.Aayush.citeproc.style;

/**
 * Rendering element kinds of a style tree.
 */
public enum ElementKind {
    TEXT,
    NUMBER,
    LABEL,
    NAMES,
    DATE,
    GROUP,
    CHOOSE
}
