package org.Aayush.citeproc.eval;

/**
 * What an evaluation pass produces.
 */
public enum EvalMode {
    /** In-text or note citation. Positions and name hints apply. */
    CITATION,
    /** Bibliography entry. Positions never match; only year suffixes apply. */
    BIBLIOGRAPHY,
    /** Sort key evaluation. Names are inverted and never truncated. */
    SORT
}
