package org.Aayush.citeproc.disambiguation;

/**
 * States of the disambiguation state machine, in execution order.
 */
public enum DisambiguationStep {
    INITIAL_RENDER,
    GLOBAL_GIVEN_NAMES,
    ADD_NAMES,
    BY_CITE_GIVEN_NAMES,
    YEAR_SUFFIXES,
    DISAMBIGUATE_CONDITION,
    /** No ambiguity left. */
    CONVERGED,
    /** Budget spent or steps exhausted with ambiguity left. */
    EXHAUSTED
}
