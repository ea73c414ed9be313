package org.Aayush.citeproc.eval;

import java.util.HashSet;
import java.util.Set;

/**
 * Mutable state scoped to rendering one item once: substituted variables and the year-suffix flag.
 */
public final class ItemRenderState {
    private final Set<String> quashed = new HashSet<>();
    private boolean yearSuffixRendered;

    /**
     * Suppresses a variable for the rest of the item after a substitute rendered it.
     */
    public void quash(String variable) {
        quashed.add(variable);
    }

    public boolean isQuashed(String variable) {
        return quashed.contains(variable);
    }

    public boolean yearSuffixRendered() {
        return yearSuffixRendered;
    }

    public void markYearSuffixRendered() {
        yearSuffixRendered = true;
    }
}
