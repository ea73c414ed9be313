package org.Aayush.citeproc.eval;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Counts variable lookups inside one group or macro scope.
 *
 * <p>A scope is suppressed when it consulted at least one variable and none of them was
 * non-empty. Counts flow to the enclosing scope through {@link #mergeInto(VariableTracker)}.</p>
 */
public final class VariableTracker {
    private int called;
    private int nonEmpty;
    private final Set<String> nonEmptyVariables = new LinkedHashSet<>();

    /**
     * Records one variable lookup.
     */
    public void record(String variable, boolean present) {
        called++;
        if (present) {
            nonEmpty++;
            if (variable != null) {
                nonEmptyVariables.add(variable);
            }
        }
    }

    /**
     * Returns true when the scope must render as nothing.
     */
    public boolean suppresses() {
        return called > 0 && nonEmpty == 0;
    }

    /**
     * Adds this scope's counts to an enclosing scope.
     */
    public void mergeInto(VariableTracker parent) {
        parent.called += called;
        parent.nonEmpty += nonEmpty;
        parent.nonEmptyVariables.addAll(nonEmptyVariables);
    }

    public int called() {
        return called;
    }

    public int nonEmpty() {
        return nonEmpty;
    }

    /**
     * Returns the non-empty variables seen in this scope, in lookup order.
     */
    public Set<String> nonEmptyVariables() {
        return Collections.unmodifiableSet(nonEmptyVariables);
    }
}
