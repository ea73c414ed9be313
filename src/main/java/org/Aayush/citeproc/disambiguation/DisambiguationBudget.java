package org.Aayush.citeproc.disambiguation;

/**
 * Upper bound on disambiguation render passes, the initial render included.
 */
public final class DisambiguationBudget {
    public static final int DEFAULT_MAX_PASSES = 10;

    static final String PROP_MAX_PASSES = "citeproc.disambiguation.maxPasses";

    private final int maxPasses;

    private DisambiguationBudget(int maxPasses) {
        this.maxPasses = normalizeBound(maxPasses);
    }

    /**
     * Creates a budget; a non-positive bound means the default.
     */
    public static DisambiguationBudget of(int maxPasses) {
        return new DisambiguationBudget(maxPasses);
    }

    /**
     * Loads the bound from the {@code citeproc.disambiguation.maxPasses} system property.
     */
    public static DisambiguationBudget defaults() {
        return DisambiguationBudget.of(readBound(PROP_MAX_PASSES));
    }

    public int maxPasses() {
        return maxPasses;
    }

    /**
     * Returns true when another pass fits after {@code passesUsed}.
     */
    public boolean allowsAnotherPass(int passesUsed) {
        return passesUsed < maxPasses;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return DEFAULT_MAX_PASSES;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_PASSES;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_PASSES;
        }
    }
}
