package org.Aayush.citeproc.style;

/**
 * Cite positions tested by {@code <if position="...">}.
 */
public enum Position {
    FIRST,
    SUBSEQUENT,
    IBID,
    IBID_WITH_LOCATOR,
    NEAR_NOTE;

    /**
     * Returns true when an actual cite position satisfies this tested position.
     *
     * <p>{@code subsequent} also holds for ibid cites, and {@code ibid} also holds for
     * ibid-with-locator cites. {@code near-note} is a separate flag and never matches here.</p>
     */
    public boolean matchedBy(Position actual) {
        return switch (this) {
            case FIRST -> actual == FIRST;
            case SUBSEQUENT -> actual == SUBSEQUENT || actual == IBID || actual == IBID_WITH_LOCATOR;
            case IBID -> actual == IBID || actual == IBID_WITH_LOCATOR;
            case IBID_WITH_LOCATOR -> actual == IBID_WITH_LOCATOR;
            case NEAR_NOTE -> false;
        };
    }
}
