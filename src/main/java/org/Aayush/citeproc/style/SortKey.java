package org.Aayush.citeproc.style;

import lombok.Value;

/**
 * {@code <key>} of a layout sort: exactly one of variable or macro.
 */
@Value
public class SortKey {
    String variable;
    String macro;
    boolean descending;

    public static SortKey variable(String variable) {
        return new SortKey(variable, null, false);
    }

    public static SortKey macro(String macro) {
        return new SortKey(null, macro, false);
    }

    /**
     * Returns this key with descending order.
     */
    public SortKey descending() {
        return new SortKey(variable, macro, true);
    }

    public String describe() {
        return variable != null ? "key[variable=" + variable + "]" : "key[macro=" + macro + "]";
    }
}
