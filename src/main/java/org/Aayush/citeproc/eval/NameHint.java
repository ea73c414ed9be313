package org.Aayush.citeproc.eval;

/**
 * Per-name expansion requested by given-name disambiguation.
 */
public enum NameHint {
    ADD_INITIALS,
    ADD_GIVEN_NAME,
    ADD_INITIALS_IF_PRIMARY,
    ADD_GIVEN_NAME_IF_PRIMARY;

    /**
     * Returns true when the hint adds initials to the name at the given list index.
     */
    public boolean addsInitials(int index) {
        return this == ADD_INITIALS || (this == ADD_INITIALS_IF_PRIMARY && index == 0);
    }

    /**
     * Returns true when the hint adds the full given name to the name at the given list index.
     */
    public boolean addsGivenName(int index) {
        return this == ADD_GIVEN_NAME || (this == ADD_GIVEN_NAME_IF_PRIMARY && index == 0);
    }
}
