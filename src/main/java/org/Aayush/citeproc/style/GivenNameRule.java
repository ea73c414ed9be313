package org.Aayush.citeproc.style;

/**
 * {@code givenname-disambiguation-rule} values.
 */
public enum GivenNameRule {
    ALL_NAMES,
    ALL_NAMES_WITH_INITIALS,
    PRIMARY_NAME,
    PRIMARY_NAME_WITH_INITIALS,
    BY_CITE;

    public boolean initialsOnly() {
        return this == ALL_NAMES_WITH_INITIALS || this == PRIMARY_NAME_WITH_INITIALS;
    }

    public boolean primaryOnly() {
        return this == PRIMARY_NAME || this == PRIMARY_NAME_WITH_INITIALS;
    }
}
