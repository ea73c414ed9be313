package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;

/**
 * Disambiguation methods enabled on the citation layout.
 */
@Value
@Builder
public class DisambiguationStrategy {
    public static final DisambiguationStrategy NONE = DisambiguationStrategy.builder().build();

    boolean addNames;
    boolean addGivenName;
    @Builder.Default
    GivenNameRule givenNameRule = GivenNameRule.BY_CITE;
    boolean addYearSuffix;

    public boolean anyEnabled() {
        return addNames || addGivenName || addYearSuffix;
    }
}
