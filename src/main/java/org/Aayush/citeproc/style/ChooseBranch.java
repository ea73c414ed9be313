package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * {@code <if>}, {@code <else-if>} or {@code <else>} branch. A branch without conditions is the else branch.
 */
@Value
@Builder
public class ChooseBranch {
    @Builder.Default
    Match match = Match.ALL;
    @Singular
    List<Condition> conditions;
    @Singular
    List<Element> elements;

    public boolean isElse() {
        return conditions.isEmpty();
    }

    public enum Match {
        ALL,
        ANY,
        NONE
    }
}
