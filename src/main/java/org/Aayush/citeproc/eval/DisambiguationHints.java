package org.Aayush.citeproc.eval;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.reference.Name;

import java.util.Map;

/**
 * Immutable per-reference disambiguation hints read during evaluation.
 */
@Value
@Builder(toBuilder = true)
public class DisambiguationHints {
    public static final DisambiguationHints NONE = DisambiguationHints.builder().build();

    /** Minimum number of names to show before et-al, nullable. */
    Integer etAlNames;
    /** Given-name expansions keyed by {@link Name#hintKey()}. */
    @Singular
    Map<String, NameHint> nameHints;
    /** Year suffix ordinal, 0 when none (1 = a). */
    int yearSuffix;
    /** Value tested by {@code <if disambiguate="true">}. */
    boolean disambiguate;

    /**
     * Returns the hint for a name, or null.
     */
    public NameHint nameHint(Name name) {
        if (nameHints.isEmpty() || name == null) {
            return null;
        }
        return nameHints.get(name.hintKey());
    }

    /**
     * Returns the subset that applies to bibliography entries (the year suffix only).
     */
    public DisambiguationHints forBibliography() {
        if (yearSuffix == 0) {
            return NONE;
        }
        return DisambiguationHints.builder().yearSuffix(yearSuffix).build();
    }
}
