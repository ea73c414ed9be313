package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

/**
 * Inheritable name formatting options ({@code <name>} and {@code <et-al>} attributes).
 *
 * <p>Every field is nullable. A null field inherits from the next outer level
 * (style, then layout, then names element, then substitute parent) through
 * {@link #mergedWith(NameOptions)}.</p>
 */
@Value
@Builder(toBuilder = true)
public class NameOptions {
    public static final NameOptions EMPTY = NameOptions.builder().build();

    And and;
    String delimiter;
    DelimiterPrecedes delimiterPrecedesLast;
    DelimiterPrecedes delimiterPrecedesEtAl;
    Integer etAlMin;
    Integer etAlUseFirst;
    Integer etAlSubsequentMin;
    Integer etAlSubsequentUseFirst;
    Boolean etAlUseLast;
    Boolean initialize;
    String initializeWith;
    Form form;
    SortOrder nameAsSortOrder;
    String sortSeparator;
    /** Term used for truncated lists, {@code et-al} by default. */
    String etAlTerm;
    Formatting etAlFormatting;
    /** Formatting of each rendered name list ({@code <name>} affixes and fonts). */
    Formatting nameFormatting;
    Formatting familyFormatting;
    Formatting givenFormatting;

    /**
     * Returns options where every non-null field of {@code override} replaces this one's.
     *
     * @param override inner options, nullable.
     * @return merged options.
     */
    public NameOptions mergedWith(NameOptions override) {
        if (override == null) {
            return this;
        }
        return NameOptions.builder()
                .and(pick(override.and, and))
                .delimiter(pick(override.delimiter, delimiter))
                .delimiterPrecedesLast(pick(override.delimiterPrecedesLast, delimiterPrecedesLast))
                .delimiterPrecedesEtAl(pick(override.delimiterPrecedesEtAl, delimiterPrecedesEtAl))
                .etAlMin(pick(override.etAlMin, etAlMin))
                .etAlUseFirst(pick(override.etAlUseFirst, etAlUseFirst))
                .etAlSubsequentMin(pick(override.etAlSubsequentMin, etAlSubsequentMin))
                .etAlSubsequentUseFirst(pick(override.etAlSubsequentUseFirst, etAlSubsequentUseFirst))
                .etAlUseLast(pick(override.etAlUseLast, etAlUseLast))
                .initialize(pick(override.initialize, initialize))
                .initializeWith(pick(override.initializeWith, initializeWith))
                .form(pick(override.form, form))
                .nameAsSortOrder(pick(override.nameAsSortOrder, nameAsSortOrder))
                .sortSeparator(pick(override.sortSeparator, sortSeparator))
                .etAlTerm(pick(override.etAlTerm, etAlTerm))
                .etAlFormatting(pick(override.etAlFormatting, etAlFormatting))
                .nameFormatting(pick(override.nameFormatting, nameFormatting))
                .familyFormatting(pick(override.familyFormatting, familyFormatting))
                .givenFormatting(pick(override.givenFormatting, givenFormatting))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public enum And {
        TEXT,
        SYMBOL
    }

    public enum DelimiterPrecedes {
        CONTEXTUAL,
        AFTER_INVERTED_NAME,
        ALWAYS,
        NEVER
    }

    public enum Form {
        LONG,
        SHORT,
        COUNT
    }

    public enum SortOrder {
        FIRST,
        ALL
    }
}
