package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * Citation or bibliography layout: elements, outer formatting, sort keys and name options.
 *
 * <p>Collapse settings apply to citation layouts, {@link #secondFieldAlign} to bibliography
 * layouts; each is ignored on the other.</p>
 */
@Value
@Builder(toBuilder = true)
public class Layout {
    /** Outer formatting; for citations the delimiter joins cite items. */
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;
    @Singular
    List<Element> elements;
    @Singular
    List<SortKey> sortKeys;
    /** Layout-level inherited name options, nullable. */
    NameOptions nameOptions;
    @Builder.Default
    DisambiguationStrategy disambiguation = DisambiguationStrategy.NONE;
    @Builder.Default
    Collapse collapse = Collapse.NONE;
    /** Joins cites sharing names; nullable. */
    String citeGroupDelimiter;
    /** Joins year suffixes of one year; nullable. */
    String yearSuffixDelimiter;
    /** Follows a collapsed group instead of the layout delimiter; nullable. */
    String afterCollapseDelimiter;
    /** Nullable; null leaves entries unsplit. */
    SecondFieldAlign secondFieldAlign;
}
