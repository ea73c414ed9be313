package org.Aayush.citeproc.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.eval.CiteInfo;

/**
 * One cited reference inside a {@link Citation}.
 */
@Value
@Builder
public class CitationItem {
    /** Reference id. */
    String id;
    /** Pinpoint locator ("12-15"), nullable. */
    String locator;
    /** Locator label term name. */
    @Builder.Default
    String label = CiteInfo.DEFAULT_LOCATOR_LABEL;
    /** Text placed before the rendered item, nullable. */
    String prefix;
    /** Text placed after the rendered item, nullable. */
    String suffix;
    /** Drops the first name list ("(1999)" instead of "(Doe 1999)"). */
    boolean suppressAuthor;
    /** Keeps only the first name list. */
    boolean authorOnly;

    public static CitationItem of(String id) {
        return CitationItem.builder().id(id).build();
    }
}
