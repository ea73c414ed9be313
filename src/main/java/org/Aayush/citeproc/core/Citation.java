package org.Aayush.citeproc.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One citation occurrence in document order.
 */
@Value
@Builder
public class Citation {
    /** Caller-chosen id echoed in {@link RenderedCitation}. */
    String id;
    /** Footnote number for note styles, nullable. */
    Integer noteNumber;
    @Singular
    List<CitationItem> items;

    /**
     * Creates a citation citing the given reference ids without locators.
     */
    public static Citation of(String id, String... referenceIds) {
        CitationBuilder builder = Citation.builder().id(id);
        for (String referenceId : referenceIds) {
            builder.item(CitationItem.of(referenceId));
        }
        return builder.build();
    }
}
