package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;

/**
 * Global style options.
 */
@Value
@Builder
public class StyleOptions {
    /** Page-range abbreviation; null keeps ranges as written (only the delimiter changes). */
    PageRangeFormat pageRangeFormat;
    @Builder.Default
    DemoteParticle demoteNonDroppingParticle = DemoteParticle.DISPLAY_AND_SORT;
    @Builder.Default
    boolean initializeWithHyphen = true;
    /** Maximum note distance for the near-note position. */
    @Builder.Default
    int nearNoteDistance = 5;

    public static StyleOptions defaults() {
        return StyleOptions.builder().build();
    }

    public enum PageRangeFormat {
        EXPANDED,
        MINIMAL,
        MINIMAL_TWO,
        CHICAGO
    }

    public enum DemoteParticle {
        NEVER,
        SORT_ONLY,
        DISPLAY_AND_SORT
    }
}
