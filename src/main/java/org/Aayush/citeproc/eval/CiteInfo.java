package org.Aayush.citeproc.eval;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.style.Position;

/**
 * Per-occurrence citation data visible to evaluation: position, locator and numbering.
 */
@Value
@Builder(toBuilder = true)
public class CiteInfo {
    public static final String DEFAULT_LOCATOR_LABEL = "page";
    public static final CiteInfo FIRST = CiteInfo.builder().build();

    @Builder.Default
    Position position = Position.FIRST;
    boolean nearNote;
    /** Pinpoint locator, nullable. */
    String locator;
    /** Locator label term name, nullable (page is assumed when a locator is present). */
    String label;
    /** 1-based citation number, 0 when unassigned. */
    int citationNumber;
    /** Note number of the citing note, nullable. */
    Integer noteNumber;
    /** Note number of the first note citing the reference, nullable. */
    Integer firstReferenceNoteNumber;

    /**
     * Returns the effective locator label.
     */
    public String effectiveLabel() {
        return label == null || label.isBlank() ? DEFAULT_LOCATOR_LABEL : label;
    }
}
