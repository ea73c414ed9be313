package org.Aayush.citeproc.core;

import lombok.Value;

/**
 * Rendering of one bibliography entry.
 *
 * @param <R> renderer output type.
 */
@Value
public class BibliographyEntry<R> {
    String referenceId;
    R rendering;
}
