package org.Aayush.citeproc.core;

import lombok.Value;

/**
 * Rendering of one citation.
 *
 * @param <R> renderer output type.
 */
@Value
public class RenderedCitation<R> {
    String citationId;
    R rendering;
}
