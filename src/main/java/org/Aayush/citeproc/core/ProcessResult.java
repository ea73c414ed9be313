package org.Aayush.citeproc.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.diagnostics.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one {@link CiteprocEngine#process} call.
 *
 * @param <R> renderer output type.
 */
@Value
@Builder
public class ProcessResult<R> {
    /** Citations in input order. */
    @Singular
    List<RenderedCitation<R>> citations;
    /** Entries in bibliography order; empty when the style has no bibliography. */
    @Singular("entry")
    List<BibliographyEntry<R>> bibliography;
    /** Non-fatal diagnostics in first-report order. */
    List<Diagnostic> diagnostics;
    /** Render passes used by disambiguation, 0 when the style disables it. */
    int disambiguationPasses;

    /**
     * Returns the rendering of a citation by id, or null.
     */
    public R citation(String citationId) {
        for (RenderedCitation<R> citation : citations) {
            if (citation.getCitationId().equals(citationId)) {
                return citation.getRendering();
            }
        }
        return null;
    }

    /**
     * Returns the diagnostics of one kind.
     */
    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        List<Diagnostic> matching = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) {
                matching.add(diagnostic);
            }
        }
        return matching;
    }
}
