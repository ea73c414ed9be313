package org.Aayush.citeproc.diagnostics;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Per-process diagnostic sink.
 *
 * <p>Render passes repeat the same evaluation many times, so identical diagnostics are kept once,
 * in first-report order. Not thread-safe; one instance belongs to one {@code process()} call.</p>
 */
@Slf4j
public final class DiagnosticCollector {
    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

    /**
     * Records a diagnostic.
     *
     * @param diagnostic diagnostic to record.
     */
    public void report(Diagnostic diagnostic) {
        Objects.requireNonNull(diagnostic, "diagnostic");
        if (diagnostics.add(diagnostic)) {
            log.debug("[{}] {} (reference={})", diagnostic.getCode(), diagnostic.getMessage(), diagnostic.getReferenceId());
        }
    }

    /**
     * Records a data warning.
     */
    public void warn(String code, String referenceId, String message) {
        report(Diagnostic.dataWarning(code, referenceId, message));
    }

    /**
     * Returns true when at least one diagnostic with the code was recorded.
     */
    public boolean contains(String code) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getCode().equals(code)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns an immutable snapshot in first-report order.
     */
    public List<Diagnostic> snapshot() {
        return List.copyOf(diagnostics);
    }
}
