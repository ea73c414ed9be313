package org.Aayush.citeproc.eval;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.citeproc.diagnostics.DiagnosticCollector;
import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.Style;

import java.util.Objects;

/**
 * Immutable evaluation context for one reference in one mode.
 *
 * <p>Scoped changes (a group's variable tracker, substitute name options, macro depth) derive a
 * new context through the {@code with...} methods. Two members are shared by reference across
 * derived contexts: the {@link ItemRenderState} of the current item and the
 * {@link DiagnosticCollector} of the current run.</p>
 */
@Getter
@Accessors(fluent = true)
public final class EvalContext {
    private final Style style;
    private final CslLocale locale;
    private final Reference reference;
    private final EvalMode mode;
    private final CiteInfo cite;
    private final DisambiguationHints hints;
    /** Style and layout name options merged, never null. */
    private final NameOptions inheritedNameOptions;
    private final boolean inSubstitute;
    /** Effective options of the names element whose substitute is being evaluated, nullable. */
    private final NameOptions substituteNameOptions;
    private final VariableTracker tracker;
    private final ItemRenderState state;
    private final DiagnosticCollector diagnostics;
    private final int macroDepth;
    /** True when dates carry the year suffix because no element renders it explicitly. */
    private final boolean implicitYearSuffix;

    @Builder(toBuilder = true)
    private EvalContext(
            Style style,
            CslLocale locale,
            Reference reference,
            EvalMode mode,
            CiteInfo cite,
            DisambiguationHints hints,
            NameOptions inheritedNameOptions,
            boolean inSubstitute,
            NameOptions substituteNameOptions,
            VariableTracker tracker,
            ItemRenderState state,
            DiagnosticCollector diagnostics,
            int macroDepth,
            boolean implicitYearSuffix
    ) {
        this.style = Objects.requireNonNull(style, "style");
        this.locale = Objects.requireNonNull(locale, "locale");
        this.reference = Objects.requireNonNull(reference, "reference");
        this.mode = mode == null ? EvalMode.CITATION : mode;
        this.cite = cite == null ? CiteInfo.FIRST : cite;
        this.hints = hints == null ? DisambiguationHints.NONE : hints;
        this.inheritedNameOptions = inheritedNameOptions == null ? NameOptions.EMPTY : inheritedNameOptions;
        this.inSubstitute = inSubstitute;
        this.substituteNameOptions = substituteNameOptions;
        this.tracker = tracker == null ? new VariableTracker() : tracker;
        this.state = state == null ? new ItemRenderState() : state;
        this.diagnostics = diagnostics == null ? new DiagnosticCollector() : diagnostics;
        this.macroDepth = macroDepth;
        this.implicitYearSuffix = implicitYearSuffix;
    }

    /**
     * Returns a context whose variable lookups are counted by {@code scopeTracker}.
     */
    public EvalContext withTracker(VariableTracker scopeTracker) {
        return toBuilder().tracker(Objects.requireNonNull(scopeTracker, "scopeTracker")).build();
    }

    /**
     * Returns a context for evaluating substitute children of a names element.
     *
     * @param effectiveOptions the parent names element's effective name options.
     */
    public EvalContext withSubstitute(NameOptions effectiveOptions) {
        return toBuilder().inSubstitute(true).substituteNameOptions(effectiveOptions).build();
    }

    /**
     * Returns a context one macro call deeper.
     */
    public EvalContext enterMacro() {
        return toBuilder().macroDepth(macroDepth + 1).build();
    }

    /**
     * Returns true when cite positions and name hints apply.
     */
    public boolean isCitation() {
        return mode == EvalMode.CITATION;
    }

    /**
     * Returns the reference id, for diagnostics.
     */
    public String referenceId() {
        return reference.getId();
    }
}
