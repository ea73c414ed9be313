package org.Aayush.citeproc.disambiguation;

import lombok.Value;

import java.util.List;

/**
 * Final state of one disambiguation run.
 */
@Value
public class DisambiguationOutcome {
    HintTable hints;
    /** Render passes used, the initial render included. */
    int passes;
    /** {@link DisambiguationStep#CONVERGED} or {@link DisambiguationStep#EXHAUSTED}. */
    DisambiguationStep finalStep;
    /** Cites of the last pass. */
    List<DisambData> lastRender;
    /** Groups still ambiguous after the last pass. */
    List<List<DisambData>> remainingGroups;

    public boolean converged() {
        return finalStep == DisambiguationStep.CONVERGED;
    }
}
