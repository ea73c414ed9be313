package org.Aayush.citeproc.disambiguation;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.diagnostics.DiagnosticCollector;
import org.Aayush.citeproc.style.DisambiguationStrategy;
import org.Aayush.citeproc.style.GivenNameRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Multi-pass disambiguation state machine.
 *
 * <p>Each step mutates the {@link HintTable} and asks the caller for a fresh render. The pass
 * counter is checked before every re-render, so a run never exceeds
 * {@link DisambiguationBudget#maxPasses()} passes whatever the style or data. Steps after the
 * initial render:</p>
 * <ol>
 * <li>global given-name expansion (once, non by-cite rules);</li>
 * <li>adding names, repeated while it changes hints;</li>
 * <li>by-cite given-name expansion;</li>
 * <li>year suffixes in bibliography order;</li>
 * <li>the {@code disambiguate} condition, with one last render.</li>
 * </ol>
 *
 * <p>One instance serves one {@code process()} call.</p>
 */
@Slf4j
public final class Disambiguator {
    private final DisambiguationStrategy strategy;
    private final DisambiguationBudget budget;
    private final DiagnosticCollector diagnostics;

    public Disambiguator(DisambiguationStrategy strategy, DisambiguationBudget budget, DiagnosticCollector diagnostics) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Runs the state machine.
     *
     * @param pass renders every cite with the given hints.
     * @param bibliographyIndex position of a reference in bibliography order.
     * @return final hints and pass statistics.
     */
    public DisambiguationOutcome run(RenderPass pass, ToIntFunction<String> bibliographyIndex) {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(bibliographyIndex, "bibliographyIndex");
        Run run = new Run(pass);
        run.render(DisambiguationStep.INITIAL_RENDER);

        if (strategy.isAddGivenName() && strategy.getGivenNameRule() != GivenNameRule.BY_CITE
                && run.hasBudget()) {
            if (GivenNameDisambiguation.applyGlobal(run.cites, strategy.getGivenNameRule(), run.hints)) {
                run.render(DisambiguationStep.GLOBAL_GIVEN_NAMES);
            }
        }

        if (strategy.isAddNames()) {
            while (!run.groups.isEmpty() && run.hasBudget() && addNames(run.groups, run.hints)) {
                run.render(DisambiguationStep.ADD_NAMES);
            }
        }

        if (strategy.isAddGivenName() && strategy.getGivenNameRule() == GivenNameRule.BY_CITE
                && !run.groups.isEmpty() && run.hasBudget()) {
            if (GivenNameDisambiguation.applyByCite(run.groups, GivenNameRule.BY_CITE, run.hints)) {
                run.render(DisambiguationStep.BY_CITE_GIVEN_NAMES);
            }
        }

        if (strategy.isAddYearSuffix() && !run.groups.isEmpty() && run.hasBudget()) {
            if (assignYearSuffixes(run.groups, run.hints, bibliographyIndex)) {
                run.render(DisambiguationStep.YEAR_SUFFIXES);
            }
        }

        if (!run.groups.isEmpty() && run.hasBudget()) {
            boolean changed = false;
            for (String itemId : AmbiguityGroups.memberIds(run.groups)) {
                changed |= run.hints.markDisambiguate(itemId);
            }
            if (changed) {
                run.render(DisambiguationStep.DISAMBIGUATE_CONDITION);
            }
        }

        return run.finish();
    }

    /**
     * Raises the et-al count of each group to the smallest count that separates some member.
     */
    private boolean addNames(List<List<DisambData>> groups, HintTable hints) {
        GivenNameRule rule = strategy.isAddGivenName() ? strategy.getGivenNameRule() : null;
        boolean changed = false;
        for (List<DisambData> group : groups) {
            int maxNames = 0;
            for (DisambData member : group) {
                maxNames = Math.max(maxNames, member.names().size());
            }
            List<DisambData> remaining = new ArrayList<>(group);
            for (int count = 1; count <= maxNames && remaining.size() > 1; count++) {
                Map<List<String>, Integer> frequency = new HashMap<>();
                for (DisambData member : remaining) {
                    frequency.merge(GivenNameDisambiguation.signature(member.names(), count, rule), 1, Integer::sum);
                }
                List<DisambData> separated = new ArrayList<>();
                for (DisambData member : remaining) {
                    if (frequency.get(GivenNameDisambiguation.signature(member.names(), count, rule)) == 1) {
                        separated.add(member);
                    }
                }
                if (separated.isEmpty()) {
                    continue;
                }
                for (DisambData member : remaining) {
                    changed |= hints.raiseEtAlNames(member.itemId(), count);
                }
                remaining.removeAll(separated);
            }
        }
        return changed;
    }

    private boolean assignYearSuffixes(
            List<List<DisambData>> groups,
            HintTable hints,
            ToIntFunction<String> bibliographyIndex
    ) {
        boolean changed = false;
        for (List<DisambData> group : groups) {
            List<String> ids = new ArrayList<>(group.size());
            for (DisambData member : group) {
                ids.add(member.itemId());
            }
            List<String> ordered = new ArrayList<>(ids);
            ordered.sort(Comparator.<String>comparingInt(bibliographyIndex::applyAsInt).thenComparingInt(ids::indexOf));
            int next = 1;
            for (String id : ordered) {
                if (hints.yearSuffix(id) != 0) {
                    continue;
                }
                hints.assignYearSuffix(id, next++);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Mutable bookkeeping of one run.
     */
    private final class Run {
        private final RenderPass pass;
        private final HintTable hints = new HintTable();
        private List<DisambData> cites = List.of();
        private List<List<DisambData>> groups = List.of();
        private int passes;

        private Run(RenderPass pass) {
            this.pass = pass;
        }

        private boolean hasBudget() {
            return budget.allowsAnotherPass(passes);
        }

        private void render(DisambiguationStep step) {
            cites = List.copyOf(pass.render(hints));
            groups = AmbiguityGroups.find(cites);
            passes++;
            log.debug("disambiguation pass {} ({}): {} cites, {} ambiguous groups", passes, step, cites.size(), groups.size());
        }

        private DisambiguationOutcome finish() {
            if (groups.isEmpty()) {
                return new DisambiguationOutcome(hints, passes, DisambiguationStep.CONVERGED, cites, groups);
            }
            for (List<DisambData> group : groups) {
                List<String> ids = new ArrayList<>(group.size());
                for (DisambData member : group) {
                    ids.add(member.itemId());
                }
                String message = "references " + ids + " still render as '" + group.get(0).rendered()
                        + "' after " + passes + " passes";
                log.warn("disambiguation incomplete: {}", message);
                diagnostics.report(Diagnostic.disambiguationIncomplete(ids.get(0), message));
            }
            return new DisambiguationOutcome(hints, passes, DisambiguationStep.EXHAUSTED, cites, groups);
        }
    }
}
