package org.Aayush.citeproc.disambiguation;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.Aayush.citeproc.eval.DisambiguationHints;
import org.Aayush.citeproc.eval.NameHint;
import org.Aayush.citeproc.reference.Name;

import java.util.Map;

/**
 * Mutable per-run disambiguation hints keyed by reference id.
 *
 * <p>Hints only ever grow: et-al counts rise, name hints are replaced by stronger ones only, and
 * the disambiguate flag is never cleared. Every mutator reports whether it changed anything so
 * the state machine can stop steps that make no progress.</p>
 */
public final class HintTable {
    private final Object2IntOpenHashMap<String> etAlNames = new Object2IntOpenHashMap<>();
    private final Object2ObjectOpenHashMap<String, Map<String, NameHint>> nameHints = new Object2ObjectOpenHashMap<>();
    private final Object2IntOpenHashMap<String> yearSuffixes = new Object2IntOpenHashMap<>();
    private final ObjectOpenHashSet<String> disambiguate = new ObjectOpenHashSet<>();

    public HintTable() {
        etAlNames.defaultReturnValue(0);
        yearSuffixes.defaultReturnValue(0);
    }

    /**
     * Raises the et-al name count of a reference.
     *
     * @return true when the stored count changed.
     */
    public boolean raiseEtAlNames(String itemId, int count) {
        if (count <= etAlNames.getInt(itemId)) {
            return false;
        }
        etAlNames.put(itemId, count);
        return true;
    }

    /**
     * Stores a name hint unless an equal or stronger one is already present.
     *
     * @return true when the stored hint changed.
     */
    public boolean upgradeNameHint(String itemId, Name name, NameHint hint) {
        Map<String, NameHint> hints = nameHints.computeIfAbsent(itemId, ignored -> new Object2ObjectOpenHashMap<>());
        NameHint current = hints.get(name.hintKey());
        if (current != null && strength(current) >= strength(hint)) {
            return false;
        }
        hints.put(name.hintKey(), hint);
        return true;
    }

    public void assignYearSuffix(String itemId, int suffix) {
        yearSuffixes.put(itemId, suffix);
    }

    public int yearSuffix(String itemId) {
        return yearSuffixes.getInt(itemId);
    }

    /**
     * Sets the disambiguate condition of a reference.
     *
     * @return true when the flag was not set before.
     */
    public boolean markDisambiguate(String itemId) {
        return disambiguate.add(itemId);
    }

    /**
     * Returns the immutable hints for one reference.
     */
    public DisambiguationHints hintsFor(String itemId) {
        int etAl = etAlNames.getInt(itemId);
        Map<String, NameHint> names = nameHints.get(itemId);
        int suffix = yearSuffixes.getInt(itemId);
        boolean flagged = disambiguate.contains(itemId);
        if (etAl == 0 && (names == null || names.isEmpty()) && suffix == 0 && !flagged) {
            return DisambiguationHints.NONE;
        }
        DisambiguationHints.DisambiguationHintsBuilder builder = DisambiguationHints.builder()
                .etAlNames(etAl == 0 ? null : etAl)
                .yearSuffix(suffix)
                .disambiguate(flagged);
        if (names != null) {
            builder.nameHints(names);
        }
        return builder.build();
    }

    private static int strength(NameHint hint) {
        return switch (hint) {
            case ADD_INITIALS_IF_PRIMARY -> 1;
            case ADD_INITIALS -> 2;
            case ADD_GIVEN_NAME_IF_PRIMARY -> 3;
            case ADD_GIVEN_NAME -> 4;
        };
    }
}
