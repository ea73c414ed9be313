package org.Aayush.citeproc.disambiguation;

import org.Aayush.citeproc.eval.GivenNames;
import org.Aayush.citeproc.eval.NameHint;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.style.GivenNameRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Given-name expansion: the global pass over all cited names and the per-group by-cite pass.
 */
final class GivenNameDisambiguation {

    private GivenNameDisambiguation() {
    }

    /**
     * Expands names that share a family name with a different person anywhere in the document.
     *
     * @return true when any hint changed.
     */
    static boolean applyGlobal(List<DisambData> cites, GivenNameRule rule, HintTable hints) {
        Map<String, List<Owned>> byFamily = new LinkedHashMap<>();
        for (DisambData cite : cites) {
            List<Name> names = rule.primaryOnly() && !cite.names().isEmpty()
                    ? cite.names().subList(0, 1)
                    : cite.names();
            for (Name name : names) {
                if (name.isLiteral() || name.getFamily() == null) {
                    continue;
                }
                byFamily.computeIfAbsent(name.familyWithParticle(), ignored -> new ArrayList<>())
                        .add(new Owned(cite.itemId(), name));
            }
        }
        boolean changed = false;
        for (List<Owned> group : byFamily.values()) {
            Set<String> initials = new HashSet<>();
            Set<String> fullGiven = new HashSet<>();
            for (Owned owned : group) {
                String given = owned.name().getGiven();
                if (given != null && !given.isBlank()) {
                    initials.add(GivenNames.initials(given));
                    fullGiven.add(normalizeGiven(given));
                }
            }
            if (initials.size() <= 1 && fullGiven.size() <= 1) {
                continue;
            }
            boolean initialsSeparate = initials.size() > 1 && initials.size() >= fullGiven.size();
            NameHint hint;
            if (initialsSeparate) {
                hint = NameHint.ADD_INITIALS;
            } else if (!rule.initialsOnly() && fullGiven.size() > 1) {
                hint = NameHint.ADD_GIVEN_NAME;
            } else {
                continue;
            }
            for (Owned owned : group) {
                changed |= hints.upgradeNameHint(owned.itemId(), owned.name(), scoped(hint, rule));
            }
        }
        return changed;
    }

    /**
     * Expands names inside each ambiguity group, position by position: initials when they tell
     * the same-family names apart, otherwise the full given name.
     *
     * @return true when any hint changed.
     */
    static boolean applyByCite(List<List<DisambData>> groups, GivenNameRule rule, HintTable hints) {
        boolean changed = false;
        for (List<DisambData> group : groups) {
            int maxNames = 0;
            for (DisambData member : group) {
                maxNames = Math.max(maxNames, member.names().size());
            }
            int positions = rule.primaryOnly() ? Math.min(1, maxNames) : maxNames;
            for (int position = 0; position < positions; position++) {
                List<Name> atPosition = new ArrayList<>(group.size());
                for (DisambData member : group) {
                    atPosition.add(position < member.names().size() ? member.names().get(position) : null);
                }
                for (int i = 0; i < group.size(); i++) {
                    Name name = atPosition.get(i);
                    if (name == null || name.isLiteral()) {
                        continue;
                    }
                    NameHint hint = hintFor(name, atPosition, rule);
                    if (hint != null) {
                        changed |= hints.upgradeNameHint(group.get(i).itemId(), name, hint);
                    }
                }
            }
        }
        return changed;
    }

    /**
     * Signature of the first {@code count} names used to decide whether showing more names
     * separates cites.
     */
    static List<String> signature(List<Name> names, int count, GivenNameRule rule) {
        List<String> signature = new ArrayList<>(Math.min(count, names.size()));
        for (int i = 0; i < names.size() && i < count; i++) {
            Name name = names.get(i);
            String given = null;
            if (rule != null && (!rule.primaryOnly() || i == 0) && name.getGiven() != null) {
                given = rule.initialsOnly() ? GivenNames.initials(name.getGiven()) : name.getGiven();
            }
            signature.add(name.familyWithParticle() + "|" + (given == null ? "" : given));
        }
        return signature;
    }

    private static NameHint hintFor(Name name, List<Name> atPosition, GivenNameRule rule) {
        List<Name> sameFamily = new ArrayList<>();
        for (Name other : atPosition) {
            if (other != null && !other.equals(name) && !other.isLiteral()
                    && other.familyWithParticle().equals(name.familyWithParticle())) {
                sameFamily.add(other);
            }
        }
        if (sameFamily.isEmpty()) {
            return null;
        }
        String ownInitials = name.getGiven() == null ? null : GivenNames.initials(name.getGiven());
        boolean initialsSeparate = true;
        for (Name other : sameFamily) {
            String otherInitials = other.getGiven() == null ? null : GivenNames.initials(other.getGiven());
            if (ownInitials == null ? otherInitials == null : ownInitials.equals(otherInitials)) {
                initialsSeparate = false;
                break;
            }
        }
        return rule.initialsOnly() || initialsSeparate ? NameHint.ADD_INITIALS : NameHint.ADD_GIVEN_NAME;
    }

    private static NameHint scoped(NameHint hint, GivenNameRule rule) {
        if (!rule.primaryOnly()) {
            return hint;
        }
        return hint == NameHint.ADD_INITIALS ? NameHint.ADD_INITIALS_IF_PRIMARY : NameHint.ADD_GIVEN_NAME_IF_PRIMARY;
    }

    /**
     * "J.J." and "J. J." compare equal; full words keep their spelling.
     */
    private static String normalizeGiven(String given) {
        StringBuilder out = new StringBuilder();
        for (String part : given.split("[\\s.]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(part.length() == 1 ? part.toUpperCase(Locale.ROOT) + "." : part);
        }
        return out.toString();
    }

    private record Owned(String itemId, Name name) {
    }
}
