package org.Aayush.citeproc.disambiguation;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups cites whose renderings collide.
 */
@UtilityClass
public class AmbiguityGroups {

    /**
     * Returns groups of cites sharing one rendering and spanning more than one reference.
     * Each group keeps one entry per reference, in first-seen order.
     */
    public List<List<DisambData>> find(List<DisambData> cites) {
        Map<String, Map<String, DisambData>> byRendering = new LinkedHashMap<>();
        for (DisambData cite : cites) {
            byRendering.computeIfAbsent(cite.rendered(), ignored -> new LinkedHashMap<>())
                    .putIfAbsent(cite.itemId(), cite);
        }
        List<List<DisambData>> groups = new ArrayList<>();
        for (Map<String, DisambData> members : byRendering.values()) {
            if (members.size() > 1) {
                groups.add(List.copyOf(members.values()));
            }
        }
        return groups;
    }

    /**
     * Returns the reference ids of every group member.
     */
    public Set<String> memberIds(List<List<DisambData>> groups) {
        Set<String> ids = new LinkedHashSet<>();
        for (List<DisambData> group : groups) {
            for (DisambData member : group) {
                ids.add(member.itemId());
            }
        }
        return ids;
    }
}
