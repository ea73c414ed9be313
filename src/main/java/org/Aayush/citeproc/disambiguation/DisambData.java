package org.Aayush.citeproc.disambiguation;

import org.Aayush.citeproc.reference.Name;

import java.util.List;
import java.util.Objects;

/**
 * One rendered cite as seen by disambiguation.
 *
 * @param itemId reference id.
 * @param names names of the first rendered name list, in order.
 * @param rendered plain-text rendering compared for ambiguity.
 */
public record DisambData(String itemId, List<Name> names, String rendered) {
    public DisambData {
        Objects.requireNonNull(itemId, "itemId");
        names = List.copyOf(Objects.requireNonNull(names, "names"));
        Objects.requireNonNull(rendered, "rendered");
    }
}
