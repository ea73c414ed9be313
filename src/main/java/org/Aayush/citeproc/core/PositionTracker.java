package org.Aayush.citeproc.core;

import org.Aayush.citeproc.eval.CiteInfo;
import org.Aayush.citeproc.style.Position;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns cite positions in document order.
 *
 * <p>A cite is {@code ibid} when the cite right before it (the previous item of the same
 * citation, or the whole previous citation) refers to the same reference alone. The locator then
 * decides between {@code ibid} and {@code ibid-with-locator}; a cite without locator following one
 * with a locator is {@code subsequent}. Near-note compares note numbers of the current citation
 * and the last one citing the same reference.</p>
 */
final class PositionTracker {
    private final int nearNoteDistance;

    PositionTracker(int nearNoteDistance) {
        this.nearNoteDistance = nearNoteDistance;
    }

    /**
     * Returns cite information per citation and item, parallel to the input lists. Citation
     * numbers are left at zero.
     */
    List<List<CiteInfo>> assign(List<Citation> citations) {
        Objects.requireNonNull(citations, "citations");
        Map<String, Integer> lastNote = new HashMap<>();
        Map<String, Integer> firstNote = new HashMap<>();
        List<List<CiteInfo>> assigned = new ArrayList<>(citations.size());
        CitationItem previous = null;
        boolean previousAlone = false;

        for (Citation citation : citations) {
            List<CiteInfo> infos = new ArrayList<>(citation.getItems().size());
            Integer note = citation.getNoteNumber();
            for (int i = 0; i < citation.getItems().size(); i++) {
                CitationItem item = citation.getItems().get(i);
                String id = item.getId();
                boolean seen = lastNote.containsKey(id);
                Position position;
                if (!seen) {
                    position = Position.FIRST;
                } else if (previous != null && previous.getId().equals(id) && (i > 0 || previousAlone)) {
                    position = ibidPosition(previous.getLocator(), item.getLocator());
                } else {
                    position = Position.SUBSEQUENT;
                }
                Integer last = lastNote.get(id);
                boolean nearNote = seen && note != null && last != null && note - last <= nearNoteDistance;
                infos.add(CiteInfo.builder()
                        .position(position)
                        .nearNote(nearNote)
                        .locator(item.getLocator())
                        .label(item.getLabel())
                        .noteNumber(note)
                        .firstReferenceNoteNumber(seen ? firstNote.get(id) : null)
                        .build());
                lastNote.put(id, note);
                if (note != null) {
                    firstNote.putIfAbsent(id, note);
                }
                previous = item;
            }
            previousAlone = sameReferenceOnly(citation.getItems());
            assigned.add(infos);
        }
        return assigned;
    }

    private static Position ibidPosition(String previousLocator, String locator) {
        if (Objects.equals(previousLocator, locator)) {
            return Position.IBID;
        }
        if (locator == null) {
            return Position.SUBSEQUENT;
        }
        return Position.IBID_WITH_LOCATOR;
    }

    private static boolean sameReferenceOnly(List<CitationItem> items) {
        if (items.isEmpty()) {
            return false;
        }
        String first = items.get(0).getId();
        for (CitationItem item : items) {
            if (!item.getId().equals(first)) {
                return false;
            }
        }
        return true;
    }
}
