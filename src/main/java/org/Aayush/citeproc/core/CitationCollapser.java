package org.Aayush.citeproc.core;

import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Outputs;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.output.Tagged;
import org.Aayush.citeproc.render.OutputRenderer;
import org.Aayush.citeproc.style.Collapse;
import org.Aayush.citeproc.style.Layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Joins the rendered items of one citation, applying the layout's collapse mode.
 *
 * <p>Name grouping compares the plain-text rendering of each item's first names span. An item
 * with a suffix never absorbs later items, and items with a prefix or suffix never join an
 * earlier group; grouped items move up next to the first item of their group. Citation-number
 * ranges need at least three consecutive numbers and never swallow an item with affixes.</p>
 */
final class CitationCollapser {
    static final String RANGE_DELIMITER = "–";
    static final String DEFAULT_CITE_GROUP_DELIMITER = ", ";

    private final Layout layout;
    private final String delimiter;
    private final OutputRenderer<String> plainText;

    /**
     * @param layout citation layout holding the collapse settings.
     * @param delimiter resolved delimiter between cites.
     * @param plainText renderer used to compare names and dates.
     */
    CitationCollapser(Layout layout, String delimiter, OutputRenderer<String> plainText) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
        this.plainText = Objects.requireNonNull(plainText, "plainText");
    }

    /**
     * Joins the items in order; the caller applies the layout's outer formatting.
     */
    Output collapse(List<Item> items) {
        if (items.isEmpty()) {
            return Output.nullOutput();
        }
        Collapse mode = layout.getCollapse();
        if (mode == Collapse.CITATION_NUMBER) {
            return collapseNumbers(items);
        }
        if (mode.byNames()) {
            return collapseNames(items);
        }
        if (layout.getCiteGroupDelimiter() != null) {
            return groupAdjacentNames(items);
        }
        return join(outputs(items), delimiter);
    }

    private Output collapseNames(List<Item> items) {
        List<Output> parts = new ArrayList<>();
        List<String> joiners = new ArrayList<>();
        for (List<Item> group : groupByNames(items)) {
            List<Output> outputs = new ArrayList<>(group.size());
            outputs.add(group.get(0).output());
            for (int i = 1; i < group.size(); i++) {
                outputs.add(Outputs.suppressNames(group.get(i).output()));
            }
            parts.add(layout.getCollapse().collapsesYearSuffixes()
                    ? collapseYearSuffixes(outputs)
                    : join(outputs, citeGroupDelimiter()));
            joiners.add(group.size() > 1 ? afterCollapseDelimiter() : delimiter);
        }
        return chain(parts, joiners.subList(0, joiners.size() - 1));
    }

    /**
     * Pulls every later groupable item with the same names up behind the first item of a group.
     */
    private List<List<Item>> groupByNames(List<Item> items) {
        List<List<Item>> groups = new ArrayList<>();
        List<Item> remaining = new ArrayList<>(items);
        while (!remaining.isEmpty()) {
            Item first = remaining.remove(0);
            List<Item> group = new ArrayList<>();
            group.add(first);
            String names = first.hasSuffix() ? null : namesText(first.output());
            if (names != null) {
                List<Item> rest = new ArrayList<>(remaining.size());
                for (Item candidate : remaining) {
                    if (!candidate.hasPrefix() && !candidate.hasSuffix() && names.equals(namesText(candidate.output()))) {
                        group.add(candidate);
                    } else {
                        rest.add(candidate);
                    }
                }
                remaining = rest;
            }
            groups.add(group);
        }
        return groups;
    }

    /**
     * Later same-year items keep only their year suffix ("1999a, b").
     */
    private Output collapseYearSuffixes(List<Output> outputs) {
        String suffixDelimiter = firstNonNull(layout.getYearSuffixDelimiter(), layout.getCiteGroupDelimiter(), delimiter);
        List<List<Output>> years = new ArrayList<>();
        List<Output> current = new ArrayList<>();
        String currentDate = null;
        boolean collapsed = false;
        for (Output output : outputs) {
            String date = dateText(output);
            Output suffixOnly = yearSuffixOnly(output);
            if (!current.isEmpty() && date != null && date.equals(currentDate) && !suffixOnly.isNull()) {
                current.add(suffixOnly);
                collapsed = true;
                continue;
            }
            if (!current.isEmpty()) {
                years.add(current);
            }
            current = new ArrayList<>();
            current.add(output);
            currentDate = date;
        }
        years.add(current);

        boolean ranged = layout.getCollapse() == Collapse.YEAR_SUFFIX_RANGED;
        List<Output> parts = new ArrayList<>(years.size());
        for (List<Output> year : years) {
            parts.add(ranged && year.size() >= 3 ? rangeSuffixes(year, suffixDelimiter) : join(year, suffixDelimiter));
        }
        String between = collapsed
                ? firstNonNull(layout.getCiteGroupDelimiter(), delimiter)
                : citeGroupDelimiter();
        return join(parts, between);
    }

    /**
     * Runs of three or more consecutive suffix letters become "a–c".
     */
    private Output rangeSuffixes(List<Output> year, String suffixDelimiter) {
        List<Output> parts = new ArrayList<>();
        int start = 0;
        while (start < year.size()) {
            int end = start;
            while (end + 1 < year.size() && isNext(yearSuffix(year.get(end)), yearSuffix(year.get(end + 1)))) {
                end++;
            }
            if (end - start >= 2) {
                parts.add(range(year.get(start), year.get(end)));
            } else {
                for (int i = start; i <= end; i++) {
                    parts.add(year.get(i));
                }
            }
            start = end + 1;
        }
        return join(parts, suffixDelimiter);
    }

    private Output collapseNumbers(List<Item> items) {
        List<Output> parts = new ArrayList<>();
        List<String> joiners = new ArrayList<>();
        int start = 0;
        while (start < items.size()) {
            int end = start;
            while (end + 1 < items.size() && inRange(items.get(end), items.get(end + 1))) {
                end++;
            }
            if (end - start >= 2) {
                parts.add(range(items.get(start).output(), items.get(end).output()));
                joiners.add(afterCollapseDelimiter());
            } else {
                for (int i = start; i <= end; i++) {
                    parts.add(items.get(i).output());
                    joiners.add(delimiter);
                }
            }
            start = end + 1;
        }
        return chain(parts, joiners.subList(0, joiners.size() - 1));
    }

    private boolean inRange(Item previous, Item next) {
        return !previous.hasAffixes() && !next.hasAffixes()
                && isNext(citationNumber(previous.output()), citationNumber(next.output()));
    }

    /**
     * Cite-group delimiter without collapse: adjacent items with the same names are joined by it,
     * names stay visible.
     */
    private Output groupAdjacentNames(List<Item> items) {
        List<Output> parts = new ArrayList<>();
        List<Output> group = new ArrayList<>();
        String groupNames = null;
        for (Item item : items) {
            String names = namesText(item.output());
            if (!group.isEmpty() && (names == null || !names.equals(groupNames))) {
                parts.add(join(group, layout.getCiteGroupDelimiter()));
                group = new ArrayList<>();
            }
            if (group.isEmpty()) {
                groupNames = names;
            }
            group.add(item.output());
        }
        parts.add(join(group, layout.getCiteGroupDelimiter()));
        return join(parts, delimiter);
    }

    private String namesText(Output output) {
        Output names = Outputs.firstNames(output);
        if (names.isNull()) {
            return null;
        }
        String text = plainText.render(names);
        return text.isEmpty() ? null : text;
    }

    private String dateText(Output output) {
        Output date = Outputs.firstTagged(output, Tag.Kind.DATE);
        if (date.isNull()) {
            return null;
        }
        String text = plainText.render(Outputs.withoutTagged(date, Tag.Kind.YEAR_SUFFIX));
        return text.isEmpty() ? null : text;
    }

    private static Output yearSuffixOnly(Output output) {
        Output suffix = Outputs.firstTagged(output, Tag.Kind.YEAR_SUFFIX);
        if (suffix.isNull() || output.kind() != Output.Kind.TAGGED) {
            return suffix;
        }
        Tagged item = (Tagged) output;
        return item.tag().getKind() == Tag.Kind.ITEM ? Output.tagged(item.tag(), suffix) : suffix;
    }

    private static int yearSuffix(Output output) {
        return tagNumber(output, Tag.Kind.YEAR_SUFFIX);
    }

    private static int citationNumber(Output output) {
        return tagNumber(output, Tag.Kind.CITATION_NUMBER);
    }

    private static int tagNumber(Output output, Tag.Kind kind) {
        List<Tag> tags = Outputs.findTags(output, kind);
        return tags.isEmpty() ? 0 : tags.get(0).getNumber();
    }

    private static boolean isNext(int previous, int next) {
        return previous > 0 && next == previous + 1;
    }

    private static Output range(Output first, Output last) {
        return Output.sequence(List.of(first, Output.literal(RANGE_DELIMITER), last));
    }

    private String citeGroupDelimiter() {
        return firstNonNull(layout.getCiteGroupDelimiter(), DEFAULT_CITE_GROUP_DELIMITER);
    }

    private String afterCollapseDelimiter() {
        return firstNonNull(layout.getAfterCollapseDelimiter(), delimiter);
    }

    private static Output join(List<Output> parts, String joiner) {
        return Output.formatted(Formatting.delimited(joiner), parts);
    }

    /**
     * Joins {@code parts}, {@code joiners.get(i)} sitting between part i and part i + 1. Nesting
     * to the right keeps delimiter punctuation handling per pair.
     */
    private static Output chain(List<Output> parts, List<String> joiners) {
        Output tail = parts.get(parts.size() - 1);
        for (int i = parts.size() - 2; i >= 0; i--) {
            tail = Output.formatted(Formatting.delimited(joiners.get(i)), List.of(parts.get(i), tail));
        }
        return tail;
    }

    private static List<Output> outputs(List<Item> items) {
        List<Output> outputs = new ArrayList<>(items.size());
        for (Item item : items) {
            outputs.add(item.output());
        }
        return outputs;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * One rendered cite with its item affix flags.
     */
    record Item(Output output, boolean hasPrefix, boolean hasSuffix) {
        boolean hasAffixes() {
            return hasPrefix || hasSuffix;
        }
    }
}
