package org.Aayush.citeproc.output;

import lombok.Value;
import org.Aayush.citeproc.reference.Name;

import java.util.List;
import java.util.Objects;

/**
 * Semantic marker carried by {@link Tagged} nodes.
 *
 * <p>Tags never change naive rendering; the disambiguator and citation assembly read them to find
 * names, dates, item boundaries and the year-suffix insertion point.</p>
 */
@Value
public class Tag {
    Kind kind;
    /** Variable name, item id, or term name depending on kind. */
    String value;
    /** Year-suffix ordinal for {@link Kind#YEAR_SUFFIX}. */
    int number;
    /** Item rendering mode for {@link Kind#ITEM}. */
    ItemKind itemKind;
    /** Single name for {@link Kind#NAME}. */
    Name name;
    /** Full name list for {@link Kind#NAMES}. */
    List<Name> names;

    private Tag(Kind kind, String value, int number, ItemKind itemKind, Name name, List<Name> names) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value;
        this.number = number;
        this.itemKind = itemKind;
        this.name = name;
        this.names = names == null ? List.of() : List.copyOf(names);
    }

    public static Tag term(String term) {
        return new Tag(Kind.TERM, term, 0, null, null, null);
    }

    public static Tag citationNumber(int number) {
        return new Tag(Kind.CITATION_NUMBER, null, number, null, null, null);
    }

    public static Tag title() {
        return new Tag(Kind.TITLE, null, 0, null, null, null);
    }

    public static Tag item(String itemId, ItemKind itemKind) {
        return new Tag(Kind.ITEM, itemId, 0, Objects.requireNonNull(itemKind, "itemKind"), null, null);
    }

    public static Tag name(Name name) {
        return new Tag(Kind.NAME, null, 0, null, Objects.requireNonNull(name, "name"), null);
    }

    public static Tag names(String variable, List<Name> names) {
        return new Tag(Kind.NAMES, variable, 0, null, null, names);
    }

    public static Tag date(String variable) {
        return new Tag(Kind.DATE, variable, 0, null, null, null);
    }

    public static Tag yearSuffix(int suffix) {
        return new Tag(Kind.YEAR_SUFFIX, null, suffix, null, null, null);
    }

    public static Tag locator() {
        return new Tag(Kind.LOCATOR, null, 0, null, null, null);
    }

    public enum Kind {
        TERM,
        CITATION_NUMBER,
        TITLE,
        ITEM,
        NAME,
        NAMES,
        DATE,
        YEAR_SUFFIX,
        LOCATOR
    }

    /**
     * How a cited item participates in its citation.
     */
    public enum ItemKind {
        NORMAL,
        AUTHOR_ONLY,
        SUPPRESS_AUTHOR
    }
}
