package org.Aayush.citeproc.output;

import lombok.Builder;
import lombok.Value;

/**
 * Formatting metadata attached to a {@link Formatted} or {@link Linked} node.
 *
 * <p>Delimiters and affixes are data here, never literal children. They are resolved in one
 * late pass by the renderer, which is what allows empty content to drop its delimiter and
 * neighbouring punctuation to collapse.</p>
 */
@Value
@Builder(toBuilder = true)
public class Formatting {
    public static final Formatting EMPTY = Formatting.builder().build();

    String prefix;
    String suffix;
    /** Joins surviving children at render time. */
    String delimiter;
    FontStyle fontStyle;
    FontVariant fontVariant;
    FontWeight fontWeight;
    TextDecoration textDecoration;
    VerticalAlign verticalAlign;
    Display display;
    TextCase textCase;
    boolean stripPeriods;
    boolean quotes;
    /** When true, prefix/suffix are applied before font styling and quotes. */
    boolean affixesInside;
    /** Language override for locale-aware transforms (title case). */
    String language;

    /**
     * Creates a formatting carrying only a delimiter.
     */
    public static Formatting delimited(String delimiter) {
        return Formatting.builder().delimiter(delimiter).build();
    }

    /**
     * Creates a formatting carrying only affixes.
     */
    public static Formatting affixes(String prefix, String suffix) {
        return Formatting.builder().prefix(prefix).suffix(suffix).build();
    }

    public boolean hasPrefix() {
        return prefix != null && !prefix.isEmpty();
    }

    public boolean hasSuffix() {
        return suffix != null && !suffix.isEmpty();
    }

    public boolean hasDelimiter() {
        return delimiter != null && !delimiter.isEmpty();
    }

    /**
     * Returns true when any font, decoration or alignment attribute is set.
     */
    public boolean hasStyle() {
        return fontStyle != null || fontVariant != null || fontWeight != null
                || textDecoration != null || verticalAlign != null;
    }

    /**
     * Returns a copy without prefix, suffix and delimiter.
     */
    public Formatting withoutAffixes() {
        return toBuilder().prefix(null).suffix(null).delimiter(null).build();
    }

    public enum FontStyle {NORMAL, ITALIC, OBLIQUE}

    public enum FontVariant {NORMAL, SMALL_CAPS}

    public enum FontWeight {NORMAL, BOLD, LIGHT}

    public enum TextDecoration {NONE, UNDERLINE}

    public enum VerticalAlign {BASELINE, SUPERSCRIPT, SUBSCRIPT}

    public enum Display {BLOCK, LEFT_MARGIN, RIGHT_INLINE, INDENT}

    public enum TextCase {LOWERCASE, UPPERCASE, CAPITALIZE_FIRST, CAPITALIZE_ALL, SENTENCE, TITLE}
}
