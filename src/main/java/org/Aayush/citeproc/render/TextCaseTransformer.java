package org.Aayush.citeproc.render;

import org.Aayush.citeproc.output.Formatted;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.InNote;
import org.Aayush.citeproc.output.Linked;
import org.Aayush.citeproc.output.Literal;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tagged;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Applies {@code text-case} and {@code strip-periods} by rewriting the literals of a subtree.
 *
 * <p>One instance handles one subtree so that "first word" state spans literal boundaries.
 * Title case applies to English text only; a {@code language} on the formatting, or inherited
 * from an enclosing formatting, selects the language.</p>
 */
final class TextCaseTransformer {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "as", "at", "but", "by", "down", "for", "from", "in", "into", "nor",
            "of", "on", "onto", "or", "over", "so", "the", "till", "to", "up", "via", "with", "yet");

    private final Formatting.TextCase textCase;
    private final boolean stripPeriods;
    private final boolean english;
    private boolean atStart = true;

    private TextCaseTransformer(Formatting.TextCase textCase, boolean stripPeriods, boolean english) {
        this.textCase = textCase;
        this.stripPeriods = stripPeriods;
        this.english = english;
    }

    /**
     * Rewrites every formatting with text-case or strip-periods in the tree, bottom-up from the
     * outermost such node, and clears those attributes.
     */
    static Output apply(Output output) {
        return applyAll(output, null);
    }

    private static Output applyAll(Output output, String language) {
        return switch (output.kind()) {
            case FORMATTED -> {
                Formatted formatted = (Formatted) output;
                Formatting formatting = formatted.formatting();
                String effectiveLanguage = formatting.getLanguage() != null ? formatting.getLanguage() : language;
                List<Output> children = new ArrayList<>(formatted.children().size());
                for (Output child : formatted.children()) {
                    children.add(applyAll(child, effectiveLanguage));
                }
                if (formatting.getTextCase() == null && !formatting.isStripPeriods()) {
                    yield Output.formatted(formatting, children);
                }
                TextCaseTransformer transformer = new TextCaseTransformer(
                        formatting.getTextCase(), formatting.isStripPeriods(), isEnglish(effectiveLanguage));
                Formatting cleared = formatting.toBuilder().textCase(null).stripPeriods(false).build();
                yield Output.formatted(cleared, transformer.rewriteAll(children));
            }
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                yield Output.tagged(tagged.tag(), applyAll(tagged.child(), language));
            }
            case LINKED -> {
                Linked linked = (Linked) output;
                List<Output> children = new ArrayList<>(linked.children().size());
                for (Output child : linked.children()) {
                    children.add(applyAll(child, language));
                }
                yield Output.linked(linked.target(), children);
            }
            case IN_NOTE -> Output.inNote(applyAll(((InNote) output).child(), language));
            default -> output;
        };
    }

    private static boolean isEnglish(String language) {
        return language == null || language.toLowerCase(Locale.ROOT).startsWith("en");
    }

    private List<Output> rewriteAll(List<Output> children) {
        List<Output> rewritten = new ArrayList<>(children.size());
        for (Output child : children) {
            rewritten.add(rewrite(child));
        }
        return rewritten;
    }

    private Output rewrite(Output output) {
        return switch (output.kind()) {
            case LITERAL -> Output.literal(transform(((Literal) output).text()));
            case FORMATTED -> {
                Formatted formatted = (Formatted) output;
                yield Output.formatted(formatted.formatting(), rewriteAll(formatted.children()));
            }
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                yield Output.tagged(tagged.tag(), rewrite(tagged.child()));
            }
            case LINKED -> {
                Linked linked = (Linked) output;
                yield Output.linked(linked.target(), rewriteAll(linked.children()));
            }
            case IN_NOTE -> Output.inNote(rewrite(((InNote) output).child()));
            case NULL -> output;
        };
    }

    String transform(String text) {
        String value = stripPeriods ? text.replace(".", "") : text;
        if (textCase == null || value.isEmpty()) {
            return value;
        }
        return switch (textCase) {
            case LOWERCASE -> value.toLowerCase(Locale.ROOT);
            case UPPERCASE -> value.toUpperCase(Locale.ROOT);
            case CAPITALIZE_FIRST -> capitalizeFirst(value);
            case CAPITALIZE_ALL -> mapWords(value, (word, first) -> capitalize(word));
            case SENTENCE -> sentence(value);
            case TITLE -> english ? mapWords(value, this::titleWord) : value;
        };
    }

    private String capitalizeFirst(String value) {
        if (!atStart) {
            return value;
        }
        atStart = false;
        return capitalize(value);
    }

    private String sentence(String value) {
        String base = value.equals(value.toUpperCase(Locale.ROOT)) ? value.toLowerCase(Locale.ROOT) : value;
        return capitalizeFirst(base);
    }

    private String titleWord(String word, boolean first) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (!first && STOP_WORDS.contains(lower)) {
            return lower;
        }
        if (word.equals(lower)) {
            return capitalize(word);
        }
        return word;
    }

    private String mapWords(String value, WordMapper mapper) {
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                out.append(c);
                if (c == ':') {
                    atStart = true;
                }
                i++;
                continue;
            }
            int end = i;
            while (end < value.length() && (Character.isLetterOrDigit(value.charAt(end)) || value.charAt(end) == '\'')) {
                end++;
            }
            out.append(mapper.map(value.substring(i, end), atStart));
            atStart = false;
            i = end;
        }
        return out.toString();
    }

    private static String capitalize(String word) {
        int first = 0;
        while (first < word.length() && !Character.isLetter(word.charAt(first))) {
            first++;
        }
        if (first == word.length()) {
            return word;
        }
        return word.substring(0, first) + Character.toUpperCase(word.charAt(first)) + word.substring(first + 1);
    }

    @FunctionalInterface
    private interface WordMapper {
        String map(String word, boolean first);
    }
}
