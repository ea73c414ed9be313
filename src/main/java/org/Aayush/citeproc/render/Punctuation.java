package org.Aayush.citeproc.render;

import lombok.experimental.UtilityClass;
import org.Aayush.citeproc.output.Formatted;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.InNote;
import org.Aayush.citeproc.output.Linked;
import org.Aayush.citeproc.output.Literal;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.output.Tagged;

import java.util.ArrayList;
import java.util.List;

/**
 * Trailing-punctuation analysis of output trees.
 *
 * <p>Marks rank {@code ! = ? > : > ; > , > .}. The trailing mark of a subtree is read the way
 * {@link OutputRenderer} will print it: an outside suffix wins, then a closing quote, then an
 * inside suffix, then the last child. Suffixes and text inside term and name spans ("et al.",
 * "J.") are reported as not strippable, so only rendered content ever loses a mark.</p>
 */
@UtilityClass
public class Punctuation {

    /**
     * Returns the precedence of a punctuation mark, 0 when the character is not one.
     */
    public int rank(char c) {
        return switch (c) {
            case '!', '?' -> 5;
            case ':' -> 4;
            case ';' -> 3;
            case ',' -> 2;
            case '.' -> 1;
            default -> 0;
        };
    }

    public boolean isMark(char c) {
        return rank(c) > 0;
    }

    /**
     * Returns the trailing character of a subtree as it will render.
     */
    public Trail trailing(Output output) {
        return trailing(output, true);
    }

    private Trail trailing(Output output, boolean strippable) {
        return switch (output.kind()) {
            case NULL -> Trail.NONE;
            case LITERAL -> {
                String text = ((Literal) output).text();
                if (text.isEmpty()) {
                    yield Trail.NONE;
                }
                yield new Trail(text.charAt(text.length() - 1), strippable, false, null);
            }
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                Tag.Kind kind = tagged.tag().getKind();
                yield trailing(tagged.child(), strippable && kind != Tag.Kind.TERM && kind != Tag.Kind.NAME);
            }
            case LINKED -> lastTrail(((Linked) output).children(), strippable);
            case IN_NOTE -> trailing(((InNote) output).child(), strippable);
            case FORMATTED -> {
                Formatted formatted = (Formatted) output;
                Formatting formatting = formatted.formatting();
                if (!formatting.isAffixesInside() && formatting.hasSuffix()) {
                    yield suffixTrail(formatting.getSuffix());
                }
                if (formatting.isQuotes()) {
                    yield new Trail('\0', false, true, lastTrail(formatted.children(), strippable));
                }
                if (formatting.hasSuffix()) {
                    yield suffixTrail(formatting.getSuffix());
                }
                yield lastTrail(formatted.children(), strippable);
            }
        };
    }

    /**
     * Removes the trailing character reported by {@link #trailing(Output)}.
     */
    public Output dropTrailing(Output output) {
        return switch (output.kind()) {
            case NULL -> output;
            case LITERAL -> {
                String text = ((Literal) output).text();
                if (text.isEmpty()) {
                    yield output;
                }
                yield Output.literal(text.substring(0, text.length() - 1));
            }
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                yield Output.tagged(tagged.tag(), dropTrailing(tagged.child()));
            }
            case LINKED -> {
                Linked linked = (Linked) output;
                yield Output.linked(linked.target(), dropLast(linked.children()));
            }
            case IN_NOTE -> Output.inNote(dropTrailing(((InNote) output).child()));
            case FORMATTED -> {
                Formatted formatted = (Formatted) output;
                Formatting formatting = formatted.formatting();
                if (formatting.isQuotes() || formatting.hasSuffix()) {
                    yield output;
                }
                yield Output.formatted(formatting, dropLast(formatted.children()));
            }
        };
    }

    private Trail suffixTrail(String suffix) {
        return new Trail(suffix.charAt(suffix.length() - 1), false, false, null);
    }

    private Trail lastTrail(List<Output> children, boolean strippable) {
        for (int i = children.size() - 1; i >= 0; i--) {
            if (!children.get(i).isNull()) {
                return trailing(children.get(i), strippable);
            }
        }
        return Trail.NONE;
    }

    /**
     * Returns a copy of the list whose last non-null element lost its trailing character.
     */
    public List<Output> dropLast(List<Output> children) {
        List<Output> rewritten = new ArrayList<>(children);
        for (int i = rewritten.size() - 1; i >= 0; i--) {
            if (!rewritten.get(i).isNull()) {
                rewritten.set(i, dropTrailing(rewritten.get(i)));
                break;
            }
        }
        return rewritten;
    }

    /**
     * Trailing character of a subtree.
     *
     * @param mark last character, {@code '\0'} when none or when the subtree ends with a quote.
     * @param strippable whether the character may be removed in a collision.
     * @param quoted whether the subtree ends with a closing quote.
     * @param inner trailing character inside the closing quote, set only when quoted.
     */
    public record Trail(char mark, boolean strippable, boolean quoted, Trail inner) {
        public static final Trail NONE = new Trail('\0', false, false, null);

        public int rank() {
            return Punctuation.rank(mark);
        }
    }
}
