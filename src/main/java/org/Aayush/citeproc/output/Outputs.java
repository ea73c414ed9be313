package org.Aayush.citeproc.output;

import lombok.experimental.UtilityClass;
import org.Aayush.citeproc.reference.Name;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural queries and rewrites over {@link Output} trees.
 */
@UtilityClass
public class Outputs {

    /**
     * Collects tags of one kind in document order.
     */
    public List<Tag> findTags(Output output, Tag.Kind kind) {
        List<Tag> tags = new ArrayList<>();
        collectTags(output, kind, tags);
        return tags;
    }

    /**
     * Returns every name carried by {@code NAMES} tags, in document order.
     */
    public List<Name> extractNames(Output output) {
        List<Name> names = new ArrayList<>();
        for (Tag tag : findTags(output, Tag.Kind.NAMES)) {
            names.addAll(tag.getNames());
        }
        return names;
    }

    /**
     * Returns the first {@code NAMES} subtree, or {@code Null} when the tree has none.
     */
    public Output firstNames(Output output) {
        return firstTagged(output, Tag.Kind.NAMES);
    }

    /**
     * Returns the first subtree tagged with {@code kind}, tag included, or {@code Null}.
     */
    public Output firstTagged(Output output, Tag.Kind kind) {
        return switch (output.kind()) {
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                yield tagged.tag().getKind() == kind ? tagged : firstTagged(tagged.child(), kind);
            }
            case FORMATTED -> firstAmong(((Formatted) output).children(), kind);
            case LINKED -> firstAmong(((Linked) output).children(), kind);
            case IN_NOTE -> firstTagged(((InNote) output).child(), kind);
            default -> Output.nullOutput();
        };
    }

    /**
     * Returns a copy of the tree with every subtree tagged with {@code kind} removed.
     */
    public Output withoutTagged(Output output, Tag.Kind kind) {
        return switch (output.kind()) {
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                yield tagged.tag().getKind() == kind
                        ? Output.nullOutput()
                        : Output.tagged(tagged.tag(), withoutTagged(tagged.child(), kind));
            }
            case FORMATTED -> {
                Formatted formatted = (Formatted) output;
                yield Output.formatted(formatted.formatting(), withoutTaggedAll(formatted.children(), kind));
            }
            case LINKED -> {
                Linked linked = (Linked) output;
                yield Output.linked(linked.target(), withoutTaggedAll(linked.children(), kind));
            }
            case IN_NOTE -> Output.inNote(withoutTagged(((InNote) output).child(), kind));
            default -> output;
        };
    }

    /**
     * Returns a copy of the tree with the first {@code NAMES} subtree removed.
     */
    public Output suppressNames(Output output) {
        return new NameSuppressor().rewrite(output);
    }

    private List<Output> withoutTaggedAll(List<Output> children, Tag.Kind kind) {
        List<Output> kept = new ArrayList<>(children.size());
        for (Output child : children) {
            kept.add(withoutTagged(child, kind));
        }
        return kept;
    }

    private Output firstAmong(List<Output> children, Tag.Kind kind) {
        for (Output child : children) {
            Output found = firstTagged(child, kind);
            if (!found.isNull()) {
                return found;
            }
        }
        return Output.nullOutput();
    }

    private void collectTags(Output output, Tag.Kind kind, List<Tag> sink) {
        switch (output.kind()) {
            case TAGGED -> {
                Tagged tagged = (Tagged) output;
                if (tagged.tag().getKind() == kind) {
                    sink.add(tagged.tag());
                }
                collectTags(tagged.child(), kind, sink);
            }
            case FORMATTED -> {
                for (Output child : ((Formatted) output).children()) {
                    collectTags(child, kind, sink);
                }
            }
            case LINKED -> {
                for (Output child : ((Linked) output).children()) {
                    collectTags(child, kind, sink);
                }
            }
            case IN_NOTE -> collectTags(((InNote) output).child(), kind, sink);
            default -> {
            }
        }
    }

    /**
     * One-shot rewriter; removes only the first names span it meets.
     */
    private static final class NameSuppressor {
        private boolean done;

        Output rewrite(Output output) {
            if (done) {
                return output;
            }
            return switch (output.kind()) {
                case TAGGED -> {
                    Tagged tagged = (Tagged) output;
                    if (tagged.tag().getKind() == Tag.Kind.NAMES) {
                        done = true;
                        yield Output.nullOutput();
                    }
                    yield Output.tagged(tagged.tag(), rewrite(tagged.child()));
                }
                case FORMATTED -> {
                    Formatted formatted = (Formatted) output;
                    yield Output.formatted(formatted.formatting(), rewriteAll(formatted.children()));
                }
                case LINKED -> {
                    Linked linked = (Linked) output;
                    yield Output.linked(linked.target(), rewriteAll(linked.children()));
                }
                case IN_NOTE -> Output.inNote(rewrite(((InNote) output).child()));
                default -> output;
            };
        }

        private List<Output> rewriteAll(List<Output> children) {
            List<Output> rewritten = new ArrayList<>(children.size());
            for (Output child : children) {
                rewritten.add(rewrite(child));
            }
            return rewritten;
        }
    }
}
