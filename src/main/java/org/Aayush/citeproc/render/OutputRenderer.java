package org.Aayush.citeproc.render;

import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.output.Formatted;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.InNote;
import org.Aayush.citeproc.output.Linked;
import org.Aayush.citeproc.output.Literal;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tagged;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders {@link Output} trees through a {@link CslRenderer}.
 *
 * <p>A formatted node renders in this order: text case and strip-periods, inside affixes, font
 * attributes, display, quotes, outside affixes. Joining a child to the following delimiter
 * resolves punctuation collisions: when the child's trailing mark ranks at least as high as the
 * delimiter's leading mark the delimiter loses its mark, otherwise a strippable child mark is
 * dropped. Prefixes and suffixes always print as written. Children that render empty take no
 * delimiter. With {@link CslLocale#punctuationInQuote()} a leading period or comma after a
 * closing quote moves inside the quote.</p>
 *
 * @param <R> rendered representation.
 */
public final class OutputRenderer<R> {
    private final CslRenderer<R> renderer;
    private final CslLocale locale;

    public OutputRenderer(CslRenderer<R> renderer, CslLocale locale) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.locale = Objects.requireNonNull(locale, "locale");
    }

    public CslRenderer<R> renderer() {
        return renderer;
    }

    /**
     * Renders a tree; {@code Null} renders as the renderer's empty value.
     */
    public R render(Output output) {
        Objects.requireNonNull(output, "output");
        return renderNode(TextCaseTransformer.apply(output), 0, null);
    }

    private R renderNode(Output output, int quoteDepth, String pulled) {
        return switch (output.kind()) {
            case NULL -> renderer.empty();
            case LITERAL -> renderer.text(((Literal) output).text());
            case TAGGED -> renderNode(((Tagged) output).child(), quoteDepth, pulled);
            case LINKED -> {
                Linked linked = (Linked) output;
                yield renderer.link(renderChildren(linked.children(), null, quoteDepth, pulled), linked.target());
            }
            case IN_NOTE -> renderer.note(renderNode(((InNote) output).child(), quoteDepth, pulled));
            case FORMATTED -> renderFormatted((Formatted) output, quoteDepth, pulled);
        };
    }

    private R renderFormatted(Formatted formatted, int quoteDepth, String pulled) {
        Formatting formatting = formatted.formatting();
        boolean quotes = formatting.isQuotes();
        String suffix = formatting.getSuffix();
        String intoQuote = quotes ? pulled : null;
        String intoLastChild = quotes ? null : pulled;

        if (quotes && !formatting.isAffixesInside() && formatting.hasSuffix()
                && locale.punctuationInQuote() && movesIntoQuote(suffix.charAt(0))) {
            intoQuote = suffix.substring(0, 1);
            suffix = suffix.substring(1);
        }

        List<Output> children = formatted.children();
        boolean suffixFollowsContent = formatting.isAffixesInside() || !quotes;
        if (suffixFollowsContent && suffix != null && !suffix.isEmpty()
                && locale.punctuationInQuote() && movesIntoQuote(suffix.charAt(0))
                && Punctuation.trailing(Output.sequence(children)).quoted()) {
            intoLastChild = suffix.substring(0, 1);
            suffix = suffix.substring(1);
        }

        int innerDepth = quotes ? quoteDepth + 1 : quoteDepth;
        if (quotes && intoQuote != null) {
            Punctuation.Trail inner = Punctuation.trailing(Output.sequence(children));
            if (inner.rank() >= Punctuation.rank(intoQuote.charAt(0))) {
                intoQuote = null;
            } else if (inner.rank() > 0 && inner.strippable()) {
                children = Punctuation.dropLast(children);
            }
        }
        R content = renderChildren(children, formatting.getDelimiter(), innerDepth, intoLastChild);
        if (quotes && intoQuote != null) {
            content = renderer.concat(List.of(content, renderer.text(intoQuote)));
        }

        if (formatting.isAffixesInside()) {
            content = affix(formatting.getPrefix(), content, suffix);
        }
        content = applyStyle(content, formatting);
        if (formatting.getDisplay() != null) {
            content = renderer.display(content, formatting.getDisplay());
        }
        if (quotes) {
            content = renderer.concat(List.of(
                    renderer.text(locale.openQuote(quoteDepth)),
                    content,
                    renderer.text(locale.closeQuote(quoteDepth))));
        }
        if (!formatting.isAffixesInside()) {
            content = affix(formatting.getPrefix(), content, suffix);
        }
        return content;
    }

    private R renderChildren(List<Output> children, String delimiter, int quoteDepth, String pulledIntoLast) {
        boolean delimited = delimiter != null && !delimiter.isEmpty();
        List<R> parts = new ArrayList<>(children.size() * 2);
        String pendingJoiner = null;
        for (int i = 0; i < children.size(); i++) {
            Output child = children.get(i);
            boolean last = i == children.size() - 1;
            String childPulled = last ? pulledIntoLast : null;
            String joiner = null;
            if (!last && delimited) {
                Join join = join(child, delimiter);
                child = join.left() == null ? child : join.left();
                joiner = join.right();
                childPulled = join.pulled();
            }
            R part = renderNode(child, quoteDepth, childPulled);
            if (renderer.isEmpty(part)) {
                continue;
            }
            if (!parts.isEmpty() && pendingJoiner != null && !pendingJoiner.isEmpty()) {
                parts.add(renderer.text(pendingJoiner));
            }
            parts.add(part);
            pendingJoiner = joiner;
        }
        return renderer.concat(parts);
    }

    /**
     * Resolves the collision between the end of {@code left} and the start of {@code right}.
     */
    private Join join(Output left, String right) {
        char lead = right.charAt(0);
        Punctuation.Trail trail = Punctuation.trailing(left);
        if (trail.quoted() && locale.punctuationInQuote() && movesIntoQuote(lead)) {
            return new Join(null, right.substring(1), String.valueOf(lead));
        }
        if (!Punctuation.isMark(lead) || trail.rank() == 0) {
            return new Join(null, right, null);
        }
        if (trail.rank() >= Punctuation.rank(lead)) {
            return new Join(null, right.substring(1), null);
        }
        if (trail.strippable()) {
            return new Join(Punctuation.dropTrailing(left), right, null);
        }
        return new Join(null, right, null);
    }

    private R applyStyle(R content, Formatting formatting) {
        R styled = content;
        if (formatting.getFontStyle() != null) {
            styled = renderer.fontStyle(styled, formatting.getFontStyle());
        }
        if (formatting.getFontVariant() != null) {
            styled = renderer.fontVariant(styled, formatting.getFontVariant());
        }
        if (formatting.getFontWeight() != null) {
            styled = renderer.fontWeight(styled, formatting.getFontWeight());
        }
        if (formatting.getTextDecoration() != null) {
            styled = renderer.textDecoration(styled, formatting.getTextDecoration());
        }
        if (formatting.getVerticalAlign() != null) {
            styled = renderer.verticalAlign(styled, formatting.getVerticalAlign());
        }
        return styled;
    }

    private R affix(String prefix, R content, String suffix) {
        List<R> parts = new ArrayList<>(3);
        if (prefix != null && !prefix.isEmpty()) {
            parts.add(renderer.text(prefix));
        }
        parts.add(content);
        if (suffix != null && !suffix.isEmpty()) {
            parts.add(renderer.text(suffix));
        }
        return parts.size() == 1 ? content : renderer.concat(parts);
    }

    private static boolean movesIntoQuote(char c) {
        return c == '.' || c == ',';
    }

    /**
     * Outcome of joining: a rewritten left side (null when unchanged), the remaining joiner text
     * and a mark to place inside the left side's closing quote.
     */
    private record Join(Output left, String right, String pulled) {
    }
}
