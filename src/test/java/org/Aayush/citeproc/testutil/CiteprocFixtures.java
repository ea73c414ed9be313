package org.Aayush.citeproc.testutil;

import org.Aayush.citeproc.diagnostics.DiagnosticCollector;
import org.Aayush.citeproc.eval.CiteInfo;
import org.Aayush.citeproc.eval.DisambiguationHints;
import org.Aayush.citeproc.eval.EvalContext;
import org.Aayush.citeproc.eval.EvalMode;
import org.Aayush.citeproc.locale.BuiltInLocales;
import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.reference.CslDate;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.OutputRenderer;
import org.Aayush.citeproc.render.PlainTextRenderer;
import org.Aayush.citeproc.style.DateElement;
import org.Aayush.citeproc.style.DatePart;
import org.Aayush.citeproc.style.DisambiguationStrategy;
import org.Aayush.citeproc.style.Element;
import org.Aayush.citeproc.style.GivenNameRule;
import org.Aayush.citeproc.style.GroupElement;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.NamesElement;
import org.Aayush.citeproc.style.SortKey;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.TextElement;

import java.util.List;

/**
 * Shared styles, references and contexts for citation processing tests.
 */
public final class CiteprocFixtures {
    public static final String AUTHOR_MACRO = "author";

    private CiteprocFixtures() {
    }

    /**
     * Author names in short form, falling back to editors and then the title.
     */
    public static NamesElement authorNames() {
        return NamesElement.builder()
                .variable("author")
                .name(NameOptions.builder().form(NameOptions.Form.SHORT).build())
                .substituteElement(NamesElement.builder().variable("editor").build())
                .substituteElement(TextElement.variable("title"))
                .build();
    }

    public static DateElement issuedYear() {
        return DateElement.builder()
                .variable("issued")
                .part(DatePart.of(DatePart.Name.YEAR))
                .build();
    }

    /**
     * Author-date style: "(Doe 1965; Roe 1970)" with a "Doe, John. 1965. Title." bibliography
     * sorted by author, year and title.
     */
    public static Style authorDateStyle(DisambiguationStrategy disambiguation) {
        return Style.builder()
                .macro(AUTHOR_MACRO, List.of(authorNames()))
                .citation(Layout.builder()
                        .formatting(Formatting.builder().prefix("(").suffix(")").delimiter("; ").build())
                        .element(GroupElement.of(" ", TextElement.macro(AUTHOR_MACRO), issuedYear()))
                        .disambiguation(disambiguation)
                        .build())
                .bibliography(Layout.builder()
                        .formatting(Formatting.affixes(null, "."))
                        .element(bibliographyEntry())
                        .sortKey(SortKey.macro(AUTHOR_MACRO))
                        .sortKey(SortKey.variable("issued"))
                        .sortKey(SortKey.variable("title"))
                        .build())
                .build();
    }

    public static Style authorDateStyle() {
        return authorDateStyle(DisambiguationStrategy.builder()
                .addNames(true)
                .addGivenName(true)
                .givenNameRule(GivenNameRule.BY_CITE)
                .addYearSuffix(true)
                .build());
    }

    /**
     * Numeric style: "[1, 2]" with "1. Title" bibliography entries in citation order.
     */
    public static Style numericStyle() {
        return Style.builder()
                .citation(Layout.builder()
                        .formatting(Formatting.builder().prefix("[").suffix("]").delimiter(", ").build())
                        .element(TextElement.variable("citation-number"))
                        .sortKey(SortKey.variable("citation-number"))
                        .build())
                .bibliography(Layout.builder()
                        .element(GroupElement.of(". ",
                                TextElement.variable("citation-number"),
                                TextElement.variable("title")))
                        .build())
                .build();
    }

    /**
     * Style with a single-element citation layout and no bibliography.
     */
    public static Style citationOnly(Element element) {
        return Style.builder()
                .citation(Layout.builder().element(element).build())
                .build();
    }

    private static Element bibliographyEntry() {
        return GroupElement.of(". ",
                NamesElement.builder()
                        .variable("author")
                        .name(NameOptions.builder().nameAsSortOrder(NameOptions.SortOrder.ALL).build())
                        .substituteElement(NamesElement.builder().variable("editor").build())
                        .build(),
                issuedYear(),
                TextElement.variable("title"));
    }

    public static Reference book(String id, String family, String given, int year, String title) {
        return Reference.builder()
                .id(id)
                .type("book")
                .names("author", List.of(Name.of(family, given)))
                .date("issued", CslDate.of(year))
                .variable("title", title)
                .build();
    }

    public static Reference book(String id, List<Name> authors, int year, String title) {
        return Reference.builder()
                .id(id)
                .type("book")
                .names("author", authors)
                .date("issued", CslDate.of(year))
                .variable("title", title)
                .build();
    }

    /**
     * Evaluation context for one reference in citation mode with the en-US locale.
     */
    public static EvalContext citationContext(Style style, Reference reference) {
        return context(style, BuiltInLocales.enUs(), reference, EvalMode.CITATION, DisambiguationHints.NONE);
    }

    public static EvalContext context(
            Style style,
            CslLocale locale,
            Reference reference,
            EvalMode mode,
            DisambiguationHints hints
    ) {
        return EvalContext.builder()
                .style(style)
                .locale(locale)
                .reference(reference)
                .mode(mode)
                .cite(CiteInfo.FIRST)
                .hints(hints)
                .diagnostics(new DiagnosticCollector())
                .implicitYearSuffix(true)
                .build();
    }

    /**
     * Renders a tree to plain text with the en-US locale.
     */
    public static String plain(Output output) {
        return plain(output, BuiltInLocales.enUs());
    }

    public static String plain(Output output, CslLocale locale) {
        return new OutputRenderer<>(new PlainTextRenderer(), locale).render(output);
    }
}
