package org.Aayush.citeproc.core;

import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.HtmlRenderer;
import org.Aayush.citeproc.style.Collapse;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.SecondFieldAlign;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.TextElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.Aayush.citeproc.testutil.CiteprocFixtures.authorDateStyle;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.book;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.numericStyle;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Citation Collapsing Tests")
class CitationCollapsingTest {

    private static final Reference DOE_ALPHA = book("doe-a", "Doe", "John", 1965, "Alpha");
    private static final Reference DOE_BETA = book("doe-b", "Doe", "John", 1965, "Beta");
    private static final Reference DOE_GAMMA = book("doe-c", "Doe", "John", 1965, "Gamma");
    private static final Reference DOE_LATER = book("doe-l", "Doe", "John", 1980, "Later");
    private static final Reference ROE = book("roe", "Roe", "Jane", 1970, "Roe");

    private static String cite(Style style, List<Reference> references, Citation citation) {
        return CiteprocEngine.builder().style(style).build()
                .process(references, List.of(citation))
                .citation(citation.getId());
    }

    private static Style withCitation(Style style, UnaryOperator<Layout.LayoutBuilder> change) {
        return style.toBuilder().citation(change.apply(style.getCitation().toBuilder()).build()).build();
    }

    @Test
    @DisplayName("Year: later cites by the same names drop the names and move up")
    void testYearCollapse() {
        Style style = withCitation(authorDateStyle(), layout -> layout.collapse(Collapse.YEAR));

        String rendered = cite(style, List.of(DOE_ALPHA, ROE, DOE_LATER),
                Citation.of("c1", "doe-a", "roe", "doe-l"));

        assertEquals("(Doe 1965, 1980; Roe 1970)", rendered);
    }

    @Test
    @DisplayName("Year: disambiguation still sees uncollapsed cites")
    void testYearCollapseKeepsYearSuffixes() {
        Style style = withCitation(authorDateStyle(), layout -> layout.collapse(Collapse.YEAR));

        String rendered = cite(style, List.of(DOE_ALPHA, DOE_BETA), Citation.of("c1", "doe-a", "doe-b"));

        assertEquals("(Doe 1965a, 1965b)", rendered);
    }

    @Test
    @DisplayName("Year: cites with their own prefix stay where they are")
    void testAffixedCiteIsNotGrouped() {
        Style style = withCitation(authorDateStyle(), layout -> layout.collapse(Collapse.YEAR));
        Citation citation = Citation.builder()
                .id("c1")
                .item(CitationItem.of("doe-a"))
                .item(CitationItem.of("roe"))
                .item(CitationItem.builder().id("doe-l").prefix("see ").build())
                .build();

        assertEquals("(Doe 1965; Roe 1970; see Doe 1980)", cite(style, List.of(DOE_ALPHA, ROE, DOE_LATER), citation));
    }

    @Test
    @DisplayName("Year suffix: same-year cites keep only their suffix")
    void testYearSuffixCollapse() {
        Style style = withCitation(authorDateStyle(),
                layout -> layout.collapse(Collapse.YEAR_SUFFIX).citeGroupDelimiter(", "));

        String rendered = cite(style, List.of(DOE_ALPHA, DOE_BETA, ROE), Citation.of("c1", "doe-a", "roe", "doe-b"));

        assertEquals("(Doe 1965a, b; Roe 1970)", rendered);
    }

    @Test
    @DisplayName("Year suffix ranged: three consecutive suffixes become a range")
    void testYearSuffixRanged() {
        Style style = withCitation(authorDateStyle(),
                layout -> layout.collapse(Collapse.YEAR_SUFFIX_RANGED).citeGroupDelimiter(", "));

        String rendered = cite(style, List.of(DOE_ALPHA, DOE_BETA, DOE_GAMMA, DOE_LATER),
                Citation.of("c1", "doe-a", "doe-b", "doe-c", "doe-l"));

        assertEquals("(Doe 1965a–c, 1980)", rendered);
    }

    @Test
    @DisplayName("Cite group delimiter: adjacent same-name cites group without dropping names")
    void testCiteGroupDelimiterWithoutCollapse() {
        Style style = withCitation(authorDateStyle(), layout -> layout.citeGroupDelimiter(", "));

        String rendered = cite(style, List.of(DOE_ALPHA, DOE_LATER, ROE), Citation.of("c1", "doe-a", "doe-l", "roe"));

        assertEquals("(Doe 1965, Doe 1980; Roe 1970)", rendered);
    }

    @Test
    @DisplayName("Citation number: runs of three or more become ranges")
    void testCitationNumberRanges() {
        Style style = withCitation(numericStyle(), layout -> layout.collapse(Collapse.CITATION_NUMBER));
        List<Reference> references = List.of(
                book("r1", "A", "A", 2001, "One"),
                book("r2", "B", "B", 2002, "Two"),
                book("r3", "C", "C", 2003, "Three"),
                book("r4", "D", "D", 2004, "Four"),
                book("r5", "E", "E", 2005, "Five"));
        CiteprocEngine engine = CiteprocEngine.builder().style(style).build();

        ProcessResult<String> result = engine.process(references, List.of(
                Citation.of("c1", "r1", "r2", "r3", "r4", "r5"),
                Citation.of("c2", "r5", "r3", "r2", "r1"),
                Citation.of("c3", "r1", "r2")));

        assertEquals("[1–5]", result.citation("c1"));
        assertEquals("[1–3, 5]", result.citation("c2"));
        assertEquals("[1, 2]", result.citation("c3"));
    }

    @Test
    @DisplayName("Citation number: after-collapse delimiter follows a range")
    void testAfterCollapseDelimiter() {
        Style style = withCitation(numericStyle(),
                layout -> layout.collapse(Collapse.CITATION_NUMBER).afterCollapseDelimiter("; "));
        List<Reference> references = List.of(
                book("r1", "A", "A", 2001, "One"),
                book("r2", "B", "B", 2002, "Two"),
                book("r3", "C", "C", 2003, "Three"),
                book("r4", "D", "D", 2004, "Four"),
                book("r5", "E", "E", 2005, "Five"));

        ProcessResult<String> result = CiteprocEngine.builder().style(style).build().process(references, List.of(
                Citation.of("c1", "r1", "r2", "r3", "r4", "r5"),
                Citation.of("c2", "r1", "r2", "r3", "r5")));

        assertEquals("[1–3; 5]", result.citation("c2"));
    }

    @Test
    @DisplayName("Second field align: first field sits in the margin, the layout suffix moves inline")
    void testSecondFieldAlign() {
        Style style = numericStyle().toBuilder()
                .bibliography(Layout.builder()
                        .formatting(Formatting.affixes(null, "."))
                        .element(TextElement.variable("citation-number", Formatting.affixes("[", "]")))
                        .element(TextElement.variable("title"))
                        .secondFieldAlign(SecondFieldAlign.FLUSH)
                        .build())
                .build();

        ProcessResult<String> result = CiteprocEngine.builder().style(style).build()
                .process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")), new HtmlRenderer());

        assertEquals("<div class=\"csl-left-margin\">[1]</div><div class=\"csl-right-inline\">Alpha.</div>",
                result.getBibliography().get(0).getRendering());
    }
}
