package org.Aayush.citeproc.core;

import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.diagnostics.DiagnosticKind;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.HtmlRenderer;
import org.Aayush.citeproc.style.GroupElement;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.TextElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.citeproc.testutil.CiteprocFixtures.authorDateStyle;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.book;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.citationOnly;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.numericStyle;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CiteprocEngine Tests")
class CiteprocEngineTest {

    private static final Reference DOE_ALPHA = book("doe-a", "Doe", "John", 1965, "Alpha");
    private static final Reference DOE_BETA = book("doe-b", "Doe", "John", 1965, "Beta");

    @Test
    @DisplayName("Author-date: single citation renders without disambiguation work")
    void testSimpleCitation() {
        ProcessResult<String> result = engine(authorDateStyle())
                .process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")));

        assertEquals("(Doe 1965)", result.citation("c1"));
        assertEquals(1, result.getDisambiguationPasses());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    @DisplayName("Disambiguation: year suffixes follow bibliography order, not citation order")
    void testYearSuffixesInBibliographyOrder() {
        ProcessResult<String> result = engine(authorDateStyle()).process(
                List.of(DOE_BETA, DOE_ALPHA),
                List.of(Citation.of("c1", "doe-b"), Citation.of("c2", "doe-a"))
        );

        assertEquals("(Doe 1965b)", result.citation("c1"));
        assertEquals("(Doe 1965a)", result.citation("c2"));
        assertEquals(2, result.getBibliography().size());
        assertEquals("doe-a", result.getBibliography().get(0).getReferenceId());
        assertEquals("Doe, John. 1965a. Alpha.", result.getBibliography().get(0).getRendering());
        assertEquals("Doe, John. 1965b. Beta.", result.getBibliography().get(1).getRendering());
    }

    @Test
    @DisplayName("Disambiguation: adding names separates et-al lists")
    void testAddNames() {
        Style style = authorDateStyle().toBuilder()
                .nameOptions(NameOptions.builder().etAlMin(3).etAlUseFirst(1).build())
                .build();
        Reference first = book("smith-a", List.of(
                Name.of("Smith", "Ann"), Name.of("Jones", "Bob"), Name.of("Lee", "Cy")), 2000, "One");
        Reference second = book("smith-b", List.of(
                Name.of("Smith", "Ann"), Name.of("Kim", "Dee"), Name.of("Lee", "Cy")), 2000, "Two");

        ProcessResult<String> result = engine(style).process(
                List.of(first, second),
                List.of(Citation.of("c1", "smith-a", "smith-b"))
        );

        assertEquals("(Smith, Jones, et al. 2000; Smith, Kim, et al. 2000)", result.citation("c1"));
        assertEquals(2, result.getDisambiguationPasses());
    }

    @Test
    @DisplayName("Disambiguation: by-cite given names use initials when they separate")
    void testByCiteInitials() {
        ProcessResult<String> result = engine(authorDateStyle()).process(
                List.of(book("doe-j", "Doe", "John", 2000, "One"), book("doe-m", "Doe", "Mary", 2000, "Two")),
                List.of(Citation.of("c1", "doe-j"), Citation.of("c2", "doe-m"))
        );

        assertEquals("(J. Doe 2000)", result.citation("c1"));
        assertEquals("(M. Doe 2000)", result.citation("c2"));
    }

    @Test
    @DisplayName("Disambiguation: by-cite given names fall back to full given names")
    void testByCiteFullGivenNames() {
        ProcessResult<String> result = engine(authorDateStyle()).process(
                List.of(book("doe-j", "Doe", "John", 2000, "One"), book("doe-ja", "Doe", "Jane", 2000, "Two")),
                List.of(Citation.of("c1", "doe-j", "doe-ja"))
        );

        assertEquals("(John Doe 2000; Jane Doe 2000)", result.citation("c1"));
    }

    @Test
    @DisplayName("Disambiguation: exhausted pass budget is reported, not thrown")
    void testDisambiguationBudgetExhausted() {
        CiteprocEngine engine = CiteprocEngine.builder()
                .style(authorDateStyle())
                .runtimeConfig(CiteprocRuntimeConfig.builder().maxDisambiguationPasses(1).build())
                .build();

        ProcessResult<String> result = engine.process(
                List.of(DOE_ALPHA, DOE_BETA),
                List.of(Citation.of("c1", "doe-a", "doe-b"))
        );

        assertEquals("(Doe 1965; Doe 1965)", result.citation("c1"));
        assertEquals(1, result.getDisambiguationPasses());
        List<Diagnostic> incomplete = result.diagnostics(DiagnosticKind.DISAMBIGUATION_INCOMPLETE);
        assertEquals(1, incomplete.size());
        assertEquals(Diagnostic.CODE_DISAMBIGUATION_INCOMPLETE, incomplete.get(0).getCode());
        assertEquals("doe-a", incomplete.get(0).getReferenceId());
    }

    @Test
    @DisplayName("Numeric: citation numbers follow first citation, uncited references come last")
    void testNumericStyle() {
        Reference alpha = book("r1", "Doe", "John", 1965, "Alpha");
        Reference beta = book("r2", "Roe", "Jane", 1970, "Beta");
        Reference gamma = book("r3", "Poe", "Max", 1975, "Gamma");

        ProcessResult<String> result = engine(numericStyle()).process(
                List.of(alpha, beta, gamma),
                List.of(Citation.of("c1", "r2"), Citation.of("c2", "r1", "r2"))
        );

        assertEquals("[1]", result.citation("c1"));
        assertEquals("[1, 2]", result.citation("c2"));
        assertEquals(3, result.getBibliography().size());
        assertEquals("1. Beta", result.getBibliography().get(0).getRendering());
        assertEquals("2. Alpha", result.getBibliography().get(1).getRendering());
        assertEquals("3. Gamma", result.getBibliography().get(2).getRendering());
        assertEquals(0, result.getDisambiguationPasses());
    }

    @Test
    @DisplayName("Citation items: suppress-author, author-only and item affixes")
    void testCitationItemFlags() {
        Citation suppressed = Citation.builder()
                .id("c1")
                .item(CitationItem.builder().id("doe-a").suppressAuthor(true).build())
                .build();
        Citation authorOnly = Citation.builder()
                .id("c2")
                .item(CitationItem.builder().id("doe-a").authorOnly(true).build())
                .build();
        Citation affixed = Citation.builder()
                .id("c3")
                .item(CitationItem.builder().id("doe-a").prefix("see ").suffix(", p. 5").build())
                .build();

        ProcessResult<String> result = engine(authorDateStyle())
                .process(List.of(DOE_ALPHA), List.of(suppressed, authorOnly, affixed));

        assertEquals("(1965)", result.citation("c1"));
        assertEquals("(Doe)", result.citation("c2"));
        assertEquals("(see Doe 1965, p. 5)", result.citation("c3"));
    }

    @Test
    @DisplayName("Diagnostics: unknown reference ids are skipped and reported")
    void testUnknownReference() {
        ProcessResult<String> result = engine(authorDateStyle())
                .process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "ghost", "doe-a")));

        assertEquals("(Doe 1965)", result.citation("c1"));
        List<Diagnostic> warnings = result.diagnostics(DiagnosticKind.DATA_WARNING);
        assertEquals(1, warnings.size());
        assertEquals(Diagnostic.CODE_UNKNOWN_REFERENCE, warnings.get(0).getCode());
        assertEquals("ghost", warnings.get(0).getReferenceId());
    }

    @Test
    @DisplayName("Renderer: runtime config selects the html renderer")
    void testHtmlRuntime() {
        Style style = citationOnly(TextElement.variable("title",
                Formatting.builder().fontStyle(Formatting.FontStyle.ITALIC).build()));
        CiteprocEngine engine = CiteprocEngine.builder()
                .style(style)
                .runtimeConfig(CiteprocRuntimeConfig.html())
                .build();

        ProcessResult<String> result = engine.process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")));

        assertEquals("<i>Alpha</i>", result.citation("c1"));
        assertTrue(result.getBibliography().isEmpty());
    }

    @Test
    @DisplayName("Renderer: per-call renderer overrides the configured one")
    void testPerCallRenderer() {
        Style style = citationOnly(TextElement.variable("title",
                Formatting.builder().fontWeight(Formatting.FontWeight.BOLD).build()));

        ProcessResult<String> result = engine(style)
                .process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")), new HtmlRenderer());

        assertEquals("<b>Alpha</b>", result.citation("c1"));
    }

    @Test
    @DisplayName("Determinism: repeated calls produce equal results")
    void testRepeatedCallsAreEqual() {
        CiteprocEngine engine = engine(authorDateStyle());
        List<Reference> references = List.of(DOE_ALPHA, DOE_BETA);
        List<Citation> citations = List.of(Citation.of("c1", "doe-b"), Citation.of("c2", "doe-a", "doe-b"));

        assertEquals(engine.process(references, citations), engine.process(references, citations));
    }

    @Test
    @DisplayName("Locale: explicit tag resolves, unknown language fails")
    void testLocaleResolution() {
        CiteprocEngine british = CiteprocEngine.builder().style(authorDateStyle()).localeTag("en-GB").build();
        assertEquals("en-GB", british.locale().lang());

        CiteprocException ex = assertThrows(CiteprocException.class,
                () -> CiteprocEngine.builder().style(authorDateStyle()).localeTag("fr-FR").build());
        assertEquals(CiteprocEngine.REASON_UNKNOWN_LOCALE, ex.reasonCode());
    }

    @Test
    @DisplayName("Locale: unknown style default falls back to the root locale")
    void testStyleDefaultLocaleFallback() {
        Style style = authorDateStyle().toBuilder().defaultLocale("fr-FR").build();

        CiteprocEngine engine = engine(style);

        assertNotNull(engine.locale());
        assertEquals("en-US", engine.locale().lang());
        ProcessResult<String> result = engine.process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")));
        assertEquals(Diagnostic.CODE_LOCALE_FALLBACK, result.getDiagnostics().get(0).getCode());
    }

    @Test
    @DisplayName("Locale: regional tag without its own locale falls back within the language")
    void testRegionalLocaleFallback() {
        CiteprocEngine engine = CiteprocEngine.builder().style(authorDateStyle()).localeTag("en-AU").build();

        ProcessResult<String> result = engine.process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a")));

        assertEquals("en-US", engine.locale().lang());
        assertEquals("(Doe 1965)", result.citation("c1"));
        assertEquals(1, result.diagnostics(DiagnosticKind.DATA_WARNING).size());
    }

    @Test
    @DisplayName("Failure: malformed style is rejected at construction")
    void testInvalidStyle() {
        CiteprocException ex = assertThrows(CiteprocException.class, () -> engine(Style.builder().build()));
        assertEquals(CiteprocEngine.REASON_STYLE_INVALID, ex.reasonCode());
    }

    @Test
    @DisplayName("Failure: style errors found during evaluation surface as invalid style")
    void testUndefinedTermDuringProcess() {
        Style style = citationOnly(GroupElement.of(" ", TextElement.term("no-such-term")));

        CiteprocException ex = assertThrows(CiteprocException.class,
                () -> engine(style).process(List.of(DOE_ALPHA), List.of(Citation.of("c1", "doe-a"))));
        assertEquals(CiteprocEngine.REASON_STYLE_INVALID, ex.reasonCode());
    }

    @Test
    @DisplayName("Failure: unknown renderer id")
    void testUnknownRenderer() {
        CiteprocException ex = assertThrows(CiteprocException.class, () -> CiteprocEngine.builder()
                .style(authorDateStyle())
                .runtimeConfig(CiteprocRuntimeConfig.builder().rendererId("rtf").build())
                .build());
        assertEquals(CiteprocEngine.REASON_UNKNOWN_RENDERER, ex.reasonCode());
    }

    @Test
    @DisplayName("Failure: missing inputs and duplicate reference ids")
    void testInputValidation() {
        CiteprocEngine engine = engine(authorDateStyle());

        CiteprocException noReferences = assertThrows(CiteprocException.class,
                () -> engine.process(null, List.of()));
        assertEquals(CiteprocEngine.REASON_REFERENCES_REQUIRED, noReferences.reasonCode());

        CiteprocException noCitations = assertThrows(CiteprocException.class,
                () -> engine.process(List.of(DOE_ALPHA), null));
        assertEquals(CiteprocEngine.REASON_CITATIONS_REQUIRED, noCitations.reasonCode());

        CiteprocException duplicate = assertThrows(CiteprocException.class,
                () -> engine.process(List.of(DOE_ALPHA, book("doe-a", "Roe", "Jane", 1970, "Other")), List.of()));
        assertEquals(CiteprocEngine.REASON_DUPLICATE_REFERENCE_ID, duplicate.reasonCode());
        assertTrue(duplicate.getMessage().startsWith("[" + CiteprocEngine.REASON_DUPLICATE_REFERENCE_ID + "]"));
    }

    @Test
    @DisplayName("Layout: citation without layout delimiter joins items with the default delimiter")
    void testDefaultCitationDelimiter() {
        Style style = Style.builder()
                .citation(Layout.builder().element(TextElement.variable("title")).build())
                .build();

        ProcessResult<String> result = engine(style)
                .process(List.of(DOE_ALPHA, DOE_BETA), List.of(Citation.of("c1", "doe-a", "doe-b")));

        assertEquals("Alpha; Beta", result.citation("c1"));
    }

    private static CiteprocEngine engine(Style style) {
        return CiteprocEngine.builder().style(style).build();
    }
}
