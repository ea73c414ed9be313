package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.locale.BuiltInLocales;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.style.LabelElement;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.NamesElement;
import org.Aayush.citeproc.style.Position;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.TermForm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.citeproc.testutil.CiteprocFixtures.authorNames;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.citationContext;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.citationOnly;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.context;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.plain;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Names Evaluation Tests")
class NamesEvaluationTest {
    private static final Name DOE = Name.of("Doe", "John");
    private static final Name ROE = Name.of("Roe", "Jane");
    private static final Name POE = Name.of("Poe", "Max");

    private final Evaluator evaluator = new Evaluator();

    private static Reference authored(Name... names) {
        return Reference.builder().id("r").type("book").names("author", List.of(names)).build();
    }

    private static NamesElement authors(NameOptions options) {
        return NamesElement.builder().variable("author").name(options).build();
    }

    private String render(NamesElement element, Reference reference) {
        Style style = citationOnly(element);
        return plain(evaluator.evaluate(element, citationContext(style, reference)));
    }

    @Test
    @DisplayName("Lists: two names join with the and term without a delimiter")
    void testTwoNamesWithAnd() {
        NameOptions options = NameOptions.builder().and(NameOptions.And.TEXT).build();
        assertEquals("John Doe and Jane Roe", render(authors(options), authored(DOE, ROE)));
    }

    @Test
    @DisplayName("Lists: three names take the delimiter before and")
    void testThreeNamesWithAnd() {
        NameOptions options = NameOptions.builder().and(NameOptions.And.TEXT).build();
        assertEquals("John Doe, Jane Roe, and Max Poe", render(authors(options), authored(DOE, ROE, POE)));
    }

    @Test
    @DisplayName("Lists: symbol form of and")
    void testSymbolAnd() {
        NameOptions options = NameOptions.builder().and(NameOptions.And.SYMBOL).form(NameOptions.Form.SHORT).build();
        assertEquals("Doe & Roe", render(authors(options), authored(DOE, ROE)));
    }

    @Test
    @DisplayName("Et-al: one shown name takes no delimiter before et al.")
    void testEtAlAfterOneName() {
        NameOptions options = NameOptions.builder().etAlMin(3).etAlUseFirst(1).build();
        assertEquals("John Doe et al.", render(authors(options), authored(DOE, ROE, POE)));
    }

    @Test
    @DisplayName("Et-al: two shown names take the delimiter before et al.")
    void testEtAlAfterTwoNames() {
        NameOptions options = NameOptions.builder().etAlMin(3).etAlUseFirst(2).form(NameOptions.Form.SHORT).build();
        assertEquals("Doe, Roe, et al.", render(authors(options), authored(DOE, ROE, POE)));
    }

    @Test
    @DisplayName("Et-al: use-last shows an ellipsis and the final name")
    void testEtAlUseLast() {
        Name fourth = Name.of("Moe", "Ann");
        NameOptions options = NameOptions.builder()
                .etAlMin(4).etAlUseFirst(1).etAlUseLast(true).form(NameOptions.Form.SHORT).build();
        assertEquals("Doe, … Moe", render(authors(options), authored(DOE, ROE, POE, fourth)));
    }

    @Test
    @DisplayName("Et-al: subsequent cites use the subsequent thresholds")
    void testSubsequentEtAl() {
        NamesElement element = authors(NameOptions.builder()
                .form(NameOptions.Form.SHORT)
                .etAlMin(5).etAlUseFirst(3)
                .etAlSubsequentMin(2).etAlSubsequentUseFirst(1)
                .build());
        Style style = citationOnly(element);
        Reference reference = authored(DOE, ROE);

        assertEquals("Doe, Roe", plain(evaluator.evaluate(element, citationContext(style, reference))));
        EvalContext subsequent = citationContext(style, reference).toBuilder()
                .cite(CiteInfo.builder().position(Position.SUBSEQUENT).build())
                .build();
        assertEquals("Doe et al.", plain(evaluator.evaluate(element, subsequent)));
    }

    @Test
    @DisplayName("Order: name-as-sort-order inverts family and given")
    void testInvertedNames() {
        NameOptions options = NameOptions.builder().nameAsSortOrder(NameOptions.SortOrder.FIRST).build();
        assertEquals("Doe, John, Jane Roe", render(authors(options), authored(DOE, ROE)));
    }

    @Test
    @DisplayName("Order: non-dropping particle is demoted only when inverted")
    void testParticles() {
        Name gogh = Name.builder().family("Gogh").given("Vincent").nonDroppingParticle("van").build();
        assertEquals("Vincent van Gogh", render(authors(NameOptions.EMPTY), authored(gogh)));
        assertEquals("Gogh, Vincent van", render(
                authors(NameOptions.builder().nameAsSortOrder(NameOptions.SortOrder.ALL).build()), authored(gogh)));
    }

    @Test
    @DisplayName("Given names: initialize-with reduces given names")
    void testInitializeWith() {
        NameOptions options = NameOptions.builder().initializeWith(". ").build();
        assertEquals("J. P. Doe", render(authors(options), authored(Name.of("Doe", "John Paul"))));
    }

    @Test
    @DisplayName("Given names: literal names render verbatim")
    void testLiteralName() {
        assertEquals("World Health Organization",
                render(authors(NameOptions.EMPTY), authored(Name.literal("World Health Organization"))));
    }

    @Test
    @DisplayName("Hints: expansion hints widen short-form names in citations")
    void testNameHints() {
        NamesElement element = authors(NameOptions.builder().form(NameOptions.Form.SHORT).build());
        Style style = citationOnly(element);
        Reference reference = authored(DOE);

        DisambiguationHints initials = DisambiguationHints.builder().nameHint(DOE.hintKey(), NameHint.ADD_INITIALS).build();
        assertEquals("J. Doe", plain(evaluator.evaluate(element,
                context(style, BuiltInLocales.enUs(), reference, EvalMode.CITATION, initials))));

        DisambiguationHints given = DisambiguationHints.builder().nameHint(DOE.hintKey(), NameHint.ADD_GIVEN_NAME).build();
        assertEquals("John Doe", plain(evaluator.evaluate(element,
                context(style, BuiltInLocales.enUs(), reference, EvalMode.CITATION, given))));

        assertEquals("Doe", plain(evaluator.evaluate(element,
                context(style, BuiltInLocales.enUs(), reference, EvalMode.BIBLIOGRAPHY, given))));
    }

    @Test
    @DisplayName("Hints: primary-only hints leave later names short")
    void testPrimaryOnlyHint() {
        NamesElement element = authors(NameOptions.builder().form(NameOptions.Form.SHORT).build());
        Name secondDoe = Name.of("Doe", "John");
        DisambiguationHints hints = DisambiguationHints.builder()
                .nameHint(DOE.hintKey(), NameHint.ADD_INITIALS_IF_PRIMARY)
                .build();
        assertEquals("J. Doe, Roe", plain(evaluator.evaluate(element, context(citationOnly(element),
                BuiltInLocales.enUs(), authored(DOE, ROE), EvalMode.CITATION, hints))));
        assertEquals("Roe, Doe", plain(evaluator.evaluate(element, context(citationOnly(element),
                BuiltInLocales.enUs(), authored(ROE, secondDoe), EvalMode.CITATION, hints))));
    }

    @Test
    @DisplayName("Count: count form prints the number of shown names")
    void testCountForm() {
        NameOptions options = NameOptions.builder().form(NameOptions.Form.COUNT).build();
        assertEquals("3", render(authors(options), authored(DOE, ROE, POE)));
    }

    @Test
    @DisplayName("Labels: identical editor and translator collapse into one role")
    void testEditorTranslatorCollapse() {
        NamesElement element = NamesElement.builder()
                .variable("editor")
                .variable("translator")
                .label(LabelElement.builder().form(TermForm.SHORT).formatting(Formatting.affixes(" (", ")")).build())
                .build();
        Reference reference = Reference.builder().id("e").type("book")
                .names("editor", List.of(DOE))
                .names("translator", List.of(DOE))
                .build();
        assertEquals("John Doe (ed. & tran.)", render(element, reference));
    }

    @Test
    @DisplayName("Substitute: editors stand in for missing authors in the author's form")
    void testSubstituteEditors() {
        Reference edited = Reference.builder().id("e").type("book").names("editor", List.of(ROE)).build();
        assertEquals("Roe", render(authorNames(), edited));
    }
}
