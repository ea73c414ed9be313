package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.locale.BuiltInLocales;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.HtmlRenderer;
import org.Aayush.citeproc.render.OutputRenderer;
import org.Aayush.citeproc.style.ChooseBranch;
import org.Aayush.citeproc.style.ChooseElement;
import org.Aayush.citeproc.style.Condition;
import org.Aayush.citeproc.style.Element;
import org.Aayush.citeproc.style.GroupElement;
import org.Aayush.citeproc.style.LabelElement;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.NumberElement;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.StyleException;
import org.Aayush.citeproc.style.StyleOptions;
import org.Aayush.citeproc.style.TermForm;
import org.Aayush.citeproc.style.TextElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.Aayush.citeproc.testutil.CiteprocFixtures.authorNames;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.book;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.citationContext;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.citationOnly;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.context;
import static org.Aayush.citeproc.testutil.CiteprocFixtures.plain;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Evaluator Tests")
class EvaluatorTest {
    private final Evaluator evaluator = new Evaluator();

    private String render(Element element, Reference reference) {
        Style style = citationOnly(element);
        return plain(evaluator.evaluate(element, citationContext(style, reference)));
    }

    private static Reference article() {
        return Reference.builder()
                .id("a1")
                .type("article-journal")
                .variable("title", "Cold Fusion")
                .variable("title-short", "Fusion")
                .variable("page", "321-328")
                .variable("volume", "12")
                .variable("edition", "2")
                .variable("DOI", "10.1000/xyz")
                .build();
    }

    @Test
    @DisplayName("Text: variables, values and short-form companions")
    void testTextSources() {
        assertEquals("Cold Fusion", render(TextElement.variable("title"), article()));
        assertEquals("Fusion", render(TextElement.builder()
                .source(TextElement.Source.VARIABLE).value("title").form(TermForm.SHORT).build(), article()));
        assertEquals("Vol.", render(TextElement.value("Vol."), article()));
    }

    @Test
    @DisplayName("Text: missing variable renders nothing and warns")
    void testMissingVariableWarns() {
        Style style = citationOnly(TextElement.variable("publisher"));
        EvalContext ctx = citationContext(style, article());
        Output output = evaluator.evaluate(TextElement.variable("publisher"), ctx);

        assertTrue(output.isNull());
        assertTrue(ctx.diagnostics().contains(Diagnostic.CODE_MISSING_VARIABLE));
    }

    @Test
    @DisplayName("Text: DOI links to the resolver")
    void testDoiLink() {
        Style style = citationOnly(TextElement.variable("DOI"));
        Output output = evaluator.evaluate(TextElement.variable("DOI"), citationContext(style, article()));
        assertEquals("<a href=\"https://doi.org/10.1000/xyz\">10.1000/xyz</a>",
                new OutputRenderer<>(new HtmlRenderer(), BuiltInLocales.enUs()).render(output));
    }

    @Test
    @DisplayName("Group: suppressed when every consulted variable is empty")
    void testGroupSuppression() {
        Element group = GroupElement.of(" ", TextElement.value("Vol."), TextElement.variable("issue"));
        assertEquals("", render(group, article()));

        Element filled = GroupElement.of(" ", TextElement.value("Vol."), TextElement.variable("volume"));
        assertEquals("Vol. 12", render(filled, article()));
    }

    @Test
    @DisplayName("Group: renders when it consults no variables")
    void testGroupWithoutVariables() {
        assertEquals("a b", render(GroupElement.of(" ", TextElement.value("a"), TextElement.value("b")), article()));
    }

    @Test
    @DisplayName("Macro: behaves as an implicit group")
    void testMacroSuppression() {
        Element call = GroupElement.of(" ", TextElement.value("Issue"), TextElement.macro("issue"));
        Style style = Style.builder()
                .macro("issue", List.of(TextElement.variable("issue")))
                .citation(Layout.builder().element(call).build())
                .build();
        EvalContext ctx = citationContext(style, article());
        assertEquals("", plain(evaluator.evaluate(call, ctx)));
    }

    @Test
    @DisplayName("Failure: undefined macro raises a reason-coded style error")
    void testUndefinedMacro() {
        StyleException ex = assertThrows(StyleException.class,
                () -> render(TextElement.macro("nope"), article()));
        assertEquals(StyleException.REASON_UNDEFINED_MACRO, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[STYLE_UNDEFINED_MACRO]"));
    }

    @Test
    @DisplayName("Failure: undefined term raises a reason-coded style error")
    void testUndefinedTerm() {
        StyleException ex = assertThrows(StyleException.class,
                () -> render(TextElement.term("no-such-term"), article()));
        assertEquals(StyleException.REASON_UNDEFINED_TERM, ex.reasonCode());
    }

    @Test
    @DisplayName("Failure: self-referencing macro hits the nesting limit")
    void testMacroCycle() {
        Style style = Style.builder()
                .macro("loop", List.of(TextElement.macro("loop")))
                .citation(Layout.builder().element(TextElement.macro("loop")).build())
                .build();
        EvalContext ctx = citationContext(style, article());
        StyleException ex = assertThrows(StyleException.class,
                () -> evaluator.evaluate(TextElement.macro("loop"), ctx));
        assertEquals(StyleException.REASON_MACRO_CYCLE, ex.reasonCode());
    }

    @Test
    @DisplayName("Terms: missing term falls back to the root locale with a warning")
    void testTermLocaleFallback() {
        Style style = citationOnly(TextElement.term("circa"));
        EvalContext ctx = context(style, BuiltInLocales.deDe(), article(), EvalMode.CITATION, DisambiguationHints.NONE);

        assertEquals("circa", plain(evaluator.evaluate(TextElement.term("circa"), ctx)));
        assertTrue(ctx.diagnostics().contains(Diagnostic.CODE_LOCALE_FALLBACK));
    }

    @Test
    @DisplayName("Terms: locale's own term does not warn")
    void testTermWithoutFallback() {
        Style style = citationOnly(TextElement.term("and"));
        EvalContext ctx = context(style, BuiltInLocales.deDe(), article(), EvalMode.CITATION, DisambiguationHints.NONE);

        assertEquals("und", plain(evaluator.evaluate(TextElement.term("and"), ctx)));
        assertFalse(ctx.diagnostics().contains(Diagnostic.CODE_LOCALE_FALLBACK));
    }

    @Test
    @DisplayName("Numbers: page ranges follow the style's range format")
    void testPageRangeFormat() {
        Element page = TextElement.variable("page");
        Style style = Style.builder()
                .options(StyleOptions.builder().pageRangeFormat(StyleOptions.PageRangeFormat.CHICAGO).build())
                .citation(Layout.builder().element(page).build())
                .build();
        assertEquals("321–28", plain(evaluator.evaluate(page, citationContext(style, article()))));
    }

    @Test
    @DisplayName("Numbers: ordinal and roman forms")
    void testNumberForms() {
        assertEquals("2nd", render(NumberElement.of("edition", NumberElement.Form.ORDINAL), article()));
        assertEquals("second", render(NumberElement.of("edition", NumberElement.Form.LONG_ORDINAL), article()));
        assertEquals("xii", render(NumberElement.of("volume", NumberElement.Form.ROMAN), article()));
    }

    @Test
    @DisplayName("Numbers: non-numeric value renders verbatim and warns")
    void testNonNumericNumber() {
        Reference reference = Reference.builder().id("r").type("book").variable("volume", "IV").build();
        Element number = NumberElement.of("volume", NumberElement.Form.ORDINAL);
        EvalContext ctx = citationContext(citationOnly(number), reference);

        assertEquals("IV", plain(evaluator.evaluate(number, ctx)));
        assertTrue(ctx.diagnostics().contains(Diagnostic.CODE_NON_NUMERIC));
    }

    @Test
    @DisplayName("Labels: plural follows the variable content")
    void testLabelPlurality() {
        Element label = LabelElement.builder().variable("page").form(TermForm.SHORT).build();
        assertEquals("pp.", render(label, article()));

        Reference single = Reference.builder().id("s").type("book").variable("page", "7").build();
        assertEquals("p.", render(label, single));
    }

    @Test
    @DisplayName("Labels: locator label comes from the cite")
    void testLocatorLabel() {
        Element group = GroupElement.of(" ",
                LabelElement.builder().variable("locator").form(TermForm.SHORT).build(),
                TextElement.variable("locator"));
        Style style = citationOnly(group);
        EvalContext ctx = citationContext(style, article()).toBuilder()
                .cite(CiteInfo.builder().locator("4").label("chapter").build())
                .build();
        assertEquals("chap. 4", plain(evaluator.evaluate(group, ctx)));
    }

    @Test
    @DisplayName("Choose: first matching branch wins, else branch otherwise")
    void testChoose() {
        Element choose = ChooseElement.builder()
                .branch(ChooseBranch.builder()
                        .condition(Condition.type("book"))
                        .element(TextElement.value("B"))
                        .build())
                .branch(ChooseBranch.builder()
                        .match(ChooseBranch.Match.ANY)
                        .condition(Condition.variable("publisher"))
                        .condition(Condition.isNumeric("volume"))
                        .element(TextElement.value("N"))
                        .build())
                .branch(ChooseBranch.builder().element(TextElement.value("O")).build())
                .build();

        assertEquals("B", render(choose, book("b", "Doe", "John", 2000, "Alpha")));
        assertEquals("N", render(choose, article()));
        assertEquals("O", render(choose, Reference.builder().id("x").type("report").build()));
    }

    @Test
    @DisplayName("Choose: disambiguate condition reads the hint")
    void testDisambiguateCondition() {
        Element choose = ChooseElement.builder()
                .branch(ChooseBranch.builder()
                        .condition(Condition.disambiguate(true))
                        .element(TextElement.variable("title"))
                        .build())
                .build();
        Style style = citationOnly(choose);
        assertEquals("", plain(evaluator.evaluate(choose, citationContext(style, article()))));

        EvalContext flagged = context(style, BuiltInLocales.enUs(), article(), EvalMode.CITATION,
                DisambiguationHints.builder().disambiguate(true).build());
        assertEquals("Cold Fusion", plain(evaluator.evaluate(choose, flagged)));
    }

    @Test
    @DisplayName("Substitute: first non-empty substitute is used and its variable is quashed")
    void testSubstituteQuashesVariable() {
        Reference untitledAuthor = Reference.builder().id("t").type("book").variable("title", "Alpha").build();
        Element group = GroupElement.of(" ", authorNames(), TextElement.variable("title"));
        assertEquals("Alpha", render(group, untitledAuthor));
    }

    @Test
    @DisplayName("Citation label: generated when missing, with the year suffix attached")
    void testGeneratedCitationLabel() {
        Element label = TextElement.variable("citation-label");
        Style style = citationOnly(label);
        Reference doe = book("d", "Doe", "John", 1965, "Alpha");
        Reference labelled = Reference.builder().id("l").type("book").variable("citation-label", "Custom").build();

        assertEquals("Doe65", render(label, doe));
        assertEquals("Custom", render(label, labelled));
        EvalContext suffixed = context(style, BuiltInLocales.enUs(), doe, EvalMode.CITATION,
                DisambiguationHints.builder().yearSuffix(2).build());
        assertEquals("Doe65b", plain(evaluator.evaluate(label, suffixed)));
    }
}
