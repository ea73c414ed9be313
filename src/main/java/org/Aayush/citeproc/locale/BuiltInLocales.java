package org.Aayush.citeproc.locale;

import lombok.experimental.UtilityClass;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.style.DateElement;
import org.Aayush.citeproc.style.DatePart;
import org.Aayush.citeproc.style.TermForm;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in locale tables: {@code en-US} (root of every fallback chain), {@code en-GB} and {@code de-DE}.
 */
@UtilityClass
public class BuiltInLocales {
    public static final String EN_US = "en-US";
    public static final String EN_GB = "en-GB";
    public static final String DE_DE = "de-DE";

    private static final String[] EN_MONTHS = {
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"
    };
    private static final String[] EN_MONTHS_SHORT = {
            "Jan.", "Feb.", "Mar.", "Apr.", "May", "Jun.",
            "Jul.", "Aug.", "Sep.", "Oct.", "Nov.", "Dec."
    };
    private static final String[] EN_LONG_ORDINALS = {
            "first", "second", "third", "fourth", "fifth",
            "sixth", "seventh", "eighth", "ninth", "tenth"
    };
    private static final String[] DE_MONTHS = {
            "Januar", "Februar", "März", "April", "Mai", "Juni",
            "Juli", "August", "September", "Oktober", "November", "Dezember"
    };

    private static final CslLocale EN_US_LOCALE = buildEnUs();
    private static final CslLocale EN_GB_LOCALE = buildEnGb();
    private static final CslLocale DE_DE_LOCALE = buildDeDe();

    public CslLocale enUs() {
        return EN_US_LOCALE;
    }

    public CslLocale enGb() {
        return EN_GB_LOCALE;
    }

    public CslLocale deDe() {
        return DE_DE_LOCALE;
    }

    /**
     * Returns every built-in locale, root first.
     */
    public List<CslLocale> all() {
        return List.of(EN_US_LOCALE, EN_GB_LOCALE, DE_DE_LOCALE);
    }

    private CslLocale buildEnUs() {
        List<Term> terms = new ArrayList<>();
        terms.add(Term.of("and", "and"));
        terms.add(Term.of("and", TermForm.SYMBOL, "&", null));
        terms.add(Term.of("et-al", "et al."));
        terms.add(Term.of("and others", "and others"));
        terms.add(Term.of("anonymous", "anonymous"));
        terms.add(Term.of("anonymous", TermForm.SHORT, "anon.", null));
        terms.add(Term.of("at", "at"));
        terms.add(Term.of("accessed", "accessed"));
        terms.add(Term.of("available at", "available at"));
        terms.add(Term.of("by", "by"));
        terms.add(Term.of("circa", "circa"));
        terms.add(Term.of("circa", TermForm.SHORT, "c.", null));
        terms.add(Term.of("cited", "cited"));
        terms.add(Term.of("edition", "edition", "editions"));
        terms.add(Term.of("edition", TermForm.SHORT, "ed.", "eds."));
        terms.add(Term.of("forthcoming", "forthcoming"));
        terms.add(Term.of("from", "from"));
        terms.add(Term.of("ibid", "ibid."));
        terms.add(Term.of("in", "in"));
        terms.add(Term.of("in press", "in press"));
        terms.add(Term.of("internet", "internet"));
        terms.add(Term.of("no date", "no date"));
        terms.add(Term.of("no date", TermForm.SHORT, "n.d.", null));
        terms.add(Term.of("online", "online"));
        terms.add(Term.of("presented at", "presented at the"));
        terms.add(Term.of("retrieved", "retrieved"));
        terms.add(Term.of("scale", "scale"));
        terms.add(Term.of("version", "version"));
        terms.add(Term.of("ad", "AD"));
        terms.add(Term.of("bc", "BC"));
        terms.add(Term.of(CslLocale.TERM_OPEN_QUOTE, "“"));
        terms.add(Term.of(CslLocale.TERM_CLOSE_QUOTE, "”"));
        terms.add(Term.of(CslLocale.TERM_OPEN_INNER_QUOTE, "‘"));
        terms.add(Term.of(CslLocale.TERM_CLOSE_INNER_QUOTE, "’"));
        terms.add(Term.of(CslLocale.TERM_PAGE_RANGE_DELIMITER, "–"));
        terms.add(Term.of("ordinal", "th"));
        terms.add(Term.of("ordinal-01", "st"));
        terms.add(Term.of("ordinal-02", "nd"));
        terms.add(Term.of("ordinal-03", "rd"));
        terms.add(Term.of("ordinal-11", "th"));
        terms.add(Term.of("ordinal-12", "th"));
        terms.add(Term.of("ordinal-13", "th"));
        for (int i = 0; i < EN_LONG_ORDINALS.length; i++) {
            terms.add(Term.of(String.format("long-ordinal-%02d", i + 1), EN_LONG_ORDINALS[i]));
        }
        months(terms, EN_MONTHS, EN_MONTHS_SHORT);
        terms.add(Term.of("season-01", "spring"));
        terms.add(Term.of("season-02", "summer"));
        terms.add(Term.of("season-03", "autumn"));
        terms.add(Term.of("season-04", "winter"));

        locator(terms, "book", "book", "books", "bk.", "bks.");
        locator(terms, "chapter", "chapter", "chapters", "chap.", "chaps.");
        locator(terms, "column", "column", "columns", "col.", "cols.");
        locator(terms, "figure", "figure", "figures", "fig.", "figs.");
        locator(terms, "folio", "folio", "folios", "fol.", "fols.");
        locator(terms, "issue", "number", "numbers", "no.", "nos.");
        locator(terms, "line", "line", "lines", "l.", "ll.");
        locator(terms, "note", "note", "notes", "n.", "nn.");
        locator(terms, "opus", "opus", "opera", "op.", "opp.");
        locator(terms, "page", "page", "pages", "p.", "pp.");
        locator(terms, "paragraph", "paragraph", "paragraphs", "para.", "paras.");
        locator(terms, "part", "part", "parts", "pt.", "pts.");
        locator(terms, "section", "section", "sections", "sec.", "secs.");
        locator(terms, "sub verbo", "sub verbo", "sub verbis", "s.v.", "s.vv.");
        locator(terms, "verse", "verse", "verses", "v.", "vv.");
        locator(terms, "volume", "volume", "volumes", "vol.", "vols.");
        locator(terms, "number-of-pages", "page", "pages", "p.", "pp.");

        role(terms, "author", "author", "authors", "auth.", "auths.", "by", "by");
        role(terms, "editor", "editor", "editors", "ed.", "eds.", "edited by", "ed.");
        role(terms, "translator", "translator", "translators", "tran.", "trans.", "translated by", "trans.");
        role(terms, "editortranslator", "editor & translator", "editors & translators",
                "ed. & tran.", "eds. & trans.", "edited & translated by", "ed. & trans.");
        role(terms, "container-author", "author", "authors", "auth.", "auths.", "by", "by");
        role(terms, "collection-editor", "editor", "editors", "ed.", "eds.", "edited by", "ed.");
        role(terms, "director", "director", "directors", "dir.", "dirs.", "directed by", "dir.");
        role(terms, "illustrator", "illustrator", "illustrators", "ill.", "ills.", "illustrated by", "illus.");

        return CslLocale.builder()
                .lang(EN_US)
                .punctuationInQuote(true)
                .terms(terms)
                .dateFormat(DateElement.Form.TEXT, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.MONTH, null, " "))
                        .part(part(DatePart.Name.DAY, null, ", "))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .dateFormat(DateElement.Form.NUMERIC, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.MONTH, DatePart.Form.NUMERIC, "/"))
                        .part(part(DatePart.Name.DAY, null, "/"))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .build();
    }

    private CslLocale buildEnGb() {
        return CslLocale.builder()
                .lang(EN_GB)
                .punctuationInQuote(false)
                .fallback(EN_US_LOCALE)
                .term(Term.of(CslLocale.TERM_OPEN_QUOTE, "‘"))
                .term(Term.of(CslLocale.TERM_CLOSE_QUOTE, "’"))
                .term(Term.of(CslLocale.TERM_OPEN_INNER_QUOTE, "“"))
                .term(Term.of(CslLocale.TERM_CLOSE_INNER_QUOTE, "”"))
                .dateFormat(DateElement.Form.TEXT, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.DAY, null, " "))
                        .part(part(DatePart.Name.MONTH, null, " "))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .dateFormat(DateElement.Form.NUMERIC, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.DAY, DatePart.Form.NUMERIC_LEADING_ZEROS, "/"))
                        .part(part(DatePart.Name.MONTH, DatePart.Form.NUMERIC_LEADING_ZEROS, "/"))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .build();
    }

    private CslLocale buildDeDe() {
        List<Term> terms = new ArrayList<>();
        terms.add(Term.of("and", "und"));
        terms.add(Term.of("et-al", "u. a."));
        terms.add(Term.of("and others", "und andere"));
        terms.add(Term.of("in", "in"));
        terms.add(Term.of("no date", "ohne Datum"));
        terms.add(Term.of("no date", TermForm.SHORT, "o. J.", null));
        terms.add(Term.of("ibid", "ebd."));
        terms.add(Term.of("ordinal", "."));
        terms.add(Term.of("ad", "n. Chr."));
        terms.add(Term.of("bc", "v. Chr."));
        terms.add(Term.of(CslLocale.TERM_OPEN_QUOTE, "„"));
        terms.add(Term.of(CslLocale.TERM_CLOSE_QUOTE, "“"));
        terms.add(Term.of(CslLocale.TERM_OPEN_INNER_QUOTE, "‚"));
        terms.add(Term.of(CslLocale.TERM_CLOSE_INNER_QUOTE, "‘"));
        months(terms, DE_MONTHS, DE_MONTHS);
        locator(terms, "page", "Seite", "Seiten", "S.", "S.");
        locator(terms, "volume", "Band", "Bände", "Bd.", "Bd.");
        role(terms, "editor", "Herausgeber", "Herausgeber", "Hrsg.", "Hrsg.", "herausgegeben von", "hrsg. v.");
        role(terms, "translator", "Übersetzer", "Übersetzer", "Übers.", "Übers.", "übersetzt von", "übers. v.");
        return CslLocale.builder()
                .lang(DE_DE)
                .punctuationInQuote(false)
                .fallback(EN_US_LOCALE)
                .terms(terms)
                .dateFormat(DateElement.Form.TEXT, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.DAY, DatePart.Form.NUMERIC, ". "))
                        .part(part(DatePart.Name.MONTH, null, " "))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .dateFormat(DateElement.Form.NUMERIC, LocalizedDateFormat.builder()
                        .part(part(DatePart.Name.DAY, DatePart.Form.NUMERIC_LEADING_ZEROS, "."))
                        .part(part(DatePart.Name.MONTH, DatePart.Form.NUMERIC_LEADING_ZEROS, "."))
                        .part(part(DatePart.Name.YEAR, null, null))
                        .build())
                .build();
    }

    private void months(List<Term> terms, String[] longNames, String[] shortNames) {
        for (int i = 0; i < 12; i++) {
            String name = String.format("month-%02d", i + 1);
            terms.add(Term.of(name, longNames[i]));
            terms.add(Term.of(name, TermForm.SHORT, shortNames[i], null));
        }
    }

    private void locator(List<Term> terms, String name, String single, String multiple,
                         String shortSingle, String shortMultiple) {
        terms.add(Term.of(name, TermForm.LONG, single, multiple));
        terms.add(Term.of(name, TermForm.SHORT, shortSingle, shortMultiple));
    }

    private void role(List<Term> terms, String name, String single, String multiple,
                      String shortSingle, String shortMultiple, String verb, String verbShort) {
        locator(terms, name, single, multiple, shortSingle, shortMultiple);
        terms.add(Term.of(name, TermForm.VERB, verb, verb));
        terms.add(Term.of(name, TermForm.VERB_SHORT, verbShort, verbShort));
    }

    private DatePart part(DatePart.Name name, DatePart.Form form, String suffix) {
        return DatePart.builder()
                .name(name)
                .form(form)
                .formatting(suffix == null ? Formatting.EMPTY : Formatting.affixes(null, suffix))
                .build();
    }
}
