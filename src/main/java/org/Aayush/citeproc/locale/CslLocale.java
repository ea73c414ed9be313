package org.Aayush.citeproc.locale;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.Aayush.citeproc.style.DateElement;
import org.Aayush.citeproc.style.TermForm;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable locale: terms, localized date formats and punctuation options.
 *
 * <p>Term lookup walks the locale chain (this locale, then its fallback), trying the requested
 * form and then its fallback forms ({@code verb-short -> verb -> long},
 * {@code symbol -> short -> long}, {@code short -> long}) in each locale.</p>
 */
@Getter
@Accessors(fluent = true)
public final class CslLocale {
    public static final String TERM_OPEN_QUOTE = "open-quote";
    public static final String TERM_CLOSE_QUOTE = "close-quote";
    public static final String TERM_OPEN_INNER_QUOTE = "open-inner-quote";
    public static final String TERM_CLOSE_INNER_QUOTE = "close-inner-quote";
    public static final String TERM_PAGE_RANGE_DELIMITER = "page-range-delimiter";
    public static final String DEFAULT_PAGE_RANGE_DELIMITER = "–";

    private final String lang;
    private final boolean punctuationInQuote;
    private final boolean limitDayOrdinalsToDay1;
    private final CslLocale fallback;
    @Getter(AccessLevel.NONE)
    private final Map<String, Map<TermForm, Term>> terms;
    @Getter(AccessLevel.NONE)
    private final Map<DateElement.Form, LocalizedDateFormat> dateFormats;

    /**
     * Creates a locale.
     *
     * @param lang locale tag, for example {@code en-US}.
     * @param punctuationInQuote whether trailing commas/periods move inside closing quotes.
     * @param limitDayOrdinalsToDay1 whether ordinal days apply only to day 1.
     * @param fallback next locale in the lookup chain, nullable.
     * @param terms localized terms.
     * @param dateFormats localized date formats.
     */
    @Builder
    public CslLocale(
            String lang,
            boolean punctuationInQuote,
            boolean limitDayOrdinalsToDay1,
            CslLocale fallback,
            @Singular Collection<Term> terms,
            @Singular Map<DateElement.Form, LocalizedDateFormat> dateFormats
    ) {
        this.lang = Objects.requireNonNull(lang, "lang");
        this.punctuationInQuote = punctuationInQuote;
        this.limitDayOrdinalsToDay1 = limitDayOrdinalsToDay1;
        this.fallback = fallback;
        this.terms = indexTerms(terms);
        this.dateFormats = Map.copyOf(dateFormats);
    }

    /**
     * Looks up a term across the form fallback chain and the locale chain.
     *
     * @param name term name.
     * @param form requested form.
     * @param plural whether the plural value is requested.
     * @return lookup result, or null when no locale in the chain defines the term.
     */
    public TermLookup lookup(String name, TermForm form, boolean plural) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(form, "form");
        for (CslLocale locale = this; locale != null; locale = locale.fallback) {
            Map<TermForm, Term> forms = locale.terms.get(name);
            if (forms == null) {
                continue;
            }
            for (TermForm candidate = form; candidate != null; candidate = candidate.fallback()) {
                Term term = forms.get(candidate);
                if (term != null) {
                    return new TermLookup(term.value(plural), locale != this, locale.lang);
                }
            }
        }
        return null;
    }

    /**
     * Returns the term value or null, ignoring where it came from.
     */
    public String term(String name, TermForm form, boolean plural) {
        TermLookup lookup = lookup(name, form, plural);
        return lookup == null ? null : lookup.value();
    }

    /**
     * Returns the long singular term value, or the default when undefined.
     */
    public String termOrDefault(String name, String defaultValue) {
        String value = term(name, TermForm.LONG, false);
        return value == null ? defaultValue : value;
    }

    /**
     * Returns the localized date format for a form, consulting the fallback chain.
     */
    public LocalizedDateFormat dateFormat(DateElement.Form form) {
        for (CslLocale locale = this; locale != null; locale = locale.fallback) {
            LocalizedDateFormat format = locale.dateFormats.get(form);
            if (format != null) {
                return format;
            }
        }
        return null;
    }

    /**
     * Returns the open quote glyph for a nesting depth (0 = outer quotes).
     */
    public String openQuote(int depth) {
        return depth % 2 == 0
                ? termOrDefault(TERM_OPEN_QUOTE, "“")
                : termOrDefault(TERM_OPEN_INNER_QUOTE, "‘");
    }

    /**
     * Returns the close quote glyph for a nesting depth (0 = outer quotes).
     */
    public String closeQuote(int depth) {
        return depth % 2 == 0
                ? termOrDefault(TERM_CLOSE_QUOTE, "”")
                : termOrDefault(TERM_CLOSE_INNER_QUOTE, "’");
    }

    /**
     * Returns the page-range delimiter, an en dash unless the locale overrides it.
     */
    public String pageRangeDelimiter() {
        return termOrDefault(TERM_PAGE_RANGE_DELIMITER, DEFAULT_PAGE_RANGE_DELIMITER);
    }

    /**
     * Returns the primary language subtag ({@code en} for {@code en-US}).
     */
    public String primaryLanguage() {
        int dash = lang.indexOf('-');
        return dash < 0 ? lang : lang.substring(0, dash);
    }

    private static Map<String, Map<TermForm, Term>> indexTerms(Collection<Term> terms) {
        Map<String, Map<TermForm, Term>> index = new HashMap<>();
        for (Term term : terms) {
            Term nonNullTerm = Objects.requireNonNull(term, "term");
            index.computeIfAbsent(nonNullTerm.getName(), ignored -> new EnumMap<>(TermForm.class))
                    .put(nonNullTerm.getForm(), nonNullTerm);
        }
        Map<String, Map<TermForm, Term>> frozen = new HashMap<>();
        for (Map.Entry<String, Map<TermForm, Term>> entry : index.entrySet()) {
            frozen.put(entry.getKey(), Map.copyOf(entry.getValue()));
        }
        return Map.copyOf(frozen);
    }

    /**
     * Result of a term lookup.
     *
     * @param value term text, possibly empty.
     * @param fromFallback true when the term came from a fallback locale.
     * @param sourceLang tag of the locale that supplied the term.
     */
    public record TermLookup(String value, boolean fromFallback, String sourceLang) {
    }
}
