package org.Aayush.citeproc.locale;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of locales keyed by tag, in registration order.
 *
 * <p>Resolution order for a requested tag: exact tag, then the first registered locale sharing the
 * primary language subtag, then {@code en-US}. Anything but an exact hit is reported as a
 * fallback.</p>
 */
public final class LocaleRegistry {
    public static final String ROOT_LOCALE = BuiltInLocales.EN_US;

    private final Map<String, CslLocale> localesByTag;

    /**
     * Creates a registry with built-in locales only.
     */
    public LocaleRegistry() {
        this.localesByTag = Collections.unmodifiableMap(materialize(BuiltInLocales.all()));
    }

    /**
     * Creates a registry by merging built-ins with custom locales; custom tags override built-ins.
     */
    public LocaleRegistry(Collection<CslLocale> customLocales) {
        this.localesByTag = Collections.unmodifiableMap(materialize(mergeWithBuiltIns(customLocales)));
    }

    /**
     * Returns the locale registered under an exact tag, or null.
     */
    public CslLocale locale(String tag) {
        if (tag == null) {
            return null;
        }
        return localesByTag.get(normalizeTag(tag));
    }

    /**
     * Returns immutable set of registered tags.
     */
    public Set<String> tags() {
        return localesByTag.keySet();
    }

    /**
     * Resolves a requested tag with language and root fallback.
     *
     * @param tag requested tag; null resolves to the root locale as a fallback.
     * @return resolution naming the locale used and whether a fallback applied.
     */
    public LocaleResolution resolve(String tag) {
        CslLocale exact = locale(tag);
        if (exact != null) {
            return LocaleResolution.builder().requestedTag(tag).locale(exact).fallbackApplied(false).build();
        }
        if (tag != null) {
            String primary = primaryLanguage(normalizeTag(tag));
            for (CslLocale candidate : localesByTag.values()) {
                if (candidate.primaryLanguage().equalsIgnoreCase(primary) && ROOT_LOCALE.equals(candidate.lang())) {
                    return fallback(tag, candidate);
                }
            }
            for (CslLocale candidate : localesByTag.values()) {
                if (candidate.primaryLanguage().equalsIgnoreCase(primary)) {
                    return fallback(tag, candidate);
                }
            }
        }
        CslLocale root = localesByTag.get(ROOT_LOCALE);
        if (root == null) {
            root = BuiltInLocales.enUs();
        }
        return fallback(tag, root);
    }

    /**
     * Returns a new default registry instance.
     */
    public static LocaleRegistry defaultRegistry() {
        return new LocaleRegistry();
    }

    private static LocaleResolution fallback(String tag, CslLocale locale) {
        return LocaleResolution.builder().requestedTag(tag).locale(locale).fallbackApplied(true).build();
    }

    private static Collection<CslLocale> mergeWithBuiltIns(Collection<CslLocale> customLocales) {
        LinkedHashMap<String, CslLocale> merged = materialize(BuiltInLocales.all());
        if (customLocales != null) {
            for (CslLocale locale : customLocales) {
                CslLocale nonNullLocale = Objects.requireNonNull(locale, "locale");
                merged.put(normalizeTag(nonNullLocale.lang()), nonNullLocale);
            }
        }
        return merged.values();
    }

    private static LinkedHashMap<String, CslLocale> materialize(Collection<CslLocale> locales) {
        Objects.requireNonNull(locales, "locales");
        LinkedHashMap<String, CslLocale> map = new LinkedHashMap<>();
        for (CslLocale locale : locales) {
            CslLocale nonNullLocale = Objects.requireNonNull(locale, "locale");
            map.put(normalizeTag(nonNullLocale.lang()), nonNullLocale);
        }
        return map;
    }

    private static String normalizeTag(String tag) {
        String normalized = tag.trim().replace('_', '-');
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("locale tag must be non-blank");
        }
        int dash = normalized.indexOf('-');
        if (dash < 0) {
            return normalized.toLowerCase(Locale.ROOT);
        }
        return normalized.substring(0, dash).toLowerCase(Locale.ROOT)
                + "-" + normalized.substring(dash + 1).toUpperCase(Locale.ROOT);
    }

    private static String primaryLanguage(String tag) {
        int dash = tag.indexOf('-');
        return dash < 0 ? tag : tag.substring(0, dash);
    }
}
