package org.Aayush.citeproc.locale;

import lombok.Value;
import org.Aayush.citeproc.style.TermForm;

import java.util.Objects;

/**
 * Localized term with singular and optional plural value.
 */
@Value
public class Term {
    String name;
    TermForm form;
    String single;
    String multiple;

    private Term(String name, TermForm form, String single, String multiple) {
        this.name = Objects.requireNonNull(name, "name");
        this.form = Objects.requireNonNull(form, "form");
        this.single = Objects.requireNonNull(single, "single");
        this.multiple = multiple;
    }

    public static Term of(String name, String single) {
        return new Term(name, TermForm.LONG, single, null);
    }

    public static Term of(String name, String single, String multiple) {
        return new Term(name, TermForm.LONG, single, multiple);
    }

    public static Term of(String name, TermForm form, String single, String multiple) {
        return new Term(name, form, single, multiple);
    }

    /**
     * Returns the plural value when requested and present, otherwise the singular one.
     */
    public String value(boolean plural) {
        if (plural && multiple != null) {
            return multiple;
        }
        return single;
    }
}
