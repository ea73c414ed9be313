package org.Aayush.citeproc.reference;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable bibliographic item consumed by evaluation.
 *
 * <p>Variables are sparse: ordinary (string and numeric) variables, name lists and dates live in
 * separate maps keyed by CSL variable name.</p>
 */
@Value
@Builder
public class Reference {
    /** Stable reference id used by citation items. */
    String id;
    /** CSL item type, for example {@code book} or {@code article-journal}. */
    String type;
    /** Optional language tag (for example {@code en-US}). */
    String language;
    /** Ordinary variables. */
    @Singular("variable")
    Map<String, String> variables;
    /** Name variables. */
    @Singular("names")
    Map<String, List<Name>> nameVariables;
    /** Date variables. */
    @Singular("date")
    Map<String, CslDate> dates;

    /**
     * Returns an ordinary variable value, or null when absent or blank.
     */
    public String variable(String name) {
        String value = variables.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }

    /**
     * Returns a name list, or an empty list when absent.
     */
    public List<Name> names(String name) {
        List<Name> names = nameVariables.get(name);
        return names == null ? List.of() : names;
    }

    /**
     * Returns a date variable, or null when absent.
     */
    public CslDate date(String name) {
        return dates.get(name);
    }

    /**
     * Returns true when any variable kind holds a non-empty value under the name.
     */
    public boolean hasVariable(String name) {
        return variable(name) != null || !names(name).isEmpty() || date(name) != null;
    }
}
