package org.Aayush.citeproc.style;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * One test of a {@code <choose>} branch, holding one or more values.
 */
@Value
public class Condition {
    Type type;
    List<String> values;

    private Condition(Type type, List<String> values) {
        this.type = Objects.requireNonNull(type, "type");
        this.values = List.copyOf(values);
    }

    public static Condition type(String... types) {
        return new Condition(Type.TYPE, List.of(types));
    }

    public static Condition variable(String... variables) {
        return new Condition(Type.VARIABLE, List.of(variables));
    }

    public static Condition isNumeric(String... variables) {
        return new Condition(Type.IS_NUMERIC, List.of(variables));
    }

    public static Condition isUncertainDate(String... variables) {
        return new Condition(Type.IS_UNCERTAIN_DATE, List.of(variables));
    }

    public static Condition locator(String... labels) {
        return new Condition(Type.LOCATOR, List.of(labels));
    }

    public static Condition position(Position... positions) {
        String[] names = new String[positions.length];
        for (int i = 0; i < positions.length; i++) {
            names[i] = positions[i].name();
        }
        return new Condition(Type.POSITION, List.of(names));
    }

    public static Condition disambiguate(boolean expected) {
        return new Condition(Type.DISAMBIGUATE, List.of(Boolean.toString(expected)));
    }

    public static Condition locale(String... languages) {
        return new Condition(Type.LOCALE, List.of(languages));
    }

    public enum Type {
        TYPE,
        VARIABLE,
        IS_NUMERIC,
        IS_UNCERTAIN_DATE,
        LOCATOR,
        POSITION,
        DISAMBIGUATE,
        LOCALE
    }
}
