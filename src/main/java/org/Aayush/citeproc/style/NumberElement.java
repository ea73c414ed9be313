package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

/**
 * {@code <number>}: renders a numeric variable in a numeric, ordinal or roman form.
 */
@Value
@Builder
public class NumberElement implements Element {
    String variable;
    @Builder.Default
    Form form = Form.NUMERIC;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    public static NumberElement of(String variable, Form form) {
        return NumberElement.builder().variable(variable).form(form).build();
    }

    @Override
    public ElementKind kind() {
        return ElementKind.NUMBER;
    }

    @Override
    public String describe() {
        return "number[variable=" + variable + "]";
    }

    public enum Form {
        NUMERIC,
        ORDINAL,
        LONG_ORDINAL,
        ROMAN
    }
}
