package org.Aayush.citeproc.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.output.Formatting;

import java.util.Locale;

/**
 * {@code <text>}: renders a variable, macro, term or literal value.
 */
@Value
@Builder
public class TextElement implements Element {
    Source source;
    /** Variable name, macro name, term name or literal value depending on {@link #source}. */
    String value;
    /** Term form, or {@link TermForm#SHORT} to prefer the short variant of a variable. */
    @Builder.Default
    TermForm form = TermForm.LONG;
    boolean plural;
    @Builder.Default
    Formatting formatting = Formatting.EMPTY;

    public static TextElement variable(String variable) {
        return variable(variable, Formatting.EMPTY);
    }

    public static TextElement variable(String variable, Formatting formatting) {
        return TextElement.builder().source(Source.VARIABLE).value(variable).formatting(formatting).build();
    }

    public static TextElement macro(String macro) {
        return macro(macro, Formatting.EMPTY);
    }

    public static TextElement macro(String macro, Formatting formatting) {
        return TextElement.builder().source(Source.MACRO).value(macro).formatting(formatting).build();
    }

    public static TextElement term(String term) {
        return TextElement.builder().source(Source.TERM).value(term).build();
    }

    public static TextElement value(String value) {
        return value(value, Formatting.EMPTY);
    }

    public static TextElement value(String value, Formatting formatting) {
        return TextElement.builder().source(Source.VALUE).value(value).formatting(formatting).build();
    }

    @Override
    public ElementKind kind() {
        return ElementKind.TEXT;
    }

    @Override
    public String describe() {
        return "text[" + source.name().toLowerCase(Locale.ROOT) + "=" + value + "]";
    }

    public enum Source {
        VARIABLE,
        MACRO,
        TERM,
        VALUE
    }
}
