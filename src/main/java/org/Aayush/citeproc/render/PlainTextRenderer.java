package org.Aayush.citeproc.render;

import org.Aayush.citeproc.output.Formatting;

import java.util.List;

/**
 * Renders text only; every styling primitive is the identity.
 */
public final class PlainTextRenderer implements CslRenderer<String> {
    public static final String ID = "plain";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String empty() {
        return "";
    }

    @Override
    public String text(String text) {
        return text == null ? "" : text;
    }

    @Override
    public String concat(List<String> parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            out.append(part);
        }
        return out.toString();
    }

    @Override
    public boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    @Override
    public String fontStyle(String content, Formatting.FontStyle style) {
        return content;
    }

    @Override
    public String fontWeight(String content, Formatting.FontWeight weight) {
        return content;
    }

    @Override
    public String fontVariant(String content, Formatting.FontVariant variant) {
        return content;
    }

    @Override
    public String textDecoration(String content, Formatting.TextDecoration decoration) {
        return content;
    }

    @Override
    public String verticalAlign(String content, Formatting.VerticalAlign align) {
        return content;
    }

    @Override
    public String display(String content, Formatting.Display display) {
        return content;
    }

    @Override
    public String link(String content, String target) {
        return content;
    }

    @Override
    public String note(String content) {
        return content;
    }
}
