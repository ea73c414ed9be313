package org.Aayush.citeproc.render;

import org.Aayush.citeproc.output.Formatting;

import java.util.List;
import java.util.Locale;

/**
 * Renders HTML fragments using the markup conventions of CSL test fixtures.
 */
public final class HtmlRenderer implements CslRenderer<String> {
    public static final String ID = "html";

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
        return text == null ? "" : escape(text);
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
        return switch (style) {
            case ITALIC -> "<i>" + content + "</i>";
            case OBLIQUE -> span("font-style:oblique;", content);
            case NORMAL -> span("font-style:normal;", content);
        };
    }

    @Override
    public String fontWeight(String content, Formatting.FontWeight weight) {
        return switch (weight) {
            case BOLD -> "<b>" + content + "</b>";
            case LIGHT -> span("font-weight:light;", content);
            case NORMAL -> span("font-weight:normal;", content);
        };
    }

    @Override
    public String fontVariant(String content, Formatting.FontVariant variant) {
        return switch (variant) {
            case SMALL_CAPS -> span("font-variant:small-caps;", content);
            case NORMAL -> span("font-variant:normal;", content);
        };
    }

    @Override
    public String textDecoration(String content, Formatting.TextDecoration decoration) {
        return switch (decoration) {
            case UNDERLINE -> span("text-decoration:underline;", content);
            case NONE -> span("text-decoration:none;", content);
        };
    }

    @Override
    public String verticalAlign(String content, Formatting.VerticalAlign align) {
        return switch (align) {
            case SUPERSCRIPT -> "<sup>" + content + "</sup>";
            case SUBSCRIPT -> "<sub>" + content + "</sub>";
            case BASELINE -> span("vertical-align:baseline;", content);
        };
    }

    @Override
    public String display(String content, Formatting.Display display) {
        String cssClass = "csl-" + display.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return "<div class=\"" + cssClass + "\">" + content + "</div>";
    }

    @Override
    public String link(String content, String target) {
        return "<a href=\"" + escape(target) + "\">" + content + "</a>";
    }

    @Override
    public String note(String content) {
        return "<span class=\"csl-note\">" + content + "</span>";
    }

    private static String span(String style, String content) {
        return "<span style=\"" + style + "\">" + content + "</span>";
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
