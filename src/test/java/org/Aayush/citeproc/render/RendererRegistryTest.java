package org.Aayush.citeproc.render;

import org.Aayush.citeproc.locale.BuiltInLocales;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Renderer Registry Tests")
class RendererRegistryTest {

    @Test
    @DisplayName("Default registry exposes plain and html renderers")
    void testDefaultRegistry() {
        RendererRegistry registry = RendererRegistry.defaultRegistry();
        assertTrue(registry.ids().containsAll(List.of(PlainTextRenderer.ID, HtmlRenderer.ID)));
        assertInstanceOf(PlainTextRenderer.class, registry.renderer("plain"));
        assertInstanceOf(HtmlRenderer.class, registry.renderer("html"));
        assertNull(registry.renderer("rtf"));
        assertNull(registry.renderer(null));
    }

    @Test
    @DisplayName("Custom renderer with a built-in id replaces the built-in")
    void testCustomRendererOverridesBuiltIn() {
        CslRenderer<String> custom = new SlashItalicRenderer("plain");
        RendererRegistry registry = new RendererRegistry(List.of(custom));
        assertSame(custom, registry.renderer("plain"));
        assertEquals(2, registry.ids().size());

        Output italic = Output.formatted(Formatting.builder().fontStyle(Formatting.FontStyle.ITALIC).build(),
                List.of(Output.literal("Title")));
        assertEquals("/Title/", new OutputRenderer<>(registry.renderer("plain"), BuiltInLocales.enUs()).render(italic));
    }

    @Test
    @DisplayName("Blank renderer ids are rejected")
    void testBlankIdRejected() {
        CslRenderer<String> blank = new SlashItalicRenderer(" ");
        assertThrows(IllegalArgumentException.class, () -> new RendererRegistry(List.of(blank)));
    }

    /**
     * Plain text with italics written as slashes.
     */
    private static final class SlashItalicRenderer implements CslRenderer<String> {
        private final PlainTextRenderer plain = new PlainTextRenderer();
        private final String id;

        private SlashItalicRenderer(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String empty() {
            return plain.empty();
        }

        @Override
        public String text(String text) {
            return plain.text(text);
        }

        @Override
        public String concat(List<String> parts) {
            return plain.concat(parts);
        }

        @Override
        public boolean isEmpty(String value) {
            return plain.isEmpty(value);
        }

        @Override
        public String fontStyle(String content, Formatting.FontStyle style) {
            return style == Formatting.FontStyle.ITALIC ? "/" + content + "/" : content;
        }

        @Override
        public String fontWeight(String content, Formatting.FontWeight weight) {
            return plain.fontWeight(content, weight);
        }

        @Override
        public String fontVariant(String content, Formatting.FontVariant variant) {
            return plain.fontVariant(content, variant);
        }

        @Override
        public String textDecoration(String content, Formatting.TextDecoration decoration) {
            return plain.textDecoration(content, decoration);
        }

        @Override
        public String verticalAlign(String content, Formatting.VerticalAlign align) {
            return plain.verticalAlign(content, align);
        }

        @Override
        public String display(String content, Formatting.Display display) {
            return plain.display(content, display);
        }

        @Override
        public String link(String content, String target) {
            return plain.link(content, target);
        }

        @Override
        public String note(String content) {
            return plain.note(content);
        }
    }
}
