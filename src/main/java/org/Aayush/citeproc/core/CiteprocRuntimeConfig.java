package org.Aayush.citeproc.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.citeproc.render.HtmlRenderer;
import org.Aayush.citeproc.render.PlainTextRenderer;

/**
 * Runtime configuration bound once when an engine is built.
 */
@Value
@Builder
public class CiteprocRuntimeConfig {

    /**
     * Renderer id resolved through the engine's renderer registry.
     */
    String rendererId;

    /**
     * Disambiguation pass bound; non-positive reads the system property default.
     */
    int maxDisambiguationPasses;

    public static CiteprocRuntimeConfig plainText() {
        return CiteprocRuntimeConfig.builder()
                .rendererId(PlainTextRenderer.ID)
                .build();
    }

    public static CiteprocRuntimeConfig html() {
        return CiteprocRuntimeConfig.builder()
                .rendererId(HtmlRenderer.ID)
                .build();
    }

    /**
     * Returns the default runtime: plain text, default pass budget.
     */
    public static CiteprocRuntimeConfig defaultRuntime() {
        return plainText();
    }
}
