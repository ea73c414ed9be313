package org.Aayush.citeproc.render;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of string-producing renderers keyed by id.
 *
 * <p>Built-ins are {@code plain} and {@code html}; custom renderers with the same id replace
 * them.</p>
 */
public final class RendererRegistry {
    private final Map<String, CslRenderer<String>> renderersById;

    /**
     * Creates a registry with built-in renderers only.
     */
    public RendererRegistry() {
        this.renderersById = Collections.unmodifiableMap(materialize(builtIns()));
    }

    /**
     * Creates a registry by merging built-ins with custom renderers.
     */
    public RendererRegistry(Collection<CslRenderer<String>> customRenderers) {
        LinkedHashMap<String, CslRenderer<String>> merged = materialize(builtIns());
        if (customRenderers != null) {
            merged.putAll(materialize(customRenderers));
        }
        this.renderersById = Collections.unmodifiableMap(merged);
    }

    /**
     * Returns the renderer registered under an id, or null.
     */
    public CslRenderer<String> renderer(String id) {
        if (id == null) {
            return null;
        }
        return renderersById.get(id);
    }

    public Set<String> ids() {
        return renderersById.keySet();
    }

    public static RendererRegistry defaultRegistry() {
        return new RendererRegistry();
    }

    private static List<CslRenderer<String>> builtIns() {
        return List.of(new PlainTextRenderer(), new HtmlRenderer());
    }

    private static LinkedHashMap<String, CslRenderer<String>> materialize(Collection<CslRenderer<String>> renderers) {
        LinkedHashMap<String, CslRenderer<String>> map = new LinkedHashMap<>();
        for (CslRenderer<String> renderer : renderers) {
            CslRenderer<String> nonNullRenderer = Objects.requireNonNull(renderer, "renderer");
            String id = Objects.requireNonNull(nonNullRenderer.id(), "renderer.id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("renderer id must be non-blank");
            }
            map.put(id, nonNullRenderer);
        }
        return map;
    }
}
