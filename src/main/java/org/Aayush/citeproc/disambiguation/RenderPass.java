package org.Aayush.citeproc.disambiguation;

import java.util.List;

/**
 * Renders every normal cite with the current hints.
 */
@FunctionalInterface
public interface RenderPass {

    List<DisambData> render(HintTable hints);
}
