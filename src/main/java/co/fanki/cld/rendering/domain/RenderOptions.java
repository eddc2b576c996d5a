package co.fanki.cld.rendering.domain;

import co.fanki.cld.shared.Preconditions;

/**
 * Presentation settings for one rendered diagram.
 *
 * @param layout the Graphviz layout engine
 * @param minimizeCrossings whether to apply the anti-crossing hints
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RenderOptions(LayoutAlgorithm layout,
        boolean minimizeCrossings) {

    /** Validates the options. */
    public RenderOptions {
        Preconditions.requireNonNull(layout, "Layout is required");
    }

}
