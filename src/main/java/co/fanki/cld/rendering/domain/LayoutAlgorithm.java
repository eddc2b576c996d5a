package co.fanki.cld.rendering.domain;

import co.fanki.cld.shared.DomainException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Graphviz layout engines a diagram can be rendered with.
 *
 * <p>Each engine carries the graph attributes that reduce edge crossings
 * for its family of layouts. Choosing one has no analytical meaning.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LayoutAlgorithm {

    /** Circular layout, the usual choice for causal loop diagrams. */
    CIRCO("circo", "Circular Layout (Recommended for CLDs)") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            return circular(root);
        }
    },

    /** Force-directed placement. */
    FDP("fdp", "Force-Directed Placement") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            return forceDirected();
        }
    },

    /** Spring model. */
    NEATO("neato", "Spring Model") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            final Map<String, String> attrs = new LinkedHashMap<>();
            attrs.put("overlap", "scale");
            attrs.put("splines", "spline");
            attrs.put("concentrate", "true");
            attrs.put("epsilon", "0.01");
            attrs.put("maxiter", "500");
            attrs.put("sep", "+20,20");
            attrs.put("model", "circuit");
            return attrs;
        }
    },

    /** Hierarchical layout. */
    DOT("dot", "Hierarchical Layout") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            final Map<String, String> attrs = new LinkedHashMap<>();
            attrs.put("overlap", "false");
            attrs.put("splines", "ortho");
            attrs.put("concentrate", "true");
            attrs.put("nodesep", "0.8");
            attrs.put("ranksep", "1.2");
            attrs.put("ordering", "out");
            attrs.put("compound", "true");
            return attrs;
        }
    },

    /** Radial layout. */
    TWOPI("twopi", "Radial Layout") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            return circular(root);
        }
    },

    /** Scalable force-directed placement, suited to larger diagrams. */
    SFDP("sfdp", "Scalable Force-Directed Placement") {
        @Override
        Map<String, String> crossingAttributes(final String root) {
            return forceDirected();
        }
    };

    /** Error code for a layout name that is not supported. */
    public static final String UNKNOWN_LAYOUT = "UNKNOWN_LAYOUT";

    private final String engineName;

    private final String description;

    LayoutAlgorithm(final String theEngineName, final String theDescription) {
        this.engineName = theEngineName;
        this.description = theDescription;
    }

    /**
     * Returns the attributes that reduce crossings for this engine.
     *
     * @param root the variable to center the layout on, may be null
     * @return ordered graph attributes
     */
    abstract Map<String, String> crossingAttributes(String root);

    /**
     * Returns the Graphviz engine name, e.g. {@code "circo"}.
     *
     * @return the engine name
     */
    public String engineName() {
        return engineName;
    }

    /**
     * Returns a human-readable description of the layout.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Returns the layout-specific graph attributes.
     *
     * @param minimizeCrossings whether to apply the anti-crossing hints
     * @param root the most central variable, used by circular layouts
     * @return ordered graph attributes
     */
    public Map<String, String> graphAttributes(final boolean minimizeCrossings,
            final String root) {
        if (minimizeCrossings) {
            return crossingAttributes(root);
        }
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("overlap", "false");
        attrs.put("splines", "curved");
        return attrs;
    }

    /**
     * Resolves a layout by its engine name, ignoring case.
     *
     * @param name the engine name, e.g. "sfdp"
     * @return the layout
     * @throws DomainException with UNKNOWN_LAYOUT if not supported
     */
    public static LayoutAlgorithm fromName(final String name) {
        if (name != null) {
            final String wanted = name.trim().toLowerCase(Locale.ROOT);
            for (final LayoutAlgorithm layout : values()) {
                if (layout.engineName.equals(wanted)) {
                    return layout;
                }
            }
        }
        throw new DomainException("Unknown layout: " + name
                + ". Valid layouts: " + names(), UNKNOWN_LAYOUT);
    }

    /**
     * Returns the supported engine names, comma separated.
     *
     * @return e.g. "circo, fdp, neato, dot, twopi, sfdp"
     */
    public static String names() {
        return Arrays.stream(values())
                .map(LayoutAlgorithm::engineName)
                .collect(Collectors.joining(", "));
    }

    private static Map<String, String> circular(final String root) {
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("overlap", "false");
        attrs.put("splines", "curved");
        attrs.put("concentrate", "true");
        attrs.put("mindist", "1.5");
        attrs.put("sep", "+25,25");
        attrs.put("esep", "+10,10");
        attrs.put("pack", "true");
        attrs.put("packmode", "graph");
        if (root != null) {
            attrs.put("root", root);
        }
        return attrs;
    }

    private static Map<String, String> forceDirected() {
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("overlap", "prism");
        attrs.put("splines", "spline");
        attrs.put("concentrate", "true");
        attrs.put("K", "0.9");
        attrs.put("maxiter", "1000");
        attrs.put("sep", "+15,15");
        attrs.put("esep", "+8,8");
        attrs.put("repulsiveforce", "2.0");
        attrs.put("smoothing", "spring");
        return attrs;
    }

}
