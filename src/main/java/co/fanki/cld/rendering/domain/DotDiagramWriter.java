package co.fanki.cld.rendering.domain;

import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.analysis.domain.Influence;
import co.fanki.cld.analysis.domain.NodeTier;
import co.fanki.cld.shared.Preconditions;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@link DiagramAnalysis} as Graphviz DOT source.
 *
 * <p>Variables are styled by tier (fill, border, font size and pen width)
 * and influences by polarity: same-direction links are green with a
 * {@code +} label, opposite-direction links are crimson with a {@code −}
 * label. Variable names longer than ten characters break at underscores.
 * Self-loops never carry the anti-crossing rank hints.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DotDiagramWriter {

    private static final int LONG_LABEL = 10;

    private static final String POSITIVE_COLOR = "#228B22";

    private static final String NEGATIVE_COLOR = "#DC143C";

    private static final Map<NodeTier, Map<String, String>> NODE_STYLES =
            new EnumMap<>(NodeTier.class);

    static {
        NODE_STYLES.put(NodeTier.CENTRAL,
                nodeStyle("#FFE4B5", "#8B4513", "12", "2"));
        NODE_STYLES.put(NodeTier.INTERMEDIATE,
                nodeStyle("#E6F3FF", "#4682B4", "10", "1.5"));
        NODE_STYLES.put(NodeTier.PERIPHERAL,
                nodeStyle("#F0F8FF", "#6495ED", "9", "1"));
    }

    private DotDiagramWriter() {
    }

    /**
     * Builds the DOT source of the diagram.
     *
     * @param analysis the annotated graph
     * @param options layout and crossing settings
     * @return the DOT source
     */
    public static String write(final DiagramAnalysis analysis,
            final RenderOptions options) {
        Preconditions.requireNonNull(analysis, "Analysis is required");
        Preconditions.requireNonNull(options, "Render options are required");

        final Map<String, String> graphAttrs = new LinkedHashMap<>();
        graphAttrs.put("layout", options.layout().engineName());
        graphAttrs.put("bgcolor", "white");
        graphAttrs.put("fontname", "Arial");
        graphAttrs.put("fontsize", "14");
        graphAttrs.putAll(options.layout().graphAttributes(
                options.minimizeCrossings(),
                analysis.classification().topCentral()));

        final StringBuilder sb = new StringBuilder();
        sb.append("digraph cld {\n");
        for (final Map.Entry<String, String> attr : graphAttrs.entrySet()) {
            sb.append("  ").append(attr.getKey()).append('=')
                    .append(quote(attr.getValue())).append(";\n");
        }

        for (final String node : analysis.graph().nodes()) {
            final Map<String, String> attrs = new LinkedHashMap<>();
            attrs.put("label", label(node));
            attrs.putAll(NODE_STYLES.get(analysis.tierOf(node)));
            sb.append("  ").append(quote(node)).append(' ')
                    .append(attributeList(attrs)).append(";\n");
        }

        for (final Influence influence : analysis.graph().influences()) {
            sb.append("  ").append(quote(influence.source()))
                    .append(" -> ").append(quote(influence.destination()))
                    .append(' ')
                    .append(attributeList(edgeStyle(influence,
                            options.minimizeCrossings())))
                    .append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Returns the display label of a variable.
     *
     * @param identifier the variable identifier
     * @return the identifier, split at underscores when it is long
     */
    static String label(final String identifier) {
        if (identifier.length() > LONG_LABEL) {
            return identifier.replace("_", "\\n");
        }
        return identifier;
    }

    private static Map<String, String> edgeStyle(final Influence influence,
            final boolean minimizeCrossings) {
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("penwidth", "2");
        attrs.put("arrowhead", "normal");
        attrs.put("arrowsize", "1.2");
        // Rank hints mean nothing on an edge that starts and ends at one node.
        if (minimizeCrossings && !influence.isSelfLoop()) {
            attrs.put("constraint", "true");
            attrs.put("weight", "2");
            attrs.put("minlen", "1");
        }
        final String color = influence.isOpposite()
                ? NEGATIVE_COLOR : POSITIVE_COLOR;
        attrs.put("color", color);
        attrs.put("label", influence.isOpposite() ? "−" : "+");
        attrs.put("fontcolor", color);
        attrs.put("fontsize", "14");
        attrs.put("fontname", "Arial Bold");
        return attrs;
    }

    private static Map<String, String> nodeStyle(final String fill,
            final String color, final String fontSize, final String penWidth) {
        final Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("shape", "ellipse");
        attrs.put("style", "filled");
        attrs.put("fillcolor", fill);
        attrs.put("color", color);
        attrs.put("fontsize", fontSize);
        attrs.put("fontcolor", color);
        attrs.put("penwidth", penWidth);
        return attrs;
    }

    private static String attributeList(final Map<String, String> attrs) {
        final StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (final Map.Entry<String, String> attr : attrs.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(attr.getKey()).append('=').append(quote(attr.getValue()));
            first = false;
        }
        return sb.append(']').toString();
    }

    /** Quotes a DOT ID; backslashes are kept so label escapes survive. */
    private static String quote(final String value) {
        return '"' + value.replace("\"", "\\\"") + '"';
    }

}
