package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The annotated causal graph handed to renderers and reports.
 *
 * <p>Bundles the immutable graph with every view derived from it: the
 * tier of each variable, the classified feedback loops and the summary
 * metrics. It is a plain value; any rendering technology can consume it
 * without touching the analysis.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DiagramAnalysis {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CausalGraph graph;

    private final NodeClassification classification;

    private final List<FeedbackLoop> loops;

    private final GraphMetrics metrics;

    /**
     * Creates a new DiagramAnalysis.
     *
     * @param theGraph the analyzed graph
     * @param theClassification the tier of every variable
     * @param theLoops the detected loops
     * @param theMetrics the summary counts
     */
    public DiagramAnalysis(final CausalGraph theGraph,
            final NodeClassification theClassification,
            final List<FeedbackLoop> theLoops,
            final GraphMetrics theMetrics) {
        this.graph = Preconditions.requireNonNull(theGraph,
                "Graph is required");
        this.classification = Preconditions.requireNonNull(theClassification,
                "Classification is required");
        this.loops = List.copyOf(Preconditions.requireNonNull(theLoops,
                "Loops are required"));
        this.metrics = Preconditions.requireNonNull(theMetrics,
                "Metrics are required");
    }

    /** Returns the analyzed graph. */
    public CausalGraph graph() {
        return graph;
    }

    /** Returns the tier classification. */
    public NodeClassification classification() {
        return classification;
    }

    /** Returns every detected loop, in detection order. */
    public List<FeedbackLoop> loops() {
        return loops;
    }

    /** Returns the summary counts. */
    public GraphMetrics metrics() {
        return metrics;
    }

    /**
     * Returns the loops with the given polarity.
     *
     * @param polarity the polarity to filter by
     * @return unmodifiable list of matching loops, in detection order
     */
    public List<FeedbackLoop> loops(final LoopPolarity polarity) {
        final List<FeedbackLoop> result = new ArrayList<>();
        for (final FeedbackLoop loop : loops) {
            if (loop.polarity() == polarity) {
                result.add(loop);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the tier of a variable.
     *
     * @param identifier the variable identifier
     * @return the tier, or null if unknown
     */
    public NodeTier tierOf(final String identifier) {
        return classification.tierOf(identifier);
    }

    /**
     * Serializes the analysis as a pretty-printed JSON document.
     *
     * @return the JSON representation
     */
    public String toJson() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode nodesArray = MAPPER.createArrayNode();
        for (final String node : graph.nodes()) {
            final ObjectNode nodeObj = MAPPER.createObjectNode();
            nodeObj.put("id", node);
            nodeObj.put("tier", classification.tierOf(node).name());
            nodeObj.put("score", classification.scoreOf(node));
            nodesArray.add(nodeObj);
        }
        root.set("nodes", nodesArray);

        final ArrayNode edgesArray = MAPPER.createArrayNode();
        for (final Influence influence : graph.influences()) {
            edgesArray.add(toJsonNode(influence));
        }
        root.set("edges", edgesArray);

        final ArrayNode loopsArray = MAPPER.createArrayNode();
        for (final FeedbackLoop loop : loops) {
            final ObjectNode loopObj = MAPPER.createObjectNode();
            final ArrayNode path = MAPPER.createArrayNode();
            loop.nodes().forEach(path::add);
            loopObj.set("nodes", path);
            final ArrayNode traversed = MAPPER.createArrayNode();
            loop.influences().forEach(i -> traversed.add(i.index()));
            loopObj.set("edges", traversed);
            loopObj.put("polarity", loop.polarity().name());
            loopObj.put("negativeCount", loop.oppositeCount());
            loopsArray.add(loopObj);
        }
        root.set("loops", loopsArray);

        final ObjectNode metricsObj = MAPPER.createObjectNode();
        metricsObj.put("variables", metrics.variableCount());
        metricsObj.put("relations", metrics.relationCount());
        metricsObj.put("positive", metrics.positiveCount());
        metricsObj.put("negative", metrics.negativeCount());
        root.set("metrics", metricsObj);

        try {
            return MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(root);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize diagram analysis", e);
        }
    }

    private static ObjectNode toJsonNode(final Influence influence) {
        final ObjectNode edgeObj = MAPPER.createObjectNode();
        edgeObj.put("index", influence.index());
        edgeObj.put("source", influence.source());
        edgeObj.put("destination", influence.destination());
        edgeObj.put("polarity", influence.polarity().name());
        return edgeObj;
    }

}
