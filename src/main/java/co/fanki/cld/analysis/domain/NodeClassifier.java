package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks variables by degree centrality and splits them into tiers.
 *
 * <p>The score of a variable is its in-degree plus its out-degree, with
 * parallel influences counted separately and a self-loop counted once on
 * each side. Variables are sorted by descending score, ties kept in graph
 * order, and cut into tiers:</p>
 * <ul>
 *   <li><b>Central</b>: the first {@code max(1, floor(n * centralFraction))}
 *       ranks, extended downward over the whole tie group of its last
 *       member.</li>
 *   <li><b>Peripheral</b>: from rank {@code floor(n * (1 - peripheralFraction))}
 *       on, never starting inside the central tier, extended upward over
 *       the whole tie group of its first member.</li>
 *   <li><b>Intermediate</b>: everything in between.</li>
 * </ul>
 *
 * <p>Equal scores therefore always share a tier. When every variable has
 * the same score they are all central.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NodeClassifier {

    /** Default share of variables provisionally placed in the top tier. */
    public static final double DEFAULT_CENTRAL_FRACTION = 0.25;

    /** Default share of variables provisionally placed in the bottom tier. */
    public static final double DEFAULT_PERIPHERAL_FRACTION = 0.25;

    private final double centralFraction;

    private final double peripheralFraction;

    /** Creates a classifier with the default quartile split. */
    public NodeClassifier() {
        this(DEFAULT_CENTRAL_FRACTION, DEFAULT_PERIPHERAL_FRACTION);
    }

    /**
     * Creates a classifier with custom tier proportions.
     *
     * @param theCentralFraction share of variables for the top tier
     * @param thePeripheralFraction share of variables for the bottom tier
     */
    public NodeClassifier(final double theCentralFraction,
            final double thePeripheralFraction) {
        this.centralFraction = Preconditions.requireFraction(
                theCentralFraction, "Central fraction must be in [0, 1]");
        this.peripheralFraction = Preconditions.requireFraction(
                thePeripheralFraction,
                "Peripheral fraction must be in [0, 1]");
        Preconditions.require(theCentralFraction + thePeripheralFraction <= 1.0,
                "Central and peripheral fractions cannot exceed 1 together");
    }

    /**
     * Computes the centrality score of every variable.
     *
     * @param graph the causal graph
     * @return score per variable, in graph order
     */
    public Map<String, Integer> scores(final CausalGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final Map<String, Integer> scores = new LinkedHashMap<>();
        for (final String node : graph.nodes()) {
            scores.put(node, graph.inDegree(node) + graph.outDegree(node));
        }
        return scores;
    }

    /**
     * Assigns a tier to every variable of the graph.
     *
     * @param graph the causal graph
     * @return the classification, covering every variable exactly once
     */
    public NodeClassification classify(final CausalGraph graph) {
        final Map<String, Integer> scores = scores(graph);

        final List<String> ranking = new ArrayList<>(scores.keySet());
        // List.sort is stable: equal scores stay in graph order.
        ranking.sort((a, b) -> Integer.compare(scores.get(b), scores.get(a)));

        final int n = ranking.size();
        final Map<String, NodeTier> tiers = new LinkedHashMap<>();
        if (n == 0) {
            return new NodeClassification(ranking, scores, tiers);
        }

        int centralEnd = Math.max(1, (int) Math.floor(n * centralFraction));
        final int lastCentralScore = scores.get(ranking.get(centralEnd - 1));
        while (centralEnd < n
                && scores.get(ranking.get(centralEnd)) == lastCentralScore) {
            centralEnd++;
        }

        int peripheralStart = Math.max(centralEnd,
                (int) Math.floor(n * (1.0 - peripheralFraction)));
        if (peripheralStart < n) {
            final int firstPeripheralScore =
                    scores.get(ranking.get(peripheralStart));
            while (peripheralStart > centralEnd
                    && scores.get(ranking.get(peripheralStart - 1))
                            == firstPeripheralScore) {
                peripheralStart--;
            }
        }

        for (int rank = 0; rank < n; rank++) {
            final NodeTier tier;
            if (rank < centralEnd) {
                tier = NodeTier.CENTRAL;
            } else if (rank >= peripheralStart) {
                tier = NodeTier.PERIPHERAL;
            } else {
                tier = NodeTier.INTERMEDIATE;
            }
            tiers.put(ranking.get(rank), tier);
        }
        return new NodeClassification(ranking, scores, tiers);
    }

    /** Returns the configured central fraction. */
    public double centralFraction() {
        return centralFraction;
    }

    /** Returns the configured peripheral fraction. */
    public double peripheralFraction() {
        return peripheralFraction;
    }

}
