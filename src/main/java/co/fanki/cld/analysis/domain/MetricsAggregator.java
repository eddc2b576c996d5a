package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;

/**
 * Tallies the summary counts of a {@link CausalGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MetricsAggregator {

    /**
     * Counts variables and influences by polarity.
     *
     * @param graph the causal graph
     * @return the metrics
     */
    public GraphMetrics aggregate(final CausalGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        int positive = 0;
        int negative = 0;
        for (final Influence influence : graph.influences()) {
            if (influence.isOpposite()) {
                negative++;
            } else {
                positive++;
            }
        }
        return new GraphMetrics(graph.nodeCount(), graph.influenceCount(),
                positive, negative);
    }

}
