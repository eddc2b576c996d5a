package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;
import co.fanki.cld.shared.ValueObject;

import java.util.ArrayList;
import java.util.List;

/**
 * An elementary directed cycle of the causal graph and its polarity.
 *
 * <p>{@code nodes.get(i)} is the source of {@code influences.get(i)}; the
 * last influence returns to {@code nodes.get(0)}. The first node is the
 * lexicographically smallest one on the cycle.</p>
 *
 * @param nodes the visited variables, starting node not repeated
 * @param influences the traversed influences, same size as nodes
 * @param polarity the loop classification
 * @param oppositeCount how many traversed influences are opposite-direction
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FeedbackLoop(List<String> nodes, List<Influence> influences,
        LoopPolarity polarity, int oppositeCount) implements ValueObject {

    /** Validates the loop and makes defensive copies. */
    public FeedbackLoop {
        Preconditions.requireNonNull(nodes, "Nodes are required");
        Preconditions.requireNonNull(influences, "Influences are required");
        Preconditions.require(!nodes.isEmpty(), "A loop has at least one node");
        Preconditions.require(nodes.size() == influences.size(),
                "A loop has one influence per node");
        Preconditions.requireNonNull(polarity, "Polarity is required");
        nodes = List.copyOf(nodes);
        influences = List.copyOf(influences);
    }

    /**
     * Returns the number of influences in the loop.
     *
     * @return the loop length
     */
    public int length() {
        return influences.size();
    }

    /**
     * Returns the node path closed on its start, e.g. {@code [X, Y, Z, X]}.
     *
     * @return the closed path
     */
    public List<String> closedPath() {
        final List<String> path = new ArrayList<>(nodes);
        path.add(nodes.get(0));
        return path;
    }

    /**
     * Renders the loop as {@code X → Y → Z → X}.
     *
     * @return the loop as an arrow chain
     */
    public String describe() {
        return String.join(" → ", closedPath());
    }

}
