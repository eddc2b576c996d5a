package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of ranking variables into tiers.
 *
 * <p>Holds the centrality score and tier of every variable, and the
 * variables in rank order (highest score first, ties in graph order).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeClassification {

    private final List<String> ranking;

    private final Map<String, Integer> scores;

    private final Map<String, NodeTier> tiers;

    /**
     * Creates a new NodeClassification.
     *
     * @param theRanking the variables, highest score first
     * @param theScores the score per variable
     * @param theTiers the tier per variable
     */
    public NodeClassification(final List<String> theRanking,
            final Map<String, Integer> theScores,
            final Map<String, NodeTier> theTiers) {
        Preconditions.requireNonNull(theRanking, "Ranking is required");
        Preconditions.requireNonNull(theScores, "Scores are required");
        Preconditions.requireNonNull(theTiers, "Tiers are required");
        Preconditions.require(theTiers.keySet().containsAll(theRanking)
                        && theTiers.size() == theRanking.size(),
                "Every ranked variable needs exactly one tier");

        this.ranking = List.copyOf(theRanking);
        this.scores = Collections.unmodifiableMap(
                new LinkedHashMap<>(theScores));
        this.tiers = Collections.unmodifiableMap(
                new LinkedHashMap<>(theTiers));
    }

    /**
     * Returns the tier of a variable.
     *
     * @param identifier the variable identifier
     * @return the tier, or null if the variable is unknown
     */
    public NodeTier tierOf(final String identifier) {
        return tiers.get(identifier);
    }

    /**
     * Returns the centrality score of a variable.
     *
     * @param identifier the variable identifier
     * @return the in-degree plus out-degree, 0 if unknown
     */
    public int scoreOf(final String identifier) {
        return scores.getOrDefault(identifier, 0);
    }

    /**
     * Returns the variables of one tier, in rank order.
     *
     * @param tier the tier
     * @return unmodifiable list of identifiers
     */
    public List<String> members(final NodeTier tier) {
        final List<String> result = new ArrayList<>();
        for (final String identifier : ranking) {
            if (tiers.get(identifier) == tier) {
                result.add(identifier);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the highest ranked central variable, used as layout root.
     *
     * @return the identifier, or null when there are no variables
     */
    public String topCentral() {
        final List<String> central = members(NodeTier.CENTRAL);
        return central.isEmpty() ? null : central.get(0);
    }

    /** Returns the variables in rank order. */
    public List<String> ranking() {
        return ranking;
    }

    /** Returns the tier per variable. */
    public Map<String, NodeTier> tiers() {
        return tiers;
    }

    /** Returns the score per variable. */
    public Map<String, Integer> scores() {
        return scores;
    }

}
