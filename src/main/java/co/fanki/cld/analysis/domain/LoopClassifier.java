package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;

import java.util.List;

/**
 * Classifies a cycle by the parity of its opposite-direction influences.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LoopClassifier {

    /**
     * Counts the opposite-direction influences along a cycle.
     *
     * @param influences the traversed influences
     * @return the number of negative links
     */
    public int countOpposite(final List<Influence> influences) {
        Preconditions.requireNonNull(influences, "Influences are required");

        int count = 0;
        for (final Influence influence : influences) {
            if (influence.isOpposite()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Classifies a cycle given its traversed influences.
     *
     * @param influences the traversed influences
     * @return REINFORCING for an even count of negative links (zero
     *         included), BALANCING for an odd one
     */
    public LoopPolarity classify(final List<Influence> influences) {
        return LoopPolarity.fromOppositeCount(countOpposite(influences));
    }

    /**
     * Builds a classified loop from a detected cycle.
     *
     * @param nodes the visited variables
     * @param influences the traversed influences
     * @return the classified feedback loop
     */
    public FeedbackLoop toLoop(final List<String> nodes,
            final List<Influence> influences) {
        final int opposite = countOpposite(influences);
        return new FeedbackLoop(nodes, influences,
                LoopPolarity.fromOppositeCount(opposite), opposite);
    }

}
