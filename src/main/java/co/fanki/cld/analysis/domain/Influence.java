package co.fanki.cld.analysis.domain;

import co.fanki.cld.notation.domain.Polarity;
import co.fanki.cld.shared.Preconditions;
import co.fanki.cld.shared.ValueObject;

/**
 * A signed edge of the causal graph.
 *
 * <p>The index is the 0-based declaration order of the relation that
 * produced it, which keeps parallel influences between the same pair of
 * variables distinct.</p>
 *
 * @param index the declaration order
 * @param source the influencing variable
 * @param destination the influenced variable
 * @param polarity the sign of the influence
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Influence(int index, String source, String destination,
        Polarity polarity) implements ValueObject {

    /** Validates the influence. */
    public Influence {
        Preconditions.require(index >= 0, "Index must be non-negative");
        Preconditions.requireNonBlank(source, "Source is required");
        Preconditions.requireNonBlank(destination, "Destination is required");
        Preconditions.requireNonNull(polarity, "Polarity is required");
    }

    /**
     * Checks if the influence inverts the direction of change.
     *
     * @return true for an opposite-direction influence
     */
    public boolean isOpposite() {
        return polarity == Polarity.OPPOSITE_DIRECTION;
    }

    /**
     * Checks if this influence is a self-loop.
     *
     * @return true when source and destination are the same variable
     */
    public boolean isSelfLoop() {
        return source.equals(destination);
    }

}
