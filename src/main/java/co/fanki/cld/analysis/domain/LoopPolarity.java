package co.fanki.cld.analysis.domain;

/**
 * Behaviour of a feedback loop.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum LoopPolarity {

    /** Even number of opposite-direction links: a disturbance compounds. */
    REINFORCING("Reinforcing", "Amplifies changes (exponential growth)"),

    /** Odd number of opposite-direction links: a disturbance is opposed. */
    BALANCING("Balancing", "Seeks equilibrium (self-regulation)");

    private final String label;

    private final String behavior;

    LoopPolarity(final String theLabel, final String theBehavior) {
        this.label = theLabel;
        this.behavior = theBehavior;
    }

    /**
     * Returns the display label.
     *
     * @return e.g. "Reinforcing"
     */
    public String label() {
        return label;
    }

    /**
     * Returns a one-line description of the loop's dynamic behaviour.
     *
     * @return the behaviour description
     */
    public String behavior() {
        return behavior;
    }

    /**
     * Returns the polarity matching a count of opposite-direction links.
     *
     * @param oppositeCount the number of opposite-direction influences
     * @return REINFORCING when even, BALANCING when odd
     */
    public static LoopPolarity fromOppositeCount(final int oppositeCount) {
        return oppositeCount % 2 == 0 ? REINFORCING : BALANCING;
    }

}
