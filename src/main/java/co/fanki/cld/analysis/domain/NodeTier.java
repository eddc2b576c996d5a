package co.fanki.cld.analysis.domain;

/**
 * Structural role of a variable, derived from its connectivity.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeTier {

    /** Most connected variables. */
    CENTRAL("Central"),

    /** Neither among the most nor the least connected. */
    INTERMEDIATE("Intermediate"),

    /** Least connected variables. */
    PERIPHERAL("Peripheral");

    private final String label;

    NodeTier(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the display label.
     *
     * @return e.g. "Central"
     */
    public String label() {
        return label;
    }

}
