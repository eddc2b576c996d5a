package co.fanki.cld.notation.domain;

/**
 * The sign of a causal influence between two variables.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Polarity {

    /** A change in the source moves the destination the same way. */
    SAME_DIRECTION('+'),

    /** A change in the source moves the destination the opposite way. */
    OPPOSITE_DIRECTION('-');

    private final char symbol;

    Polarity(final char theSymbol) {
        this.symbol = theSymbol;
    }

    /**
     * Returns the notation symbol, {@code +} or {@code -}.
     *
     * @return the symbol
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Resolves the polarity of a sign token.
     *
     * @param token the token, must be exactly {@code "+"} or {@code "-"}
     * @return the polarity, or null if the token is not a sign
     */
    public static Polarity fromToken(final String token) {
        if ("+".equals(token)) {
            return SAME_DIRECTION;
        }
        if ("-".equals(token)) {
            return OPPOSITE_DIRECTION;
        }
        return null;
    }

}
