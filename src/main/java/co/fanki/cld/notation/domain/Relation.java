package co.fanki.cld.notation.domain;

import co.fanki.cld.shared.Preconditions;
import co.fanki.cld.shared.ValueObject;

import java.util.regex.Pattern;

/**
 * A signed causal relation as declared in the notation:
 * {@code source sign destination}.
 *
 * @param source the influencing variable
 * @param polarity the sign of the influence
 * @param destination the influenced variable
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Relation(String source, Polarity polarity, String destination)
        implements ValueObject {

    /** Identifiers are letters, digits and underscores only. */
    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    /** Validates the relation. */
    public Relation {
        Preconditions.require(isIdentifier(source),
                "Invalid source identifier: " + source);
        Preconditions.requireNonNull(polarity, "Polarity is required");
        Preconditions.require(isIdentifier(destination),
                "Invalid destination identifier: " + destination);
    }

    /**
     * Checks whether a token is a valid variable identifier.
     *
     * @param token the token to check, may be null
     * @return true if the token matches {@code [A-Za-z0-9_]+}
     */
    public static boolean isIdentifier(final String token) {
        return token != null && IDENTIFIER.matcher(token).matches();
    }

    /**
     * Renders the relation as a notation line.
     *
     * @return e.g. {@code "Births + Population"}
     */
    public String toNotation() {
        return source + " " + polarity.symbol() + " " + destination;
    }

}
