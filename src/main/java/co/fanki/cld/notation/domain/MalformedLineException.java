package co.fanki.cld.notation.domain;

import co.fanki.cld.shared.DomainException;

/**
 * Raised when a data line of the notation cannot be parsed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MalformedLineException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** The error code reported for malformed lines. */
    public static final String ERROR_CODE = "MALFORMED_LINE";

    private final int lineNumber;

    private final String content;

    /**
     * Creates a new malformed line exception.
     *
     * @param theLineNumber the 1-based line number
     * @param theContent the raw line as read
     * @param reason what is wrong with the line
     */
    public MalformedLineException(final int theLineNumber,
            final String theContent, final String reason) {
        super("Malformed line " + theLineNumber + ": '" + theContent + "' ("
                + reason + ")", ERROR_CODE);
        this.lineNumber = theLineNumber;
        this.content = theContent;
    }

    /**
     * Returns the 1-based number of the offending line.
     *
     * @return the line number
     */
    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Returns the raw content of the offending line.
     *
     * @return the line content
     */
    public String content() {
        return content;
    }

}
