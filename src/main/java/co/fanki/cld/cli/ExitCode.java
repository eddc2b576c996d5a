package co.fanki.cld.cli;

import co.fanki.cld.shared.DomainException;

/**
 * Process exit statuses of the command line tool.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ExitCode {

    SUCCESS(0),

    /** Input problems: unreadable file, malformed line, no relations. */
    ANALYSIS_ERROR(1),

    /** Bad command line arguments. */
    USAGE(2),

    /** Graphviz could not be invoked. */
    RENDER_BACKEND_UNAVAILABLE(3),

    /** Graphviz ran but the diagram could not be produced. */
    RENDER_FAILED(4);

    private final int code;

    ExitCode(final int theCode) {
        this.code = theCode;
    }

    /**
     * Returns the numeric process status.
     *
     * @return the status
     */
    public int code() {
        return code;
    }

    /**
     * Maps a domain failure to its exit status.
     *
     * @param e the failure
     * @return the exit status for its error code
     */
    public static ExitCode of(final DomainException e) {
        if (e.getErrorCode() == null) {
            return ANALYSIS_ERROR;
        }
        return switch (e.getErrorCode()) {
            case "USAGE", "UNKNOWN_LAYOUT" -> USAGE;
            case "MALFORMED_LINE", "EMPTY_INPUT", "INPUT_NOT_FOUND",
                    "INVALID_ENCODING" -> ANALYSIS_ERROR;
            case "RENDER_BACKEND_UNAVAILABLE" -> RENDER_BACKEND_UNAVAILABLE;
            case "RENDER_FAILED" -> RENDER_FAILED;
            default -> ANALYSIS_ERROR;
        };
    }

}
