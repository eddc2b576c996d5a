package co.fanki.cld.rendering.domain;

import co.fanki.cld.shared.DomainException;

/**
 * Raised when the external Graphviz program cannot be invoked.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RenderBackendUnavailableException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** The error code reported when the backend is unavailable. */
    public static final String ERROR_CODE = "RENDER_BACKEND_UNAVAILABLE";

    /**
     * Creates a new exception.
     *
     * @param message what could not be invoked
     * @param cause the underlying failure, may be null
     */
    public RenderBackendUnavailableException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
