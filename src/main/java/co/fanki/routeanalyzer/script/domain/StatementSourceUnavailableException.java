package co.fanki.routeanalyzer.script.domain;

import co.fanki.routeanalyzer.shared.DomainException;

/**
 * The statement source as a whole cannot be read.
 *
 * <p>This is the only failure the analysis core propagates. It is passed
 * through untouched so the caller can retry later.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StatementSourceUnavailableException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported to REST callers. */
    public static final String ERROR_CODE = "SOURCE_UNAVAILABLE";

    /**
     * Creates a new exception.
     *
     * @param message the error message
     */
    public StatementSourceUnavailableException(final String message) {
        super(message, ERROR_CODE);
    }

    /**
     * Creates a new exception with its cause.
     *
     * @param message the error message
     * @param cause the underlying I/O failure
     */
    public StatementSourceUnavailableException(final String message,
            final Throwable cause) {
        super(message, ERROR_CODE, cause);
    }

}
