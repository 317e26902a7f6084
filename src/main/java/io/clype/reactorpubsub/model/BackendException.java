package io.clype.reactorpubsub.model;

/**
 * Base class for failures reported by the messaging backend.
 *
 * <p>Subclasses tell retry logic whether the failure is worth another attempt:
 * {@link TransientBackendException} is, {@link FatalBackendException} is not.</p>
 */
public abstract class BackendException extends RuntimeException {

    private final String errorCode;

    protected BackendException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the backend error code (e.g. "Throttling"), or null when the failure
     * did not carry one (network errors).
     */
    public String getErrorCode() {
        return errorCode;
    }
}
