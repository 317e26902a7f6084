package io.clype.reactorpubsub.model;

/**
 * A backend failure expected to clear on its own: throttling, temporary unavailability,
 * network errors.
 */
public class TransientBackendException extends BackendException {

    public TransientBackendException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    public TransientBackendException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
