package io.clype.reactorpubsub.model;

/**
 * A backend failure that will not succeed on retry: validation errors, missing topics,
 * authorization failures.
 */
public class FatalBackendException extends BackendException {

    public FatalBackendException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    public FatalBackendException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
