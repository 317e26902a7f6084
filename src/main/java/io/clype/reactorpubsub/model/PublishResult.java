package io.clype.reactorpubsub.model;

import java.util.Objects;

/**
 * Outcome of publishing a single message: {@link Success} with the backend message id,
 * or {@link Failure} with the error that prevented publication.
 */
public interface PublishResult {

    boolean isSuccess();

    static PublishResult success(String messageId) {
        return new Success(messageId);
    }

    static PublishResult failure(Throwable error) {
        return new Failure(error);
    }

    /**
     * @param messageId the id assigned by the backend
     */
    record Success(String messageId) implements PublishResult {
        public Success {
            Objects.requireNonNull(messageId, "messageId cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * @param error why the message was not published
     */
    record Failure(Throwable error) implements PublishResult {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
