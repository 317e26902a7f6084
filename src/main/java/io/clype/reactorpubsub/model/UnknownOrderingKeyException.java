package io.clype.reactorpubsub.model;

/**
 * Thrown when resuming an ordering key the publisher has never seen.
 */
public class UnknownOrderingKeyException extends RuntimeException {

    private final String orderingKey;

    public UnknownOrderingKeyException(String orderingKey) {
        super("Ordering key was never used by this publisher: " + orderingKey);
        this.orderingKey = orderingKey;
    }

    public String getOrderingKey() {
        return orderingKey;
    }
}
