package io.clype.reactorpubsub.model;

/**
 * Returned for messages on an ordering key that is paused after a dispatch failure.
 *
 * <p>The message was never sent: a previous message on the same key failed, and sending
 * this one would deliver it out of order. The failure that paused the key is available
 * as {@link #getCause()}. Call {@code resume(orderingKey)} on the publisher to continue
 * publishing on the key.</p>
 */
public class OrderingKeyPoisonedException extends RuntimeException {

    private static final int MAX_KEY_LENGTH_IN_MESSAGE = 20;

    private final String orderingKey;

    public OrderingKeyPoisonedException(String orderingKey, Throwable poisoningError) {
        super(String.format("Ordering key '%s' is paused after a failed publish; resume it to continue",
                truncateForMessage(orderingKey)), poisoningError);
        this.orderingKey = orderingKey;
    }

    private static String truncateForMessage(String key) {
        if (key == null) {
            return "null";
        }
        if (key.length() <= MAX_KEY_LENGTH_IN_MESSAGE) {
            return key;
        }
        return key.substring(0, MAX_KEY_LENGTH_IN_MESSAGE) + "...";
    }

    public String getOrderingKey() {
        return orderingKey;
    }
}
