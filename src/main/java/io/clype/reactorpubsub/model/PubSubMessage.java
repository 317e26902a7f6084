package io.clype.reactorpubsub.model;

import java.util.Map;
import java.util.Objects;

/**
 * A message to publish, optionally tagged with an ordering key.
 *
 * <p>Messages sharing a non-empty {@code orderingKey} are dispatched one at a time in the
 * order they were submitted. A null or empty key means the message has no ordering
 * constraint.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * PubSubMessage message = new PubSubMessage(
 *     "{\"status\": \"shipped\"}",       // payload
 *     Map.of("origin", "warehouse-7"),   // attributes
 *     "order-123"                        // orderingKey
 * );
 * }</pre>
 *
 * <p><b>Field Constraints:</b></p>
 * <ul>
 *   <li>{@code payload}: Required, may be empty</li>
 *   <li>{@code attributes}: Optional, copied on construction; keys and values must not be null</li>
 *   <li>{@code orderingKey}: Optional, any string of at most 128 characters. Transports may
 *       restrict it further (SNS FIFO topics only accept printable ASCII group ids)</li>
 *   <li>{@code deduplicationId}: Optional, at most 128 characters. Identifies the message
 *       across repeated sends; the publisher assigns one when absent</li>
 * </ul>
 *
 * @param payload         the message body
 * @param attributes      string attributes sent alongside the body (never null after construction)
 * @param orderingKey     the ordering key, or null for unordered messages
 * @param deduplicationId id shared by every send of this message, or null
 */
public record PubSubMessage(
    String payload,
    Map<String, String> attributes,
    String orderingKey,
    String deduplicationId
) {
    private static final int MAX_KEY_LENGTH = 128;

    /**
     * @throws NullPointerException     if payload, an attribute key or an attribute value is null
     * @throws IllegalArgumentException if orderingKey or deduplicationId exceeds 128 characters
     */
    public PubSubMessage {
        Objects.requireNonNull(payload, "payload cannot be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        orderingKey = emptyToNull(orderingKey);
        deduplicationId = emptyToNull(deduplicationId);
        checkLength("orderingKey", orderingKey);
        checkLength("deduplicationId", deduplicationId);
    }

    public PubSubMessage(String payload, Map<String, String> attributes, String orderingKey) {
        this(payload, attributes, orderingKey, null);
    }

    public static PubSubMessage of(String payload) {
        return new PubSubMessage(payload, Map.of(), null);
    }

    public static PubSubMessage ordered(String orderingKey, String payload) {
        return new PubSubMessage(payload, Map.of(), orderingKey);
    }

    public boolean hasOrderingKey() {
        return orderingKey != null;
    }

    /**
     * Returns a copy of this message carrying the given deduplication id.
     */
    public PubSubMessage withDeduplicationId(String id) {
        return new PubSubMessage(payload, attributes, orderingKey, id);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static void checkLength(String field, String value) {
        if (value != null && value.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(field + " exceeds " + MAX_KEY_LENGTH + " characters");
        }
    }
}
