package io.clype.reactorpubsub.model;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PubSubMessageTest {

    @Test
    void testValidOrderedMessage() {
        assertDoesNotThrow(() -> PubSubMessage.ordered("order-123_abc", "payload"));
    }

    @Test
    void testEmptyPayloadAllowed() {
        assertEquals("", PubSubMessage.of("").payload());
    }

    @Test
    void testNullPayloadThrows() {
        assertThrows(NullPointerException.class, () -> PubSubMessage.of(null));
    }

    @Test
    void testEmptyOrderingKeyMeansUnordered() {
        PubSubMessage message = PubSubMessage.ordered("", "payload");

        assertNull(message.orderingKey());
        assertFalse(message.hasOrderingKey());
    }

    @Test
    void testOrderingKeyExceeds128CharsThrows() {
        String longKey = "k".repeat(129);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> PubSubMessage.ordered(longKey, "payload"));
        assertEquals("orderingKey exceeds 128 characters", ex.getMessage());
    }

    @Test
    void testOrderingKeyExactly128CharsAllowed() {
        assertTrue(PubSubMessage.ordered("k".repeat(128), "payload").hasOrderingKey());
    }

    @Test
    void testOrderingKeyMayContainAnyCharacters() {
        assertEquals("user:42", PubSubMessage.ordered("user:42", "payload").orderingKey());
        assertEquals("tenant.order-1", PubSubMessage.ordered("tenant.order-1", "payload").orderingKey());
        assertEquals("order 123/ü", PubSubMessage.ordered("order 123/ü", "payload").orderingKey());
    }

    @Test
    void testDeduplicationIdDefaultsToNull() {
        assertNull(PubSubMessage.ordered("k1", "payload").deduplicationId());
        assertNull(new PubSubMessage("payload", null, null, "").deduplicationId());
    }

    @Test
    void testWithDeduplicationIdKeepsOtherFields() {
        PubSubMessage message = new PubSubMessage("payload", Map.of("origin", "warehouse-7"), "k1")
                .withDeduplicationId("dedup-1");

        assertEquals(new PubSubMessage("payload", Map.of("origin", "warehouse-7"), "k1", "dedup-1"), message);
    }

    @Test
    void testDeduplicationIdExceeds128CharsThrows() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> PubSubMessage.of("payload").withDeduplicationId("d".repeat(129)));
        assertEquals("deduplicationId exceeds 128 characters", ex.getMessage());
    }

    @Test
    void testAttributesAreCopied() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("origin", "warehouse-7");
        PubSubMessage message = new PubSubMessage("payload", attributes, null);

        attributes.put("late", "value");

        assertEquals(Map.of("origin", "warehouse-7"), message.attributes());
        assertThrows(UnsupportedOperationException.class, () -> message.attributes().put("x", "y"));
    }

    @Test
    void testNullAttributesBecomeEmpty() {
        assertTrue(new PubSubMessage("payload", null, null).attributes().isEmpty());
    }

    @Test
    void testNullAttributeValueThrows() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("origin", null);

        assertThrows(NullPointerException.class, () -> new PubSubMessage("payload", attributes, null));
    }

    @Test
    void testPoisonedExceptionTruncatesLongKeysInMessage() {
        String key = "k".repeat(100);
        OrderingKeyPoisonedException ex = new OrderingKeyPoisonedException(key, new IllegalStateException("boom"));

        assertEquals(key, ex.getOrderingKey());
        assertTrue(ex.getMessage().contains("k".repeat(20) + "..."));
        assertFalse(ex.getMessage().contains("k".repeat(21)));
        assertEquals("boom", ex.getCause().getMessage());
    }
}
