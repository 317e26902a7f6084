package io.clype.reactorpubsub.model;

/**
 * Status information about the ordered publisher.
 *
 * <p>This record provides introspection into the publisher's current state,
 * useful for monitoring and health checks.</p>
 *
 * @param activeRequests number of submitted messages that have not resolved yet
 * @param orderingKeys   number of ordering keys seen so far
 * @param pausedKeys     number of ordering keys currently paused
 */
public record PublisherStatus(
    int activeRequests,
    int orderingKeys,
    int pausedKeys
) {}
