package io.clype.reactorpubsub.model;

/**
 * Dispatch state of an ordering key.
 */
public enum OrderingKeyStatus {

    /** Messages are dispatched in order. */
    ACTIVE,

    /** A dispatch failed; new messages fail fast until the key is resumed. */
    PAUSED
}
