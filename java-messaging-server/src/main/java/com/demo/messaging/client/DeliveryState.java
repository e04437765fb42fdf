package com.demo.messaging.client;

/**
 * Lifecycle of a message sent from this client.
 *
 * SENT, PERSISTED, DELIVERED and READ only move forward. FAILED is reachable
 * from SENT once retries are exhausted and goes back to SENT on a manual retry.
 */
public enum DeliveryState {
    SENT(0),
    PERSISTED(1),
    DELIVERED(2),
    READ(3),
    FAILED(-1);

    private final int rank;

    DeliveryState(int rank) {
        this.rank = rank;
    }

    boolean isBefore(DeliveryState other) {
        return rank < other.rank;
    }
}
