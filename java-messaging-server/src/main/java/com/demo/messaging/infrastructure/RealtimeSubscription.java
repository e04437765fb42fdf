package com.demo.messaging.infrastructure;

/**
 * Handle returned by subscribe; closing it stops delivery. Idempotent.
 */
@FunctionalInterface
public interface RealtimeSubscription extends AutoCloseable {

    @Override
    void close();
}
