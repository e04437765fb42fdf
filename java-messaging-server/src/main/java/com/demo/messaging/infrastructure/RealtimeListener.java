package com.demo.messaging.infrastructure;

import com.demo.messaging.domain.RealtimeEvent;

/**
 * Receives realtime events for one subscribed user
 */
@FunctionalInterface
public interface RealtimeListener {
    void onEvent(RealtimeEvent event);
}
