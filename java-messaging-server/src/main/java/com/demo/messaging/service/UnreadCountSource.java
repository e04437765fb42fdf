package com.demo.messaging.service;

/**
 * Where the unread aggregate comes from. Selected with messaging.unread.strategy.
 */
public interface UnreadCountSource {

    /**
     * Messages addressed to the user that are still unread, across all conversations
     */
    long count(String userId);

    /**
     * Called after a write that changed the user's count
     */
    default void refresh(String userId) {
    }

    String strategy();
}
