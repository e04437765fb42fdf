package com.demo.messaging.client;

import com.demo.messaging.domain.ConversationPage;

/**
 * Typed notifications from {@link ClientSyncController} to the UI layer.
 * Invoked on the controller's event loop.
 */
public interface ClientSyncListener {

    /**
     * Badge value changed. Never negative.
     */
    default void onUnreadCountChanged(int unreadCount) {
    }

    default void onMessageStateChanged(OutgoingMessage message) {
    }

    default void onConversationsChanged(ConversationPage page) {
    }

    default void onSyncError(String operation, Throwable error) {
    }
}
