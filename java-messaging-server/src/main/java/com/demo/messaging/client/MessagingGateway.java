package com.demo.messaging.client;

import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.Message;

import java.util.concurrent.CompletableFuture;

/**
 * Command/query surface of the messaging core.
 *
 * Implemented in-process by the server facade and over HTTP by
 * {@link RestMessagingGateway}. Failures complete the future exceptionally
 * with a {@link com.demo.messaging.exception.MessagingException}.
 */
public interface MessagingGateway {

    /**
     * @return id of the conversation between the two users
     */
    CompletableFuture<String> createOrGetConversation(String userA, String userB);

    /**
     * @param cursor nextCursor of the previous page, or null for the first page
     */
    CompletableFuture<ConversationPage> listConversations(String userId, String cursor);

    CompletableFuture<Message> sendMessage(String conversationId, String senderId, String body, String idempotencyKey);

    /**
     * @return number of messages newly marked read
     */
    CompletableFuture<Integer> markConversationRead(String conversationId, String readerId);

    CompletableFuture<Integer> getUnreadCount(String userId);
}
