package com.demo.messaging.service;

import com.demo.messaging.cache.CacheKeys;
import com.demo.messaging.cache.RequestCache;
import com.demo.messaging.client.MessagingGateway;
import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.Message;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.infrastructure.RealtimeSubscription;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Server-side entry point for the messaging commands and queries.
 *
 * Store calls run on the messaging executor. Conversation lists and unread
 * counts are read through the request cache; writes invalidate the affected
 * users' entries before completing. Events arriving from other nodes
 * invalidate the same entries on this node.
 */
@Service
@Slf4j
public class MessagingService implements MessagingGateway {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final UnreadAggregator unreadAggregator;
    private final RequestCache requestCache;
    private final RealtimeBus realtimeBus;
    private final Executor executor;
    private final Duration conversationsTtl;

    private RealtimeSubscription remoteInvalidation;

    public MessagingService(ConversationStore conversationStore,
                            MessageStore messageStore,
                            UnreadAggregator unreadAggregator,
                            RequestCache requestCache,
                            RealtimeBus realtimeBus,
                            @Qualifier("messagingExecutor") Executor executor,
                            @Value("${messaging.cache.conversations-ttl-ms:30000}") long conversationsTtlMs) {
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.unreadAggregator = unreadAggregator;
        this.requestCache = requestCache;
        this.realtimeBus = realtimeBus;
        this.executor = executor;
        this.conversationsTtl = Duration.ofMillis(conversationsTtlMs);
    }

    @PostConstruct
    public void subscribeToRemoteChanges() {
        remoteInvalidation = realtimeBus.subscribeAll((userId, event) -> {
            requestCache.invalidate(CacheKeys.conversationsPattern(userId));
            unreadAggregator.invalidate(userId);
        });
    }

    @PreDestroy
    public void shutdown() {
        if (remoteInvalidation != null) {
            remoteInvalidation.close();
        }
    }

    @Override
    public CompletableFuture<String> createOrGetConversation(String userA, String userB) {
        return CompletableFuture.supplyAsync(() -> {
            Conversation conversation = conversationStore.getOrCreate(userA, userB);
            invalidateConversationLists(conversation.getParticipantAId(), conversation.getParticipantBId());
            return conversation.getId();
        }, executor);
    }

    @Override
    public CompletableFuture<ConversationPage> listConversations(String userId, String cursor) {
        return requestCache.dedupe(
            CacheKeys.conversations(userId, cursor),
            ConversationPage.class,
            () -> CompletableFuture.supplyAsync(() -> conversationStore.list(userId, cursor), executor),
            conversationsTtl);
    }

    @Override
    public CompletableFuture<Message> sendMessage(String conversationId, String senderId, String body, String idempotencyKey) {
        return CompletableFuture.supplyAsync(() -> {
            Message message = messageStore.append(conversationId, senderId, body, idempotencyKey);
            invalidateConversationLists(message.getSenderId(), message.getRecipientId());
            return message;
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> markConversationRead(String conversationId, String readerId) {
        return CompletableFuture.supplyAsync(() -> {
            int updated = messageStore.markRead(conversationId, readerId);
            invalidateConversationLists(readerId);
            return updated;
        }, executor);
    }

    @Override
    public CompletableFuture<Integer> getUnreadCount(String userId) {
        return unreadAggregator.get(userId);
    }

    public CompletableFuture<List<Message>> recentMessages(String conversationId, String requesterId, int limit) {
        return CompletableFuture.supplyAsync(
            () -> messageStore.recentMessages(conversationId, requesterId, limit), executor);
    }

    private void invalidateConversationLists(String... userIds) {
        for (String userId : userIds) {
            requestCache.invalidate(CacheKeys.conversationsPattern(userId));
        }
    }
}
