package com.demo.messaging.service;

import com.demo.messaging.cache.RequestCache;
import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.exception.ValidationException;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.infrastructure.RealtimeSubscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessagingServiceTest {

    @Mock
    private ConversationStore conversationStore;

    @Mock
    private MessageStore messageStore;

    @Mock
    private UnreadAggregator unreadAggregator;

    @Mock
    private RealtimeBus realtimeBus;

    @Mock
    private RealtimeSubscription subscription;

    private MessagingService service;

    @BeforeEach
    void setUp() {
        service = new MessagingService(conversationStore, messageStore, unreadAggregator,
            new RequestCache(Duration.ofSeconds(5)), realtimeBus, Runnable::run, 30_000);
    }

    @Test
    void conversationListIsCachedUntilAWriteTouchesIt() {
        when(conversationStore.list("alice", null)).thenReturn(ConversationPage.empty());
        when(messageStore.append("c1", "bob", "hi", "k1")).thenReturn(message());

        service.listConversations("alice", null).join();
        service.listConversations("alice", null).join();
        verify(conversationStore, times(1)).list("alice", null);

        service.sendMessage("c1", "bob", "hi", "k1").join();
        service.listConversations("alice", null).join();
        verify(conversationStore, times(2)).list("alice", null);
    }

    @Test
    void readInvalidatesTheReadersList() {
        when(conversationStore.list("alice", null)).thenReturn(ConversationPage.empty());
        when(messageStore.markRead("c1", "alice")).thenReturn(2);

        service.listConversations("alice", null).join();
        assertThat(service.markConversationRead("c1", "alice").join()).isEqualTo(2);
        service.listConversations("alice", null).join();

        verify(conversationStore, times(2)).list("alice", null);
    }

    @Test
    void createReturnsTheConversationId() {
        when(conversationStore.getOrCreate("alice", "bob")).thenReturn(Conversation.builder()
            .id("c1")
            .participantAId("alice")
            .participantBId("bob")
            .build());

        assertThat(service.createOrGetConversation("alice", "bob").join()).isEqualTo("c1");
    }

    @Test
    void storeErrorsCompleteTheFutureExceptionally() {
        when(messageStore.append("c1", "bob", "", "k1")).thenThrow(new ValidationException("Message body must not be empty"));

        CompletableFuture<Message> result = service.sendMessage("c1", "bob", "", "k1");

        assertThatThrownBy(result::join).hasCauseInstanceOf(ValidationException.class);
    }

    @Test
    void eventsFromOtherNodesInvalidateCachedReads() {
        when(realtimeBus.subscribeAll(any())).thenReturn(subscription);
        when(conversationStore.list("alice", null)).thenReturn(ConversationPage.empty());
        service.subscribeToRemoteChanges();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<BiConsumer<String, RealtimeEvent>> listener = ArgumentCaptor.forClass(BiConsumer.class);
        verify(realtimeBus).subscribeAll(listener.capture());

        service.listConversations("alice", null).join();
        listener.getValue().accept("alice", RealtimeEvent.builder()
            .type(RealtimeEvent.Type.MESSAGE_INSERTED)
            .conversationId("c1")
            .sequence(2)
            .build());
        service.listConversations("alice", null).join();

        verify(conversationStore, times(2)).list("alice", null);
        verify(unreadAggregator).invalidate("alice");

        service.shutdown();
        verify(subscription).close();
    }

    private static Message message() {
        return Message.builder()
            .id("m1")
            .conversationId("c1")
            .senderId("bob")
            .recipientId("alice")
            .body("hi")
            .idempotencyKey("k1")
            .build();
    }
}
