package com.demo.messaging.service;

import com.demo.messaging.config.ClockConfig;
import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.NotFoundException;
import com.demo.messaging.exception.ValidationException;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.repository.ConversationRepository;
import com.demo.messaging.repository.MessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({MessageStore.class, ConversationStore.class, MessageBodyValidator.class, MetricsService.class, ClockConfig.class})
class MessageStoreTest {

    @Autowired
    private MessageStore messageStore;

    @Autowired
    private ConversationStore conversationStore;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private MessageRepository messageRepository;

    @MockBean
    private RealtimeBus realtimeBus;

    @MockBean
    private UnreadAggregator unreadAggregator;

    private String conversationId;

    @BeforeEach
    void setUp() {
        conversationId = conversationStore.getOrCreate("alice", "bob").getId();
    }

    @Test
    void appendStoresNormalizedBodyForTheOtherParticipant() {
        Message message = messageStore.append(conversationId, "alice", "  hi bob  ", "k1");

        assertThat(message.getId()).isNotNull();
        assertThat(message.getBody()).isEqualTo("hi bob");
        assertThat(message.getRecipientId()).isEqualTo("bob");
        assertThat(message.getReadAt()).isNull();
        verify(unreadAggregator).invalidate("bob");
    }

    @Test
    void appendPublishesInsertWithIncreasingSequence() {
        messageStore.append(conversationId, "alice", "one", "k1");
        messageStore.append(conversationId, "bob", "two", "k2");

        List<RealtimeEvent> inserts = publishedEvents(RealtimeEvent.Type.MESSAGE_INSERTED);
        assertThat(inserts).hasSize(2);
        assertThat(inserts.get(1).getSequence()).isGreaterThan(inserts.get(0).getSequence());
        assertThat(inserts.get(0).getParticipantIds()).containsExactlyInAnyOrder("alice", "bob");
        assertThat(inserts.get(0).getIdempotencyKey()).isEqualTo("k1");
        assertThat(inserts.get(0).getActorId()).isEqualTo("alice");
    }

    @Test
    void duplicateSendWithSameKeyPersistsOnce() {
        Message first = messageStore.append(conversationId, "alice", "hi", "k1");
        Message retried = messageStore.append(conversationId, "alice", "hi", "k1");

        assertThat(retried.getId()).isEqualTo(first.getId());
        assertThat(messageRepository.countByConversationId(conversationId)).isEqualTo(1);
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull("bob")).isEqualTo(1);
        assertThat(publishedEvents(RealtimeEvent.Type.MESSAGE_INSERTED)).hasSize(1);
        verify(unreadAggregator, times(1)).invalidate("bob");
    }

    @Test
    void sameKeyFromDifferentSendersIsNotADuplicate() {
        messageStore.append(conversationId, "alice", "hi", "k1");
        messageStore.append(conversationId, "bob", "hey", "k1");

        assertThat(messageRepository.countByConversationId(conversationId)).isEqualTo(2);
    }

    @Test
    void rejectsEmptyBody() {
        assertThatThrownBy(() -> messageStore.append(conversationId, "alice", "   ", "k1"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> messageStore.append(conversationId, "alice", null, "k1"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void enforcesMaximumBodyLength() {
        assertThat(messageStore.append(conversationId, "alice", "a".repeat(1000), "k1").getBody()).hasSize(1000);

        assertThatThrownBy(() -> messageStore.append(conversationId, "alice", "a".repeat(1001), "k2"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("1000");
    }

    @Test
    void rejectsMissingIdempotencyKey() {
        assertThatThrownBy(() -> messageStore.append(conversationId, "alice", "hi", " "))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void appendToUnknownConversationIsNotFound() {
        assertThatThrownBy(() -> messageStore.append("missing", "alice", "hi", "k1"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void nonParticipantCannotAppend() {
        assertThatThrownBy(() -> messageStore.append(conversationId, "mallory", "hi", "k1"))
            .isInstanceOf(AuthorizationException.class);
        verify(realtimeBus, never()).publish(org.mockito.ArgumentMatchers.argThat(
            event -> event.getType() == RealtimeEvent.Type.MESSAGE_INSERTED));
    }

    @Test
    void markReadCountsExactlyTheReadersUnreadMessages() {
        messageStore.append(conversationId, "alice", "one", "k1");
        messageStore.append(conversationId, "alice", "two", "k2");
        messageStore.append(conversationId, "alice", "three", "k3");
        messageStore.append(conversationId, "bob", "reply", "k4");

        int updated = messageStore.markRead(conversationId, "bob");

        assertThat(updated).isEqualTo(3);
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull("bob")).isZero();
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull("alice")).isEqualTo(1);
        assertThat(messageStore.markRead(conversationId, "bob")).isZero();
        verify(unreadAggregator, atLeastOnce()).invalidate("bob");
    }

    @Test
    void markReadPublishesOnlyWhenSomethingChanged() {
        messageStore.append(conversationId, "alice", "one", "k1");

        messageStore.markRead(conversationId, "bob");
        messageStore.markRead(conversationId, "bob");

        List<RealtimeEvent> reads = publishedEvents(RealtimeEvent.Type.MESSAGE_READ);
        assertThat(reads).hasSize(1);
        assertThat(reads.get(0).getAffectedCount()).isEqualTo(1);
        assertThat(reads.get(0).getActorId()).isEqualTo("bob");
        assertThat(reads.get(0).getSequence())
            .isGreaterThan(publishedEvents(RealtimeEvent.Type.MESSAGE_INSERTED).get(0).getSequence());
    }

    @Test
    void senderCannotMarkOwnMessagesRead() {
        messageStore.append(conversationId, "alice", "one", "k1");

        assertThat(messageStore.markRead(conversationId, "alice")).isZero();
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull("bob")).isEqualTo(1);
    }

    @Test
    void readAtIsNeverClearedOrMovedOnceSet() {
        Message message = messageStore.append(conversationId, "alice", "one", "k1");
        messageStore.markRead(conversationId, "bob");
        Instant firstReadAt = messageRepository.findById(message.getId()).orElseThrow().getReadAt();

        messageStore.append(conversationId, "alice", "two", "k2");
        messageStore.markRead(conversationId, "bob");
        messageStore.append(conversationId, "alice", "one", "k1");

        Message reloaded = messageRepository.findById(message.getId()).orElseThrow();
        assertThat(firstReadAt).isNotNull();
        assertThat(reloaded.getReadAt()).isEqualTo(firstReadAt);
    }

    @Test
    void markReadRequiresParticipant() {
        assertThatThrownBy(() -> messageStore.markRead(conversationId, "mallory"))
            .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void markReadOnUnknownConversationIsNotFound() {
        assertThatThrownBy(() -> messageStore.markRead("missing", "bob"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void appendAndReadBumpConversationVersion() {
        long initial = conversationRepository.findById(conversationId).orElseThrow().getVersion();

        messageStore.append(conversationId, "alice", "one", "k1");
        long afterAppend = conversationRepository.findById(conversationId).orElseThrow().getVersion();

        messageStore.markRead(conversationId, "bob");
        Conversation afterRead = conversationRepository.findById(conversationId).orElseThrow();

        assertThat(afterAppend).isGreaterThan(initial);
        assertThat(afterRead.getVersion()).isGreaterThan(afterAppend);
        assertThat(afterRead.getLastReadAt()).isNotNull();
        assertThat(afterRead.getLastMessageAt()).isNotNull();
    }

    @Test
    void historyIsInAppendOrder() {
        for (int i = 1; i <= 5; i++) {
            messageStore.append(conversationId, i % 2 == 0 ? "bob" : "alice", "m" + i, "k" + i);
        }

        List<Message> all = messageStore.recentMessages(conversationId, "alice", 50);
        assertThat(all).extracting(Message::getBody).containsExactly("m1", "m2", "m3", "m4", "m5");
        for (int i = 1; i < all.size(); i++) {
            assertThat(all.get(i).getCreatedAt()).isAfter(all.get(i - 1).getCreatedAt());
        }

        List<Message> latest = messageStore.recentMessages(conversationId, "bob", 2);
        assertThat(latest).extracting(Message::getBody).containsExactly("m4", "m5");
    }

    @Test
    void historyRequiresParticipant() {
        assertThatThrownBy(() -> messageStore.recentMessages(conversationId, "mallory", 10))
            .isInstanceOf(AuthorizationException.class);
    }

    private List<RealtimeEvent> publishedEvents(RealtimeEvent.Type type) {
        ArgumentCaptor<RealtimeEvent> captor = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(realtimeBus, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream()
            .filter(event -> event.getType() == type)
            .collect(Collectors.toList());
    }
}
