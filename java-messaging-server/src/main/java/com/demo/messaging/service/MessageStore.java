package com.demo.messaging.service;

import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.domain.ValidationResult;
import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.NotFoundException;
import com.demo.messaging.exception.TransientException;
import com.demo.messaging.exception.ValidationException;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.repository.ConversationRepository;
import com.demo.messaging.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only message log with read-state transitions.
 *
 * Both writes lock the conversation row for the length of their transaction,
 * so appends and read transitions on one conversation are serialized and the
 * conversation version increases once per change. Cache invalidation and
 * realtime fan-out happen after commit, before the call returns.
 */
@Service
@Slf4j
public class MessageStore {

    private static final int MAX_HISTORY_LIMIT = 200;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final MessageBodyValidator bodyValidator;
    private final UnreadAggregator unreadAggregator;
    private final RealtimeBus realtimeBus;
    private final ObjectProvider<EventPublisher> eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public MessageStore(ConversationRepository conversationRepository,
                        MessageRepository messageRepository,
                        MessageBodyValidator bodyValidator,
                        UnreadAggregator unreadAggregator,
                        RealtimeBus realtimeBus,
                        ObjectProvider<EventPublisher> eventPublisher,
                        MetricsService metricsService,
                        Clock clock,
                        PlatformTransactionManager transactionManager) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.bodyValidator = bodyValidator;
        this.unreadAggregator = unreadAggregator;
        this.realtimeBus = realtimeBus;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Append a message. A second call with the same (conversation, sender,
     * idempotency key) returns the message persisted by the first call.
     *
     * @throws ValidationException on an empty or oversized body or a blank key
     * @throws NotFoundException if the conversation does not exist
     * @throws AuthorizationException if the sender is not a participant
     */
    public Message append(String conversationId, String senderId, String body, String idempotencyKey) {
        ValidationResult validation = bodyValidator.validate(body);
        if (!validation.isValid()) {
            throw new ValidationException(validation.getErrorMessage());
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key is required");
        }

        MetricsService.TimerSample timer = metricsService.startTimer();
        AppendOutcome outcome;
        try {
            outcome = transactionTemplate.execute(status ->
                appendLocked(conversationId, senderId, validation.getValue(), idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            // Lost an insert race on the idempotency constraint; the winner's row is the answer
            Message existing = messageRepository
                .findByConversationIdAndSenderIdAndIdempotencyKey(conversationId, senderId, idempotencyKey)
                .orElseThrow(() -> new TransientException(
                    "Message insert conflicted but no row is visible for key " + idempotencyKey, e));
            metricsService.recordIdempotentReplay(conversationId);
            return existing;
        }

        if (outcome.replayed) {
            metricsService.recordIdempotentReplay(conversationId);
            log.info("Duplicate send resolved by idempotency key: conversationId={}, senderId={}, messageId={}",
                conversationId, senderId, outcome.message.getId());
            return outcome.message;
        }

        Message message = outcome.message;
        unreadAggregator.invalidate(message.getRecipientId());

        realtimeBus.publish(RealtimeEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .type(RealtimeEvent.Type.MESSAGE_INSERTED)
            .conversationId(conversationId)
            .participantIds(List.of(message.getSenderId(), message.getRecipientId()))
            .sequence(outcome.sequence)
            .actorId(senderId)
            .messageId(message.getId())
            .idempotencyKey(idempotencyKey)
            .affectedCount(1)
            .occurredAt(message.getCreatedAt())
            .message(message)
            .build());
        eventPublisher.ifAvailable(publisher -> publisher.publishMessageSent(message, outcome.sequence));

        metricsService.recordMessageAppended(conversationId, timer.stop());
        log.debug("Message appended: conversationId={}, messageId={}, sequence={}",
            conversationId, message.getId(), outcome.sequence);
        return message;
    }

    private AppendOutcome appendLocked(String conversationId, String senderId, String body, String idempotencyKey) {
        Conversation conversation = conversationRepository.lockById(conversationId)
            .orElseThrow(() -> NotFoundException.conversation(conversationId));
        if (!conversation.hasParticipant(senderId)) {
            throw new AuthorizationException(
                "User " + senderId + " is not a participant of conversation " + conversationId);
        }

        Optional<Message> existing = messageRepository
            .findByConversationIdAndSenderIdAndIdempotencyKey(conversationId, senderId, idempotencyKey);
        if (existing.isPresent()) {
            return new AppendOutcome(existing.get(), conversation.getVersion(), true);
        }

        Instant createdAt = nextMessageTimestamp(conversation);
        Message message = messageRepository.saveAndFlush(Message.builder()
            .conversationId(conversationId)
            .senderId(senderId)
            .recipientId(conversation.otherParticipant(senderId))
            .body(body)
            .idempotencyKey(idempotencyKey)
            .createdAt(createdAt)
            .build());

        conversation.setLastMessageAt(createdAt);
        conversation.setUpdatedAt(createdAt);
        Conversation saved = conversationRepository.saveAndFlush(conversation);

        return new AppendOutcome(message, saved.getVersion(), false);
    }

    /**
     * Set read_at on every unread message in the conversation not sent by the
     * reader. Repeated and concurrent calls never count a message twice.
     *
     * @return number of messages this call transitioned to read
     */
    public int markRead(String conversationId, String readerId) {
        ReadOutcome outcome = transactionTemplate.execute(status -> {
            Conversation conversation = conversationRepository.lockById(conversationId)
                .orElseThrow(() -> NotFoundException.conversation(conversationId));
            if (!conversation.hasParticipant(readerId)) {
                throw new AuthorizationException(
                    "User " + readerId + " is not a participant of conversation " + conversationId);
            }
            String otherParticipant = conversation.otherParticipant(readerId);
            long sequence = conversation.getVersion();

            Instant readAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
            int updated = messageRepository.markRead(conversationId, readerId, readAt);

            if (updated > 0) {
                // The bulk update cleared the persistence context; reload the locked row
                Conversation current = conversationRepository.findById(conversationId)
                    .orElseThrow(() -> NotFoundException.conversation(conversationId));
                current.setLastReadAt(readAt);
                sequence = conversationRepository.saveAndFlush(current).getVersion();
            }
            return new ReadOutcome(updated, sequence, readAt, otherParticipant);
        });

        unreadAggregator.invalidate(readerId);
        metricsService.recordMessagesRead(conversationId, outcome.updated);

        if (outcome.updated > 0) {
            realtimeBus.publish(RealtimeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(RealtimeEvent.Type.MESSAGE_READ)
                .conversationId(conversationId)
                .participantIds(List.of(readerId, outcome.otherParticipant))
                .sequence(outcome.sequence)
                .actorId(readerId)
                .affectedCount(outcome.updated)
                .occurredAt(outcome.readAt)
                .build());
            eventPublisher.ifAvailable(publisher ->
                publisher.publishMessagesRead(conversationId, readerId, outcome.updated, outcome.readAt));
            log.info("Messages marked read: conversationId={}, readerId={}, count={}",
                conversationId, readerId, outcome.updated);
        }

        return outcome.updated;
    }

    /**
     * The latest messages of a conversation in ascending (created_at, id) order
     */
    public List<Message> recentMessages(String conversationId, String requesterId, int limit) {
        Conversation conversation = conversationRepository.findById(conversationId)
            .orElseThrow(() -> NotFoundException.conversation(conversationId));
        if (!conversation.hasParticipant(requesterId)) {
            throw new AuthorizationException(
                "User " + requesterId + " is not a participant of conversation " + conversationId);
        }

        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        List<Message> newestFirst = messageRepository
            .findByConversationIdOrderByCreatedAtDescIdDesc(conversationId, PageRequest.of(0, pageSize));
        List<Message> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    // Strictly after the previous message so (created_at, id) order matches append order
    private Instant nextMessageTimestamp(Conversation conversation) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Instant previous = conversation.getLastMessageAt();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    private static final class AppendOutcome {
        private final Message message;
        private final long sequence;
        private final boolean replayed;

        private AppendOutcome(Message message, long sequence, boolean replayed) {
            this.message = message;
            this.sequence = sequence;
            this.replayed = replayed;
        }
    }

    private static final class ReadOutcome {
        private final int updated;
        private final long sequence;
        private final Instant readAt;
        private final String otherParticipant;

        private ReadOutcome(int updated, long sequence, Instant readAt, String otherParticipant) {
            this.updated = updated;
            this.sequence = sequence;
            this.readAt = readAt;
            this.otherParticipant = otherParticipant;
        }
    }
}
