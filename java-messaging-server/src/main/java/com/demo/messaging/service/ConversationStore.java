package com.demo.messaging.service;

import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.ConversationSummary;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.NotFoundException;
import com.demo.messaging.exception.TransientException;
import com.demo.messaging.exception.ValidationException;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.repository.ConversationRepository;
import com.demo.messaging.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns two-party conversation identity.
 *
 * A pair of users maps to exactly one conversation: the pair is normalized
 * (smaller id first) and the table carries a unique constraint on it. A
 * concurrent creator that loses the insert race re-reads the winner's row.
 */
@Service
@Slf4j
public class ConversationStore {

    private static final String CURSOR_SEPARATOR = "|";

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final RealtimeBus realtimeBus;
    private final ObjectProvider<EventPublisher> eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;
    private final int pageSize;

    public ConversationStore(ConversationRepository conversationRepository,
                             MessageRepository messageRepository,
                             RealtimeBus realtimeBus,
                             ObjectProvider<EventPublisher> eventPublisher,
                             MetricsService metricsService,
                             Clock clock,
                             @Value("${messaging.conversations.page-size:50}") int pageSize) {
        this.conversationRepository = conversationRepository;
        this.messageRepository = messageRepository;
        this.realtimeBus = realtimeBus;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
        this.pageSize = pageSize;
    }

    /**
     * Return the conversation between the two users, creating it on first use.
     * Symmetric: getOrCreate(a, b) and getOrCreate(b, a) return the same row.
     */
    public Conversation getOrCreate(String userA, String userB) {
        requireUserId(userA);
        requireUserId(userB);
        if (userA.equals(userB)) {
            throw new ValidationException("A conversation needs two different participants");
        }

        String first = userA.compareTo(userB) < 0 ? userA : userB;
        String second = first.equals(userA) ? userB : userA;

        Optional<Conversation> existing = conversationRepository.findByParticipantAIdAndParticipantBId(first, second);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Conversation created;
        try {
            created = conversationRepository.saveAndFlush(Conversation.builder()
                .participantAId(first)
                .participantBId(second)
                .createdAt(now)
                .updatedAt(now)
                .build());
        } catch (DataIntegrityViolationException e) {
            log.info("Conversation created concurrently, re-reading: pair=({}, {})", first, second);
            return conversationRepository.findByParticipantAIdAndParticipantBId(first, second)
                .orElseThrow(() -> new TransientException(
                    "Conversation insert conflicted but no row is visible for (" + first + ", " + second + ")", e));
        }

        log.info("Conversation created: conversationId={}, participants=({}, {})", created.getId(), first, second);
        metricsService.recordConversationCreated(created.getId());

        realtimeBus.publish(RealtimeEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .type(RealtimeEvent.Type.CONVERSATION_CREATED)
            .conversationId(created.getId())
            .participantIds(List.of(first, second))
            .sequence(created.getVersion() != null ? created.getVersion() : 0L)
            .actorId(userA)
            .occurredAt(now)
            .build());
        eventPublisher.ifAvailable(publisher -> publisher.publishConversationCreated(created, userA));

        return created;
    }

    /**
     * Load a conversation the user participates in
     *
     * @throws NotFoundException if it does not exist
     * @throws AuthorizationException if the user is not a participant
     */
    public Conversation requireParticipant(String conversationId, String userId) {
        Conversation conversation = conversationRepository.findById(conversationId)
            .orElseThrow(() -> NotFoundException.conversation(conversationId));
        if (!conversation.hasParticipant(userId)) {
            throw new AuthorizationException(
                "User " + userId + " is not a participant of conversation " + conversationId);
        }
        return conversation;
    }

    /**
     * One page of the user's conversations, most recent activity first.
     *
     * @param cursor opaque cursor from a previous page's nextCursor, or null for the first page
     */
    public ConversationPage list(String userId, String cursor) {
        requireUserId(userId);

        PageRequest limit = PageRequest.of(0, pageSize + 1);
        List<Conversation> rows;
        if (cursor == null || cursor.isBlank()) {
            rows = conversationRepository.findRecentForUser(userId, limit);
        } else {
            CursorPosition position = decodeCursor(cursor);
            rows = conversationRepository.findRecentForUserBefore(userId, position.updatedAt, position.id, limit);
        }

        boolean hasMore = rows.size() > pageSize;
        List<Conversation> page = hasMore ? rows.subList(0, pageSize) : rows;
        if (page.isEmpty()) {
            return ConversationPage.empty();
        }

        Map<String, Integer> unreadByConversation = unreadCounts(userId, page);

        List<ConversationSummary> items = new ArrayList<>(page.size());
        for (Conversation conversation : page) {
            Optional<Message> last = messageRepository.findFirstByConversationIdOrderByCreatedAtDescIdDesc(conversation.getId());
            items.add(ConversationSummary.builder()
                .conversationId(conversation.getId())
                .otherParticipantId(conversation.otherParticipant(userId))
                .lastMessageBody(last.map(Message::getBody).orElse(null))
                .lastMessageSenderId(last.map(Message::getSenderId).orElse(null))
                .lastMessageAt(conversation.getLastMessageAt())
                .unreadCount(unreadByConversation.getOrDefault(conversation.getId(), 0))
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .build());
        }

        Conversation lastRow = page.get(page.size() - 1);
        return ConversationPage.builder()
            .items(items)
            .nextCursor(hasMore ? encodeCursor(lastRow) : null)
            .build();
    }

    private Map<String, Integer> unreadCounts(String userId, List<Conversation> page) {
        List<String> ids = page.stream().map(Conversation::getId).collect(Collectors.toList());
        Map<String, Integer> counts = new HashMap<>();
        for (Object[] row : messageRepository.countUnreadByConversation(userId, ids)) {
            counts.put((String) row[0], ((Number) row[1]).intValue());
        }
        return counts;
    }

    static String encodeCursor(Conversation conversation) {
        String raw = conversation.getUpdatedAt().toString() + CURSOR_SEPARATOR + conversation.getId();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    static CursorPosition decodeCursor(String cursor) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            int separator = raw.indexOf(CURSOR_SEPARATOR);
            if (separator <= 0 || separator == raw.length() - 1) {
                throw new ValidationException("Invalid conversation cursor");
            }
            return new CursorPosition(Instant.parse(raw.substring(0, separator)), raw.substring(separator + 1));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new ValidationException("Invalid conversation cursor");
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
    }

    static final class CursorPosition {
        final Instant updatedAt;
        final String id;

        CursorPosition(Instant updatedAt, String id) {
            this.updatedAt = updatedAt;
            this.id = id;
        }
    }
}
