package com.demo.messaging.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Conversation row as seen by one participant, with the last message preview
 * and that participant's unread count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {
    private String conversationId;
    private String otherParticipantId;
    private String lastMessageBody;
    private String lastMessageSenderId;
    private Instant lastMessageAt;
    private int unreadCount;
    private Instant createdAt;
    private Instant updatedAt;
}
