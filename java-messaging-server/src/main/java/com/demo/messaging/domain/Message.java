package com.demo.messaging.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Append-only direct message.
 *
 * Never edited or deleted; the only mutation is the single readAt transition.
 */
@Entity
@Table(name = "messages",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_messages_idempotency",
            columnNames = {"conversation_id", "sender_id", "idempotency_key"})
    },
    indexes = {
        @Index(name = "idx_messages_read_state", columnList = "conversation_id,sender_id,read_at"),
        @Index(name = "idx_messages_recipient_unread", columnList = "recipient_id,read_at"),
        @Index(name = "idx_messages_conversation_order", columnList = "conversation_id,created_at,id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "conversation_id", nullable = false, length = 36)
    private String conversationId;

    @Column(name = "sender_id", nullable = false, length = 100)
    private String senderId;

    @Column(name = "recipient_id", nullable = false, length = 100)
    private String recipientId;

    @Column(nullable = false, length = 4000)
    private String body;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "idempotency_key", nullable = false, length = 100)
    private String idempotencyKey;

    public boolean isRead() {
        return readAt != null;
    }
}
