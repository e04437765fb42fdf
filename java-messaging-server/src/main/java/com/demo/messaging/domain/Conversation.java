package com.demo.messaging.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Two-party conversation keyed by a normalized participant pair.
 *
 * participantAId is always the lexicographically smaller id, so a pair maps
 * to exactly one row regardless of who started the conversation.
 */
@Entity
@Table(name = "conversations",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_conversations_pair", columnNames = {"participant_a_id", "participant_b_id"})
    },
    indexes = {
        @Index(name = "idx_conversations_participant_a", columnList = "participant_a_id,updated_at"),
        @Index(name = "idx_conversations_participant_b", columnList = "participant_b_id,updated_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(name = "participant_a_id", nullable = false, length = 100)
    private String participantAId;

    @Column(name = "participant_b_id", nullable = false, length = 100)
    private String participantBId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "last_read_at")
    private Instant lastReadAt;

    // Bumped on every append and read transition; also the realtime event sequence
    @Version
    private Long version;

    public boolean hasParticipant(String userId) {
        return participantAId.equals(userId) || participantBId.equals(userId);
    }

    public String otherParticipant(String userId) {
        if (participantAId.equals(userId)) {
            return participantBId;
        }
        if (participantBId.equals(userId)) {
            return participantAId;
        }
        throw new IllegalArgumentException("User " + userId + " is not a participant of " + id);
    }
}
