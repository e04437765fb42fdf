package com.demo.messaging.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-level change pushed to subscribed participants.
 *
 * sequence is the conversation version after the change; it is strictly
 * increasing per conversation and lets receivers drop duplicates and stale
 * deliveries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEvent {
    private String eventId;
    private Type type;
    private String conversationId;

    @Builder.Default
    private List<String> participantIds = new ArrayList<>();

    private long sequence;

    // sender for message_inserted, reader for message_read, creator for conversation_created
    private String actorId;
    private String messageId;
    private String idempotencyKey;
    private int affectedCount;
    private Instant occurredAt;
    private Message message;

    public enum Type {
        MESSAGE_INSERTED("message_inserted"),
        MESSAGE_READ("message_read"),
        CONVERSATION_CREATED("conversation_created");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Type fromWireName(String value) {
            for (Type type : values()) {
                if (type.wireName.equals(value) || type.name().equals(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown realtime event type: " + value);
        }
    }
}
