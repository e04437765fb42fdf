package com.demo.messaging.client;

import com.demo.messaging.domain.Message;
import lombok.Getter;

import java.time.Instant;

/**
 * Client-side view of one message this user sent.
 *
 * The correlation id doubles as the idempotency key, so a manual retry after
 * FAILED can never create a second server row. Instances are confined to the
 * sync controller's event loop.
 */
@Getter
public class OutgoingMessage {

    private final String correlationId;
    private final String conversationId;
    private final String senderId;
    private final String body;
    private final Instant createdLocallyAt;

    private DeliveryState state = DeliveryState.SENT;
    private String serverId;
    private Instant serverCreatedAt;
    private Throwable failure;
    private int submissions;

    public OutgoingMessage(String correlationId, String conversationId, String senderId, String body, Instant createdLocallyAt) {
        this.correlationId = correlationId;
        this.conversationId = conversationId;
        this.senderId = senderId;
        this.body = body;
        this.createdLocallyAt = createdLocallyAt;
    }

    public String getIdempotencyKey() {
        return correlationId;
    }

    /**
     * Adopt the server's id and timestamp. Also valid after an echo already
     * moved the message past PERSISTED.
     */
    boolean markPersisted(Message persisted) {
        if (state == DeliveryState.FAILED) {
            return false;
        }
        boolean changed = serverId == null || !serverId.equals(persisted.getId());
        serverId = persisted.getId();
        serverCreatedAt = persisted.getCreatedAt();
        return advance(DeliveryState.PERSISTED) || changed;
    }

    boolean markDelivered(String messageId, Instant createdAt) {
        if (messageId != null && serverId == null) {
            serverId = messageId;
            serverCreatedAt = createdAt;
        }
        return advance(DeliveryState.DELIVERED);
    }

    boolean markRead() {
        return advance(DeliveryState.READ);
    }

    boolean markFailed(Throwable cause) {
        if (state != DeliveryState.SENT) {
            return false;
        }
        state = DeliveryState.FAILED;
        failure = cause;
        return true;
    }

    boolean resetForRetry() {
        if (state != DeliveryState.FAILED) {
            return false;
        }
        state = DeliveryState.SENT;
        failure = null;
        return true;
    }

    void recordSubmission() {
        submissions++;
    }

    private boolean advance(DeliveryState target) {
        if (state == DeliveryState.FAILED || !state.isBefore(target)) {
            return false;
        }
        state = target;
        return true;
    }
}
