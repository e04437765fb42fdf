package com.demo.messaging.service;

import com.demo.messaging.domain.Conversation;
import com.demo.messaging.domain.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes messaging domain events to Kafka for audit and analytics.
 *
 * Optional; enable with spring.kafka.enabled=true. Events are keyed by
 * conversation id so one conversation stays on one partition.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.messaging-events:messaging-events}")
    private String messagingEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishConversationCreated(Conversation conversation, String createdBy) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "CONVERSATION_CREATED");
        event.put("timestamp", Instant.now().toString());
        event.put("conversationId", conversation.getId());
        event.put("participantAId", conversation.getParticipantAId());
        event.put("participantBId", conversation.getParticipantBId());
        event.put("createdBy", createdBy);

        publishEvent(conversation.getId(), event, "CONVERSATION_CREATED");
    }

    public void publishMessageSent(Message message, long sequence) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "MESSAGE_SENT");
        event.put("timestamp", Instant.now().toString());
        event.put("messageId", message.getId());
        event.put("conversationId", message.getConversationId());
        event.put("senderId", message.getSenderId());
        event.put("recipientId", message.getRecipientId());
        event.put("createdAt", message.getCreatedAt().toString());
        event.put("bodyLength", message.getBody().codePointCount(0, message.getBody().length()));
        event.put("sequence", sequence);

        publishEvent(message.getConversationId(), event, "MESSAGE_SENT");
    }

    public void publishMessagesRead(String conversationId, String readerId, int count, Instant readAt) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "MESSAGES_READ");
        event.put("timestamp", Instant.now().toString());
        event.put("conversationId", conversationId);
        event.put("readerId", readerId);
        event.put("count", count);
        event.put("readAt", readAt.toString());

        publishEvent(conversationId, event, "MESSAGES_READ");
    }

    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(messagingEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, messagingEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, messagingEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
