package com.demo.messaging.infrastructure;

import com.demo.messaging.config.RedisConfig;
import com.demo.messaging.domain.RealtimeEvent;
import com.demo.messaging.service.MetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeBusTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    private ObjectMapper objectMapper;
    private MetricsService metricsService;
    private RealtimeBus bus;

    @BeforeEach
    void setUp() {
        objectMapper = new RedisConfig().objectMapper();
        metricsService = new MetricsService();
        bus = new RealtimeBus(redisTemplate, objectMapper, metricsService);
    }

    @Test
    void publishesToEveryParticipantChannel() throws Exception {
        when(redisTemplate.convertAndSend(anyString(), anyString())).thenReturn(1L);

        RealtimeEvent event = event("c1", 3);
        bus.publish(event);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("messaging:user:alice"), payload.capture());
        verify(redisTemplate).convertAndSend(eq("messaging:user:bob"), anyString());

        assertThat(event.getEventId()).isNotNull();
        assertThat(event.getOccurredAt()).isNotNull();
        assertThat(payload.getValue()).contains("\"type\":\"message_inserted\"");
        RealtimeEvent decoded = objectMapper.readValue(payload.getValue(), RealtimeEvent.class);
        assertThat(decoded.getSequence()).isEqualTo(3);
        assertThat(decoded.getType()).isEqualTo(RealtimeEvent.Type.MESSAGE_INSERTED);
    }

    @Test
    void publishFailureOnOneChannelStillReachesTheOther() {
        when(redisTemplate.convertAndSend(eq("messaging:user:alice"), anyString()))
            .thenThrow(new IllegalStateException("redis down"));
        when(redisTemplate.convertAndSend(eq("messaging:user:bob"), anyString())).thenReturn(1L);

        bus.publish(event("c1", 1));

        verify(redisTemplate).convertAndSend(eq("messaging:user:bob"), anyString());
        assertThat(metricsService.getCounterValue("errors.type=REALTIME_PUBLISH_ERROR")).isEqualTo(1);
    }

    @Test
    void deliversRedisMessagesToTheAddressedUser() throws Exception {
        List<RealtimeEvent> bobEvents = new CopyOnWriteArrayList<>();
        List<RealtimeEvent> aliceEvents = new CopyOnWriteArrayList<>();
        bus.subscribe("bob", bobEvents::add);
        bus.subscribe("alice", aliceEvents::add);

        String body = objectMapper.writeValueAsString(event("c1", 2));
        bus.onMessage(new DefaultMessage(
            "messaging:user:bob".getBytes(StandardCharsets.UTF_8),
            body.getBytes(StandardCharsets.UTF_8)), null);

        assertThat(bobEvents).hasSize(1);
        assertThat(bobEvents.get(0).getConversationId()).isEqualTo("c1");
        assertThat(aliceEvents).isEmpty();
    }

    @Test
    void dropsDuplicateAndStaleSequences() {
        List<Long> sequences = new ArrayList<>();
        bus.subscribe("bob", event -> sequences.add(event.getSequence()));

        bus.deliver("bob", event("c1", 2));
        bus.deliver("bob", event("c1", 2));
        bus.deliver("bob", event("c1", 1));
        bus.deliver("bob", event("c1", 3));
        bus.deliver("bob", event("c2", 1));

        assertThat(sequences).containsExactly(2L, 3L, 1L);
    }

    @Test
    void sequencesAreTrackedPerRecipient() {
        List<String> received = new ArrayList<>();
        bus.subscribe("alice", event -> received.add("alice"));
        bus.subscribe("bob", event -> received.add("bob"));

        bus.deliver("alice", event("c1", 5));
        bus.deliver("bob", event("c1", 5));

        assertThat(received).containsExactly("alice", "bob");
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<RealtimeEvent> received = new ArrayList<>();
        RealtimeSubscription subscription = bus.subscribe("bob", received::add);
        assertThat(bus.getSubscriberCount("bob")).isEqualTo(1);

        subscription.close();
        subscription.close();
        bus.deliver("bob", event("c1", 1));

        assertThat(received).isEmpty();
        assertThat(bus.getSubscriberCount("bob")).isZero();
    }

    @Test
    void nodeListenersSeeEveryDeliveredEvent() {
        List<String> seen = new ArrayList<>();
        RealtimeSubscription subscription = bus.subscribeAll((userId, event) -> seen.add(userId + ":" + event.getSequence()));

        bus.deliver("bob", event("c1", 1));
        bus.deliver("bob", event("c1", 1));
        subscription.close();
        bus.deliver("alice", event("c1", 2));

        assertThat(seen).containsExactly("bob:1");
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<RealtimeEvent> received = new ArrayList<>();
        bus.subscribe("bob", event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe("bob", received::add);

        bus.deliver("bob", event("c1", 1));

        assertThat(received).hasSize(1);
    }

    @Test
    void ignoresMalformedPayloads() {
        List<RealtimeEvent> received = new ArrayList<>();
        bus.subscribe("bob", received::add);

        bus.onMessage(new DefaultMessage(
            "messaging:user:bob".getBytes(StandardCharsets.UTF_8),
            "not json".getBytes(StandardCharsets.UTF_8)), null);

        assertThat(received).isEmpty();
        assertThat(metricsService.getCounterValue("errors.type=REALTIME_RECEIVE_ERROR")).isEqualTo(1);
    }

    private static RealtimeEvent event(String conversationId, long sequence) {
        return RealtimeEvent.builder()
            .type(RealtimeEvent.Type.MESSAGE_INSERTED)
            .conversationId(conversationId)
            .participantIds(List.of("alice", "bob"))
            .sequence(sequence)
            .actorId("alice")
            .affectedCount(1)
            .build();
    }
}
