package com.demo.messaging.client;

import com.demo.messaging.cache.CacheKeys;
import com.demo.messaging.cache.RequestCache;
import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.ConversationSummary;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.RealtimeEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-session sync state for one signed-in user.
 *
 * Applies optimistic changes immediately and reconciles them with the
 * server:
 * - Sends are shown as SENT in the same tick and move forward as the server
 *   confirms them; exhausted retries end in FAILED with a retry affordance
 * - Reads zero the conversation's unread count at once; the decrement is a
 *   pending delta keyed by a correlation id that is rolled back on failure and
 *   discarded once an authoritative count fetched after the server applied
 *   the read arrives
 * - A second read of the same conversation supersedes the first; the first
 *   request's response is ignored when it arrives
 * - Pushed events invalidate cached reads and refetch only when local state
 *   does not already account for them
 * - Periodic polling through the cache covers missed pushes
 *
 * All state is confined to the event loop executor. Public methods other than
 * {@link #onRemoteEvent} must be called on it.
 */
@Slf4j
public class ClientSyncController implements AutoCloseable {

    private final String userId;
    private final MessagingGateway gateway;
    private final RetryExecutor retryExecutor;
    private final RequestCache cache;
    private final Executor eventLoop;
    private final ScheduledExecutorService scheduler;
    private final ClientSyncSettings settings;
    private final Clock clock;
    private final List<ClientSyncListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, OutgoingMessage> outgoing = new LinkedHashMap<>();
    private final Map<String, PendingDelta> pendingUnreadDeltas = new LinkedHashMap<>();
    private final Map<String, Integer> conversationUnread = new HashMap<>();
    private final Map<String, ReadRequest> latestRead = new HashMap<>();
    private final Set<String> seenEventIds;

    private long lastIssuedToken;
    private long lastAppliedFetchToken;
    private int authoritativeUnread;
    private Integer lastNotifiedUnread;
    private ConversationPage conversations = ConversationPage.empty();
    private ScheduledFuture<?> pollTask;

    public ClientSyncController(String userId,
                                MessagingGateway gateway,
                                RetryExecutor retryExecutor,
                                RequestCache cache,
                                Executor eventLoop,
                                ScheduledExecutorService scheduler,
                                ClientSyncSettings settings,
                                Clock clock) {
        this.userId = userId;
        this.gateway = gateway;
        this.retryExecutor = retryExecutor;
        this.cache = cache;
        this.eventLoop = eventLoop;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;

        int capacity = settings.getSeenEventCapacity();
        this.seenEventIds = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    public void addListener(ClientSyncListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ClientSyncListener listener) {
        listeners.remove(listener);
    }

    /**
     * Load the initial state and start the polling fallback
     */
    public synchronized void start() {
        if (pollTask != null) {
            return;
        }
        long intervalMs = settings.effectivePollInterval().toMillis();
        pollTask = scheduler.scheduleAtFixedRate(
            () -> eventLoop.execute(this::poll), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        eventLoop.execute(this::poll);
        log.info("Client sync started: userId={}, pollInterval={}ms", userId, intervalMs);
    }

    @Override
    public synchronized void close() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
            log.info("Client sync stopped: userId={}", userId);
        }
    }

    // ===== Send =====

    /**
     * Show the message as SENT immediately and append it in the background
     */
    public OutgoingMessage send(String conversationId, String body) {
        OutgoingMessage message = new OutgoingMessage(
            UUID.randomUUID().toString(), conversationId, userId, body, clock.instant());
        outgoing.put(message.getCorrelationId(), message);
        notifyMessageState(message);
        submit(message);
        return message;
    }

    /**
     * Resubmit a FAILED message with its original idempotency key
     *
     * @return false if the message is unknown or not FAILED
     */
    public boolean retry(String correlationId) {
        OutgoingMessage message = outgoing.get(correlationId);
        if (message == null || !message.resetForRetry()) {
            return false;
        }
        notifyMessageState(message);
        submit(message);
        return true;
    }

    private void submit(OutgoingMessage message) {
        message.recordSubmission();
        retryExecutor.execute("sendMessage",
                () -> gateway.sendMessage(message.getConversationId(), userId, message.getBody(), message.getIdempotencyKey()))
            .whenCompleteAsync((persisted, error) -> onSendCompleted(message, persisted, error), eventLoop);
    }

    private void onSendCompleted(OutgoingMessage message, Message persisted, Throwable error) {
        if (error != null) {
            Throwable cause = RetryExecutor.unwrap(error);
            log.warn("Send failed: correlationId={}, error={}", message.getCorrelationId(), cause.toString());
            if (message.markFailed(cause)) {
                notifyMessageState(message);
            }
            notifyError("sendMessage", cause);
            return;
        }

        if (message.markPersisted(persisted)) {
            notifyMessageState(message);
        }
        cache.invalidate(CacheKeys.conversationsPattern(userId));
    }

    // ===== Read =====

    /**
     * Zero the conversation's unread count locally and mark it read on the server.
     *
     * The optimistic decrement uses the count from the last fetched first page.
     * For a conversation that page does not contain, nothing is subtracted
     * up front and the badge settles on the count fetched after the server
     * confirms the read.
     */
    public void markRead(String conversationId) {
        long token = ++lastIssuedToken;
        String correlationId = UUID.randomUUID().toString();

        int visibleUnread = conversationUnread.getOrDefault(conversationId, 0);
        int delta = -visibleUnread;
        int previousUnread = visibleUnread;

        ReadRequest superseded = latestRead.get(conversationId);
        if (superseded != null) {
            // Take over the superseded request's decrement so it is applied once
            PendingDelta taken = pendingUnreadDeltas.remove(superseded.correlationId);
            if (taken != null) {
                delta += taken.delta;
            }
            previousUnread += superseded.previousUnread;
            log.debug("markRead superseded: conversationId={}, oldToken={}, newToken={}",
                conversationId, superseded.token, token);
        }

        ReadRequest request = new ReadRequest(token, correlationId, conversationId, previousUnread);
        latestRead.put(conversationId, request);
        pendingUnreadDeltas.put(correlationId, new PendingDelta(conversationId, delta));
        conversationUnread.put(conversationId, 0);
        notifyUnread();

        retryExecutor.execute("markConversationRead", () -> gateway.markConversationRead(conversationId, userId))
            .whenCompleteAsync((updated, error) -> onReadCompleted(request, updated, error), eventLoop);
    }

    private void onReadCompleted(ReadRequest request, Integer updated, Throwable error) {
        ReadRequest latest = latestRead.get(request.conversationId);
        if (latest == null || latest.token != request.token) {
            log.debug("Discarding stale markRead response: conversationId={}, token={}",
                request.conversationId, request.token);
            return;
        }
        latestRead.remove(request.conversationId);

        if (error != null) {
            Throwable cause = RetryExecutor.unwrap(error);
            log.warn("markRead failed, rolling back: conversationId={}, error={}",
                request.conversationId, cause.toString());
            pendingUnreadDeltas.remove(request.correlationId);
            conversationUnread.put(request.conversationId, request.previousUnread);
            notifyUnread();
            notifyError("markConversationRead", cause);
            return;
        }

        log.debug("markRead applied: conversationId={}, updated={}", request.conversationId, updated);
        PendingDelta delta = pendingUnreadDeltas.get(request.correlationId);
        if (delta != null) {
            // Any count fetched from here on already reflects this read
            delta.discardFrom = lastIssuedToken + 1;
        }
        cache.invalidate(CacheKeys.unreadCount(userId));
        cache.invalidate(CacheKeys.conversationsPattern(userId));
        refreshUnreadCount();
    }

    // ===== Authoritative reads =====

    public void refreshUnreadCount() {
        long token = ++lastIssuedToken;
        cache.dedupe(CacheKeys.unreadCount(userId), Integer.class, () -> gateway.getUnreadCount(userId), settings.getUnreadTtl())
            .whenCompleteAsync((count, error) -> applyUnreadCount(token, count, error), eventLoop);
    }

    private void applyUnreadCount(long token, Integer count, Throwable error) {
        if (error != null) {
            // Badge keeps its last value
            notifyError("getUnreadCount", RetryExecutor.unwrap(error));
            return;
        }
        if (token <= lastAppliedFetchToken) {
            log.debug("Ignoring out-of-order unread count: token={}, lastApplied={}", token, lastAppliedFetchToken);
            return;
        }
        lastAppliedFetchToken = token;
        authoritativeUnread = Math.max(0, count != null ? count : 0);
        pendingUnreadDeltas.values().removeIf(delta -> delta.discardFrom <= token);
        notifyUnread();
    }

    public void refreshConversations() {
        cache.dedupe(CacheKeys.conversations(userId, null), ConversationPage.class,
                () -> gateway.listConversations(userId, null),
                settings.getConversationsTtl())
            .whenCompleteAsync(this::applyConversations, eventLoop);
    }

    private void applyConversations(ConversationPage page, Throwable error) {
        if (error != null) {
            notifyError("listConversations", RetryExecutor.unwrap(error));
            return;
        }
        for (ConversationSummary summary : page.getItems()) {
            if (!hasPendingRead(summary.getConversationId())) {
                conversationUnread.put(summary.getConversationId(), summary.getUnreadCount());
            }
            if (summary.getLastMessageAt() != null) {
                confirmDelivered(summary.getConversationId(), summary.getLastMessageAt());
            }
        }
        conversations = page;
        for (ClientSyncListener listener : listeners) {
            listener.onConversationsChanged(page);
        }
    }

    void poll() {
        refreshUnreadCount();
        refreshConversations();
    }

    // ===== Remote events =====

    /**
     * Entry point for pushed events; safe to call from any thread
     */
    public void onRemoteEvent(RealtimeEvent event) {
        eventLoop.execute(() -> handleRemoteEvent(event));
    }

    private void handleRemoteEvent(RealtimeEvent event) {
        if (event.getEventId() != null && !seenEventIds.add(event.getEventId())) {
            log.debug("Duplicate event ignored: eventId={}", event.getEventId());
            return;
        }

        switch (event.getType()) {
            case MESSAGE_INSERTED -> onMessageInserted(event);
            case MESSAGE_READ -> onMessageRead(event);
            case CONVERSATION_CREATED -> {
                cache.invalidate(CacheKeys.conversationsPattern(userId));
                refreshConversations();
            }
        }
    }

    private void onMessageInserted(RealtimeEvent event) {
        if (userId.equals(event.getActorId())) {
            OutgoingMessage own = event.getIdempotencyKey() != null ? outgoing.get(event.getIdempotencyKey()) : null;
            if (own != null) {
                Instant createdAt = event.getMessage() != null ? event.getMessage().getCreatedAt() : event.getOccurredAt();
                if (own.markDelivered(event.getMessageId(), createdAt)) {
                    notifyMessageState(own);
                }
                cache.invalidate(CacheKeys.conversationsPattern(userId));
                return;
            }
            // Sent from another session of this user
            cache.invalidate(CacheKeys.conversationsPattern(userId));
            refreshConversations();
            return;
        }

        // A later message in the same conversation means ours were committed before it
        Instant insertedAt = event.getMessage() != null ? event.getMessage().getCreatedAt() : event.getOccurredAt();
        if (insertedAt != null) {
            confirmDelivered(event.getConversationId(), insertedAt);
        }

        cache.invalidate(CacheKeys.unreadCount(userId));
        cache.invalidate(CacheKeys.conversationsPattern(userId));
        refreshUnreadCount();
        refreshConversations();
    }

    private void onMessageRead(RealtimeEvent event) {
        if (userId.equals(event.getActorId())) {
            if (hasPendingRead(event.getConversationId())) {
                log.debug("Own read already applied locally: conversationId={}", event.getConversationId());
                cache.invalidate(CacheKeys.unreadCount(userId));
                return;
            }
            // Read from another session of this user
            cache.invalidate(CacheKeys.unreadCount(userId));
            cache.invalidate(CacheKeys.conversationsPattern(userId));
            refreshUnreadCount();
            refreshConversations();
            return;
        }

        Instant readAt = event.getOccurredAt();
        for (OutgoingMessage message : outgoing.values()) {
            if (!message.getConversationId().equals(event.getConversationId())
                    || message.getServerCreatedAt() == null
                    || (readAt != null && message.getServerCreatedAt().isAfter(readAt))) {
                continue;
            }
            if (message.markRead()) {
                notifyMessageState(message);
            }
        }
    }

    /**
     * Advance PERSISTED messages of the conversation committed no later than
     * upTo. Covers echoes the bus dropped as out of order or never delivered.
     */
    private void confirmDelivered(String conversationId, Instant upTo) {
        for (OutgoingMessage message : outgoing.values()) {
            if (message.getState() != DeliveryState.PERSISTED
                    || !message.getConversationId().equals(conversationId)
                    || message.getServerCreatedAt() == null
                    || message.getServerCreatedAt().isAfter(upTo)) {
                continue;
            }
            if (message.markDelivered(message.getServerId(), message.getServerCreatedAt())) {
                notifyMessageState(message);
            }
        }
    }

    // ===== State =====

    /**
     * Badge value: authoritative count plus pending optimistic deltas, never negative
     */
    public int getUnreadCount() {
        int pending = 0;
        for (PendingDelta delta : pendingUnreadDeltas.values()) {
            pending += delta.delta;
        }
        return Math.max(0, authoritativeUnread + pending);
    }

    public int getConversationUnread(String conversationId) {
        return conversationUnread.getOrDefault(conversationId, 0);
    }

    public Optional<OutgoingMessage> getOutgoing(String correlationId) {
        return Optional.ofNullable(outgoing.get(correlationId));
    }

    public ConversationPage getConversations() {
        return conversations;
    }

    int pendingDeltaCount() {
        return pendingUnreadDeltas.size();
    }

    private boolean hasPendingRead(String conversationId) {
        if (latestRead.containsKey(conversationId)) {
            return true;
        }
        for (PendingDelta delta : pendingUnreadDeltas.values()) {
            if (delta.conversationId.equals(conversationId)) {
                return true;
            }
        }
        return false;
    }

    private void notifyUnread() {
        int displayed = getUnreadCount();
        if (lastNotifiedUnread != null && lastNotifiedUnread == displayed) {
            return;
        }
        lastNotifiedUnread = displayed;
        for (ClientSyncListener listener : listeners) {
            listener.onUnreadCountChanged(displayed);
        }
    }

    private void notifyMessageState(OutgoingMessage message) {
        for (ClientSyncListener listener : listeners) {
            listener.onMessageStateChanged(message);
        }
    }

    private void notifyError(String operation, Throwable error) {
        for (ClientSyncListener listener : listeners) {
            listener.onSyncError(operation, error);
        }
    }

    private static final class PendingDelta {
        private final String conversationId;
        private final int delta;
        // Token of the first fetch allowed to discard this delta; unset while the command is in flight
        private long discardFrom = Long.MAX_VALUE;

        private PendingDelta(String conversationId, int delta) {
            this.conversationId = conversationId;
            this.delta = delta;
        }
    }

    private static final class ReadRequest {
        private final long token;
        private final String correlationId;
        private final String conversationId;
        private final int previousUnread;

        private ReadRequest(long token, String correlationId, String conversationId, int previousUnread) {
            this.token = token;
            this.correlationId = correlationId;
            this.conversationId = conversationId;
            this.previousUnread = previousUnread;
        }
    }
}
