package com.demo.messaging.controller;

import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.CreateConversationRequest;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.SendMessageRequest;
import com.demo.messaging.service.IdentityTokenValidator;
import com.demo.messaging.service.MessagingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST surface of the messaging core. The caller is always the subject of
 * the bearer token, so users can only send, read and count as themselves.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class MessagingController {

    private final MessagingService messagingService;
    private final IdentityTokenValidator identityTokenValidator;

    public MessagingController(MessagingService messagingService,
                               IdentityTokenValidator identityTokenValidator) {
        this.messagingService = messagingService;
        this.identityTokenValidator = identityTokenValidator;
    }

    @PostMapping("/conversations")
    public CompletableFuture<Map<String, String>> createConversation(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody CreateConversationRequest request) {
        String callerId = identityTokenValidator.authenticate(authorization);
        return messagingService.createOrGetConversation(callerId, request.getParticipantId())
            .thenApply(conversationId -> Map.of("conversationId", conversationId));
    }

    @GetMapping("/conversations")
    public CompletableFuture<ConversationPage> listConversations(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) String cursor) {
        String callerId = identityTokenValidator.authenticate(authorization);
        return messagingService.listConversations(callerId, cursor);
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public CompletableFuture<List<Message>> recentMessages(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String conversationId,
            @RequestParam(defaultValue = "50") int limit) {
        String callerId = identityTokenValidator.authenticate(authorization);
        return messagingService.recentMessages(conversationId, callerId, limit);
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public CompletableFuture<Message> sendMessage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String conversationId,
            @RequestBody SendMessageRequest request) {
        String callerId = identityTokenValidator.authenticate(authorization);
        log.debug("Send requested: conversationId={}, senderId={}, idempotencyKey={}",
            conversationId, callerId, request.getIdempotencyKey());
        return messagingService.sendMessage(conversationId, callerId, request.getBody(), request.getIdempotencyKey());
    }

    @PostMapping("/conversations/{conversationId}/read")
    public CompletableFuture<Map<String, Integer>> markRead(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String conversationId) {
        String callerId = identityTokenValidator.authenticate(authorization);
        return messagingService.markConversationRead(conversationId, callerId)
            .thenApply(updated -> Map.of("updated", updated));
    }

    @GetMapping("/unread-count")
    public CompletableFuture<Map<String, Integer>> unreadCount(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String callerId = identityTokenValidator.authenticate(authorization);
        return messagingService.getUnreadCount(callerId)
            .thenApply(count -> Map.of("count", count));
    }
}
