package com.demo.messaging.client;

import com.demo.messaging.domain.ConversationPage;
import com.demo.messaging.domain.Message;
import com.demo.messaging.exception.AuthenticationException;
import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.MessagingException;
import com.demo.messaging.exception.NotFoundException;
import com.demo.messaging.exception.TransientException;
import com.demo.messaging.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link MessagingGateway} over the server's REST API.
 *
 * The caller is identified by the bearer token; user id arguments naming the
 * caller are not sent. HTTP errors are mapped back to the messaging exception
 * taxonomy so {@link RetryExecutor} can tell transient failures apart.
 */
@Slf4j
public class RestMessagingGateway implements MessagingGateway {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final Supplier<String> tokenSupplier;
    private final Executor executor;
    private final ObjectMapper objectMapper;

    public RestMessagingGateway(RestTemplate restTemplate,
                                String baseUrl,
                                Supplier<String> tokenSupplier,
                                Executor executor,
                                ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tokenSupplier = tokenSupplier;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    /**
     * Gateway with its own RestTemplate using the given timeouts
     */
    public static RestMessagingGateway create(String baseUrl,
                                              Supplier<String> tokenSupplier,
                                              Executor executor,
                                              Duration connectTimeout,
                                              Duration readTimeout) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.getMessageConverters().add(0, new MappingJackson2HttpMessageConverter(mapper));

        return new RestMessagingGateway(restTemplate, baseUrl, tokenSupplier, executor, mapper);
    }

    @Override
    public CompletableFuture<String> createOrGetConversation(String userA, String userB) {
        return call("createOrGetConversation", () -> {
            JsonNode response = exchange(HttpMethod.POST, baseUrl + "/api/conversations",
                Map.of("participantId", userB), JsonNode.class);
            return response.path("conversationId").asText();
        });
    }

    @Override
    public CompletableFuture<ConversationPage> listConversations(String userId, String cursor) {
        return call("listConversations", () -> {
            UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/api/conversations");
            if (cursor != null) {
                uri.queryParam("cursor", cursor);
            }
            return exchange(HttpMethod.GET, uri.toUriString(), null, ConversationPage.class);
        });
    }

    @Override
    public CompletableFuture<Message> sendMessage(String conversationId, String senderId, String body, String idempotencyKey) {
        return call("sendMessage", () -> exchange(HttpMethod.POST,
            baseUrl + "/api/conversations/" + conversationId + "/messages",
            Map.of("body", body, "idempotencyKey", idempotencyKey),
            Message.class));
    }

    @Override
    public CompletableFuture<Integer> markConversationRead(String conversationId, String readerId) {
        return call("markConversationRead", () -> {
            JsonNode response = exchange(HttpMethod.POST,
                baseUrl + "/api/conversations/" + conversationId + "/read", null, JsonNode.class);
            return response.path("updated").asInt();
        });
    }

    @Override
    public CompletableFuture<Integer> getUnreadCount(String userId) {
        return call("getUnreadCount", () -> {
            JsonNode response = exchange(HttpMethod.GET, baseUrl + "/api/unread-count", null, JsonNode.class);
            return response.path("count").asInt();
        });
    }

    private <T> CompletableFuture<T> call(String operation, Supplier<T> request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return request.get();
            } catch (HttpStatusCodeException e) {
                throw translate(operation, e);
            } catch (RestClientException e) {
                throw new TransientException(operation + " failed: " + e.getMessage(), e);
            }
        }, executor);
    }

    private <T> T exchange(HttpMethod method, String url, Object body, Class<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenSupplier.get());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), responseType).getBody();
    }

    private MessagingException translate(String operation, HttpStatusCodeException e) {
        String detail = errorDetail(e);
        int status = e.getStatusCode().value();
        log.debug("{} returned HTTP {}: {}", operation, status, detail);

        switch (status) {
            case 400:
            case 413:
            case 422:
                return new ValidationException(detail);
            case 401:
                return new AuthenticationException(detail);
            case 403:
                return new AuthorizationException(detail);
            case 404:
            case 410:
                return new NotFoundException(detail);
            default:
                return new TransientException(operation + " failed with HTTP " + status + ": " + detail, e);
        }
    }

    private String errorDetail(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body.isEmpty()) {
            return e.getStatusText();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.hasNonNull("detail")) {
                return node.get("detail").asText();
            }
        } catch (Exception parseError) {
            log.debug("Error body is not JSON: {}", body);
        }
        return body;
    }
}
