package com.demo.messaging.cache;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Cache key conventions shared by server and client.
 *
 * Keys are "resource?k1=v1&k2=v2" with parameters sorted by name, so the same
 * logical request always maps to the same key.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String generate(String resource, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return resource;
        }
        StringJoiner query = new StringJoiner("&", resource + "?", "");
        query.setEmptyValue(resource);
        new TreeMap<>(params).forEach((name, value) -> {
            if (value != null) {
                query.add(name + "=" + value);
            }
        });
        return query.toString();
    }

    public static String unreadCount(String userId) {
        return "unread-count:" + userId;
    }

    public static String conversations(String userId, String cursor) {
        return generate("conversations:" + userId, cursor == null ? Map.of() : Map.of("cursor", cursor));
    }

    /**
     * Matches every page of one user's conversation list
     */
    public static Pattern conversationsPattern(String userId) {
        return Pattern.compile(Pattern.quote("conversations:" + userId) + "(\\?.*)?");
    }
}
