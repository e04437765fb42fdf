package com.demo.messaging.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientSyncSettings {

    static final Duration MIN_POLL_INTERVAL = Duration.ofSeconds(10);
    static final Duration MAX_POLL_INTERVAL = Duration.ofSeconds(30);

    @Builder.Default
    private Duration unreadTtl = Duration.ofSeconds(5);

    @Builder.Default
    private Duration conversationsTtl = Duration.ofSeconds(30);

    // Clamped to 10-30s
    @Builder.Default
    private Duration pollInterval = Duration.ofSeconds(15);

    // Remembered event ids for duplicate suppression
    @Builder.Default
    private int seenEventCapacity = 1024;

    public static ClientSyncSettings defaults() {
        return ClientSyncSettings.builder().build();
    }

    Duration effectivePollInterval() {
        if (pollInterval.compareTo(MIN_POLL_INTERVAL) < 0) {
            return MIN_POLL_INTERVAL;
        }
        if (pollInterval.compareTo(MAX_POLL_INTERVAL) > 0) {
            return MAX_POLL_INTERVAL;
        }
        return pollInterval;
    }
}
