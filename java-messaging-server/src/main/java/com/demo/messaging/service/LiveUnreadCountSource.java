package com.demo.messaging.service;

import com.demo.messaging.repository.MessageRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Indexed count over (recipient_id, read_at). Always current; cost grows with
 * the number of unread rows.
 */
@Component
@ConditionalOnProperty(name = "messaging.unread.strategy", havingValue = "live", matchIfMissing = true)
public class LiveUnreadCountSource implements UnreadCountSource {

    private final MessageRepository messageRepository;
    private final MetricsService metricsService;

    public LiveUnreadCountSource(MessageRepository messageRepository, MetricsService metricsService) {
        this.messageRepository = messageRepository;
        this.metricsService = metricsService;
    }

    @Override
    public long count(String userId) {
        MetricsService.TimerSample timer = metricsService.startTimer();
        long count = messageRepository.countByRecipientIdAndReadAtIsNull(userId);
        metricsService.recordUnreadQuery(strategy(), timer.stop());
        return count;
    }

    @Override
    public String strategy() {
        return "live";
    }
}
