package com.demo.messaging.service;

import com.demo.messaging.config.ClockConfig;
import com.demo.messaging.domain.Message;
import com.demo.messaging.infrastructure.RealtimeBus;
import com.demo.messaging.repository.MessageRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs without a test transaction so each call commits and the row locks
 * are contended for real.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({MessageStore.class, ConversationStore.class, MessageBodyValidator.class, MetricsService.class, ClockConfig.class})
class MessageStoreConcurrencyTest {

    @Autowired
    private MessageStore messageStore;

    @Autowired
    private ConversationStore conversationStore;

    @Autowired
    private MessageRepository messageRepository;

    @MockBean
    private RealtimeBus realtimeBus;

    @MockBean
    private UnreadAggregator unreadAggregator;

    private ExecutorService pool;
    private String sender;
    private String reader;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        sender = "sender-" + UUID.randomUUID();
        reader = "reader-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void concurrentReadsNeverCountAMessageTwice() throws Exception {
        String conversationId = conversationStore.getOrCreate(sender, reader).getId();
        for (int i = 0; i < 5; i++) {
            messageStore.append(conversationId, sender, "message " + i, "key-" + i);
        }

        List<Integer> results = race(() -> messageStore.markRead(conversationId, reader));

        assertThat(results.get(0) + results.get(1)).isEqualTo(5);
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull(reader)).isZero();
    }

    @Test
    void concurrentDuplicateSendsPersistOnce() throws Exception {
        String conversationId = conversationStore.getOrCreate(sender, reader).getId();

        List<Message> results = race(() -> messageStore.append(conversationId, sender, "hello", "same-key"));

        assertThat(results.get(0).getId()).isEqualTo(results.get(1).getId());
        assertThat(messageRepository.countByConversationId(conversationId)).isEqualTo(1);
        assertThat(messageRepository.countByRecipientIdAndReadAtIsNull(reader)).isEqualTo(1);
    }

    private <T> List<T> race(Callable<T> call) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return call.call();
            }));
        }
        start.countDown();

        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(15, TimeUnit.SECONDS));
        }
        return results;
    }
}
