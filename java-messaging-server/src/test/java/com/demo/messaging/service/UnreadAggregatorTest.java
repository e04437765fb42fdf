package com.demo.messaging.service;

import com.demo.messaging.cache.RequestCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnreadAggregatorTest {

    @Mock
    private UnreadCountSource source;

    private UnreadAggregator aggregator;

    @BeforeEach
    void setUp() {
        lenient().when(source.strategy()).thenReturn("live");
        aggregator = new UnreadAggregator(new RequestCache(Duration.ofSeconds(5)), source, Runnable::run, 60_000);
    }

    @Test
    void repeatedReadsWithinTtlHitTheSourceOnce() {
        when(source.count("bob")).thenReturn(3L);

        assertThat(aggregator.get("bob").join()).isEqualTo(3);
        assertThat(aggregator.get("bob").join()).isEqualTo(3);

        verify(source, times(1)).count("bob");
    }

    @Test
    void invalidationForcesARecountAndRefreshesTheSource() {
        when(source.count("bob")).thenReturn(3L, 1L);

        assertThat(aggregator.get("bob").join()).isEqualTo(3);
        aggregator.invalidate("bob");

        assertThat(aggregator.get("bob").join()).isEqualTo(1);
        verify(source).refresh("bob");
        verify(source, times(2)).count("bob");
    }

    @Test
    void refreshFailureDoesNotFailTheWrite() {
        doThrow(new IllegalStateException("snapshot unavailable")).when(source).refresh("bob");
        when(source.count("bob")).thenReturn(2L);

        aggregator.invalidate("bob");

        assertThat(aggregator.get("bob").join()).isEqualTo(2);
    }

    @Test
    void countIsNeverNegative() {
        when(source.count("bob")).thenReturn(-4L);

        assertThat(aggregator.get("bob").join()).isZero();
    }

    @Test
    void usersAreCachedIndependently() {
        when(source.count("alice")).thenReturn(1L);
        when(source.count("bob")).thenReturn(5L);

        assertThat(aggregator.get("alice").join()).isEqualTo(1);
        assertThat(aggregator.get("bob").join()).isEqualTo(5);

        aggregator.invalidate("alice");
        aggregator.get("bob").join();
        verify(source, times(1)).count("bob");
    }
}
