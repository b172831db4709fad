package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.repository.ItemStore;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DailySummaryFireStoreTest {

    private static final String KEY = "pricewatch:summary:fired:42";
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    @Test
    void cachedDateIsServedWithoutDatabase() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        ItemStore itemStore = mock(ItemStore.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn("2026-03-02");

        DailySummaryFireStore store = new DailySummaryFireStore(redisTemplate, itemStore);

        assertThat(store.lastFireDate("42")).contains(TODAY);
        verifyNoInteractions(itemStore);
    }

    @Test
    void cacheMissReadsDatabaseAndWritesBack() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        ItemStore itemStore = mock(ItemStore.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        when(itemStore.findLastSummaryDate("42")).thenReturn(Optional.of(TODAY));

        DailySummaryFireStore store = new DailySummaryFireStore(redisTemplate, itemStore);

        assertThat(store.lastFireDate("42")).contains(TODAY);
        verify(ops).set(KEY, "2026-03-02", Duration.ofDays(2));
    }

    @Test
    void redisOutageFallsBackToDatabase() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ItemStore itemStore = mock(ItemStore.class);
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("down"));
        when(itemStore.findLastSummaryDate("42")).thenReturn(Optional.empty());

        DailySummaryFireStore store = new DailySummaryFireStore(redisTemplate, itemStore);

        assertThat(store.lastFireDate("42")).isEmpty();
        verify(itemStore).findLastSummaryDate("42");
    }

    @Test
    void markFiredPersistsEvenWhenCacheWriteFails() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        ItemStore itemStore = mock(ItemStore.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        doThrow(new RedisConnectionFailureException("down")).when(ops).set(anyString(), anyString(), any(Duration.class));
        Instant firedAt = Instant.parse("2026-03-02T08:00:00Z");

        DailySummaryFireStore store = new DailySummaryFireStore(redisTemplate, itemStore);
        store.markFired("42", TODAY, firedAt);

        verify(itemStore).saveLastSummaryDate("42", TODAY, firedAt);
    }

    @Test
    void malformedCacheEntryIsIgnored() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        ItemStore itemStore = mock(ItemStore.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn("yesterday");
        when(itemStore.findLastSummaryDate("42")).thenReturn(Optional.of(TODAY));

        DailySummaryFireStore store = new DailySummaryFireStore(redisTemplate, itemStore);

        assertThat(store.lastFireDate("42")).contains(TODAY);
    }
}
