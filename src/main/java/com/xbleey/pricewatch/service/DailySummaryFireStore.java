package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.repository.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Last daily-summary fire date per owner. The database is the source of truth, Redis only
 * caches it; cache errors fall back to the database.
 */
@Service
public class DailySummaryFireStore {

    private static final Logger log = LoggerFactory.getLogger(DailySummaryFireStore.class);
    private static final String KEY_PREFIX = "pricewatch:summary:fired:";
    private static final Duration CACHE_TTL = Duration.ofDays(2);

    private final StringRedisTemplate redisTemplate;
    private final ItemStore itemStore;

    public DailySummaryFireStore(StringRedisTemplate redisTemplate, ItemStore itemStore) {
        this.redisTemplate = redisTemplate;
        this.itemStore = itemStore;
    }

    public Optional<LocalDate> lastFireDate(String ownerId) {
        Optional<LocalDate> cached = readFromCache(ownerId);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<LocalDate> stored = itemStore.findLastSummaryDate(ownerId);
        stored.ifPresent(date -> writeToCache(ownerId, date));
        return stored;
    }

    public void markFired(String ownerId, LocalDate date, Instant firedAt) {
        itemStore.saveLastSummaryDate(ownerId, date, firedAt);
        writeToCache(ownerId, date);
    }

    static String cacheKey(String ownerId) {
        return KEY_PREFIX + ownerId;
    }

    private Optional<LocalDate> readFromCache(String ownerId) {
        try {
            String cached = redisTemplate.opsForValue().get(cacheKey(ownerId));
            if (cached == null || cached.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(LocalDate.parse(cached.trim()));
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring malformed summary fire date cached for owner {}", ownerId);
            return Optional.empty();
        } catch (Exception ex) {
            log.warn("Failed to read summary fire date from redis", ex);
            return Optional.empty();
        }
    }

    private void writeToCache(String ownerId, LocalDate date) {
        try {
            redisTemplate.opsForValue().set(cacheKey(ownerId), date.toString(), CACHE_TTL);
        } catch (Exception ex) {
            log.warn("Failed to cache summary fire date to redis", ex);
        }
    }
}
