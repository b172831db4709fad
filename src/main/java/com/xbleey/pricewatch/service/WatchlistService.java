package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.enums.ItemStatus;
import com.xbleey.pricewatch.model.PriceObservation;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.repository.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class WatchlistService {

    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);
    private static final int MAX_OBSERVATIONS = 500;

    private final ItemStore itemStore;
    private final Clock clock;

    public WatchlistService(ItemStore itemStore, Clock clock) {
        this.itemStore = itemStore;
        this.clock = clock;
    }

    /**
     * Starts tracking a product for an owner at the price seen when it was added.
     *
     * @throws com.xbleey.pricewatch.repository.DuplicateWatchlistItemException when the owner
     *                                                                          already tracks it
     */
    public WatchlistItem add(String ownerId, String productId, BigDecimal initialPrice, BigDecimal targetPrice, String title) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId must not be blank");
        }
        if (initialPrice == null || initialPrice.signum() <= 0) {
            throw new IllegalArgumentException("initialPrice must be > 0");
        }
        if (targetPrice != null && targetPrice.signum() <= 0) {
            throw new IllegalArgumentException("targetPrice must be > 0");
        }
        Instant now = Instant.now(clock);
        WatchlistItem item = new WatchlistItem();
        item.setOwnerId(ownerId.trim());
        item.setProductId(productId.trim());
        item.setTitle(title == null || title.isBlank() ? null : title.trim());
        item.setInitialPrice(initialPrice);
        item.setTargetPrice(targetPrice);
        item.setCurrentPrice(initialPrice);
        item.setConsecutiveFailures(0);
        item.setStatus(ItemStatus.ACTIVE);
        item.setCreatedAt(now);
        WatchlistItem created = itemStore.createItem(item);
        log.info("Owner {} now tracks {} (item {}) from {}",
                created.getOwnerId(), created.getProductId(), created.getId(), initialPrice.toPlainString());
        return created;
    }

    public boolean remove(Long itemId) {
        boolean removed = itemStore.markRemoved(itemId, Instant.now(clock));
        if (removed) {
            log.info("Item {} removed", itemId);
        }
        return removed;
    }

    /**
     * Puts a STALE item back on the schedule.
     */
    public boolean reactivate(Long itemId) {
        boolean reactivated = itemStore.reactivate(itemId);
        if (reactivated) {
            log.info("Item {} reactivated", itemId);
        }
        return reactivated;
    }

    public Optional<WatchlistItem> find(Long itemId) {
        return itemStore.findItem(itemId);
    }

    public List<WatchlistItem> list(String ownerId) {
        return itemStore.findItemsByOwner(ownerId);
    }

    public List<PriceObservation> observations(Long itemId, int limit) {
        return itemStore.findObservations(itemId, Math.min(Math.max(1, limit), MAX_OBSERVATIONS));
    }
}
