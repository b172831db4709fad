package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.client.PriceQuote;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.FailureKind;
import com.xbleey.pricewatch.enums.ItemStatus;
import com.xbleey.pricewatch.enums.StaleReason;
import com.xbleey.pricewatch.model.ItemCheckResult;
import com.xbleey.pricewatch.model.NotificationEvent;
import com.xbleey.pricewatch.model.PriceObservation;
import com.xbleey.pricewatch.model.WatchlistItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-item transitions. Every method returns the complete set of writes for one check and
 * leaves the given item untouched; applying the result is the caller's job.
 *
 * <p>States: ACTIVE and STALE move to each other, REMOVED is terminal and set externally.
 * A notification is decided, never counted: {@code lastNotifiedPrice} only moves when the
 * dispatcher confirms delivery.
 */
@Component
public class PriceStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PriceStateMachine.class);
    private static final String DEFAULT_CURRENCY = "EUR";

    private final int failureStaleThreshold;

    public PriceStateMachine(PriceWatchProperties properties) {
        this.failureStaleThreshold = properties.getBackoff().getFailureStaleThreshold();
    }

    /**
     * @param lowestPendingPrice lowest price among the item's undelivered notifications, or null
     */
    public ItemCheckResult onPrice(WatchlistItem item, PriceQuote quote, BigDecimal lowestPendingPrice, Instant now) {
        requireCheckable(item);
        BigDecimal price = quote.price();
        WatchlistItem next = item.copy();
        next.setCurrentPrice(price);
        next.setLastCheckedAt(now);
        next.setConsecutiveFailures(0);
        next.setStatus(ItemStatus.ACTIVE);
        next.setStaleReason(null);
        if (isBlank(next.getTitle()) && !isBlank(quote.title())) {
            next.setTitle(quote.title().trim());
        }
        if (!isBlank(quote.currency())) {
            next.setCurrency(quote.currency().trim());
        } else if (isBlank(next.getCurrency())) {
            next.setCurrency(DEFAULT_CURRENCY);
        }
        PriceObservation observation = PriceObservation.priced(item.getId(), price, next.getCurrency(), now);

        NotificationEvent notification = null;
        if (qualifies(item, price) && isNewLow(item, price) && belowPending(lowestPendingPrice, price)) {
            notification = new NotificationEvent(item.getId(), item.getOwnerId(), price, now);
            log.info("Price drop for item {} ({}): {} <= threshold {}",
                    item.getId(), item.getProductId(), price.toPlainString(), item.threshold().toPlainString());
        }
        if (item.getStatus() == ItemStatus.STALE) {
            log.info("Item {} recovered, STALE -> ACTIVE", item.getId());
        }
        return new ItemCheckResult(next, observation, notification);
    }

    /**
     * Called once all in-cycle retries of a retryable failure are used up.
     */
    public ItemCheckResult onRetriesExhausted(WatchlistItem item, FailureKind kind, String detail, Instant now) {
        requireCheckable(item);
        WatchlistItem next = item.copy();
        int failures = item.getConsecutiveFailures() + 1;
        next.setConsecutiveFailures(failures);
        next.setLastCheckedAt(now);
        if (failures >= failureStaleThreshold && item.getStatus() == ItemStatus.ACTIVE) {
            next.setStatus(ItemStatus.STALE);
            next.setStaleReason(StaleReason.FAILURE_THRESHOLD);
            log.warn("Item {} ({}) ACTIVE -> STALE after {} failed cycles",
                    item.getId(), item.getProductId(), failures);
        }
        PriceObservation observation = PriceObservation.failed(item.getId(), kind.toOutcome(), detail, now);
        return new ItemCheckResult(next, observation, null);
    }

    public ItemCheckResult onPermanentFailure(WatchlistItem item, String detail, Instant now) {
        requireCheckable(item);
        WatchlistItem next = item.copy();
        next.setConsecutiveFailures(item.getConsecutiveFailures() + 1);
        next.setLastCheckedAt(now);
        next.setStatus(ItemStatus.STALE);
        next.setStaleReason(StaleReason.PERMANENT_ERROR);
        log.warn("Item {} ({}) -> STALE, permanent pricing error: {}", item.getId(), item.getProductId(), detail);
        PriceObservation observation = PriceObservation.failed(
                item.getId(), FailureKind.PERMANENT.toOutcome(), detail, now
        );
        return new ItemCheckResult(next, observation, null);
    }

    /**
     * With a target the price may reach it; without one it must fall below the initial price.
     */
    public boolean qualifies(WatchlistItem item, BigDecimal price) {
        BigDecimal threshold = item.threshold();
        if (threshold == null || price == null) {
            return false;
        }
        int cmp = price.compareTo(threshold);
        return item.hasTarget() ? cmp <= 0 : cmp < 0;
    }

    public boolean isNewLow(WatchlistItem item, BigDecimal price) {
        BigDecimal lastNotified = item.getLastNotifiedPrice();
        return lastNotified == null || price.compareTo(lastNotified) < 0;
    }

    private static boolean belowPending(BigDecimal lowestPendingPrice, BigDecimal price) {
        return lowestPendingPrice == null || price.compareTo(lowestPendingPrice) < 0;
    }

    private static void requireCheckable(WatchlistItem item) {
        if (item == null || item.isRemoved()) {
            throw new IllegalArgumentException("Removed items are not checked");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
