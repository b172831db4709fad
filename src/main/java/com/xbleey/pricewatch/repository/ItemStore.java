package com.xbleey.pricewatch.repository;

import com.xbleey.pricewatch.model.ItemCheckResult;
import com.xbleey.pricewatch.model.NotificationEvent;
import com.xbleey.pricewatch.model.PriceObservation;
import com.xbleey.pricewatch.model.WatchlistItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for watchlist items, their observations and notification events.
 * Methods that touch more than one row are atomic.
 */
public interface ItemStore {

    /**
     * Inserts the item unless a non-removed item with the same owner and product exists.
     *
     * @throws DuplicateWatchlistItemException when such an item exists
     */
    WatchlistItem createItem(WatchlistItem item);

    Optional<WatchlistItem> findItem(Long id);

    List<WatchlistItem> findItemsByOwner(String ownerId);

    List<WatchlistItem> findCheckableItems();

    List<WatchlistItem> findActiveItemsByOwner(String ownerId);

    List<String> findOwnersWithActiveItems();

    boolean markRemoved(Long id, Instant removedAt);

    boolean reactivate(Long id);

    /**
     * Writes the item's new state, appends the observation and, if present, inserts the
     * notification. Older pending notifications of the item stay pending. Does nothing and
     * returns false when the item was removed or a newer check was already applied.
     */
    boolean applyCheck(ItemCheckResult result);

    List<PriceObservation> findObservations(Long itemId, int limit);

    Optional<BigDecimal> findLowestPendingPrice(Long itemId);

    /**
     * Undelivered notifications, oldest decision first.
     */
    List<NotificationEvent> findPendingNotifications();

    List<NotificationEvent> findPendingNotifications(Long itemId);

    /**
     * Marks the event delivered and lowers the item's last notified price to the event price.
     */
    boolean markDelivered(Long eventId, Instant deliveredAt);

    void recordDeliveryAttempt(Long eventId);

    boolean markSuperseded(Long eventId);

    Optional<LocalDate> findLastSummaryDate(String ownerId);

    void saveLastSummaryDate(String ownerId, LocalDate date, Instant firedAt);
}
