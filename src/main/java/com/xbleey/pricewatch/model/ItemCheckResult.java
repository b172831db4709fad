package com.xbleey.pricewatch.model;

/**
 * Everything one item check writes, applied as a single atomic step.
 * {@code notification} is null when the check decided not to notify.
 */
public record ItemCheckResult(WatchlistItem item, PriceObservation observation, NotificationEvent notification) {

    public boolean hasNotification() {
        return notification != null;
    }
}
