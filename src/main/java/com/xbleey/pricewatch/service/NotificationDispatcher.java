package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.client.MessageSender;
import com.xbleey.pricewatch.enums.DeliveryResult;
import com.xbleey.pricewatch.model.NotificationEvent;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.repository.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Hands decided notifications to the messaging channel. The only place where an item's
 * last notified price advances.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final ItemStore itemStore;
    private final MessageSender messageSender;
    private final PriceAlertMessages messages;
    private final PersistenceRetrier persistence;
    private final Clock clock;

    public NotificationDispatcher(
            ItemStore itemStore,
            MessageSender messageSender,
            PriceAlertMessages messages,
            PersistenceRetrier persistence,
            Clock clock
    ) {
        this.itemStore = itemStore;
        this.messageSender = messageSender;
        this.messages = messages;
        this.persistence = persistence;
        this.clock = clock;
    }

    public DeliveryResult deliver(NotificationEvent event) {
        return attempt(event) == Attempt.SENT ? DeliveryResult.DELIVERED : DeliveryResult.FAILED;
    }

    /**
     * Delivers the item's undelivered notifications oldest first and stops at the first one
     * that fails, so the owner never hears about a low before the higher lows that preceded it.
     *
     * @return number delivered
     */
    public int deliverPending(Long itemId) {
        List<NotificationEvent> pending = persistence.call("load pending notifications of item " + itemId,
                () -> itemStore.findPendingNotifications(itemId)).orElse(List.of());
        int delivered = 0;
        for (NotificationEvent event : pending) {
            Attempt attempt = attempt(event);
            if (attempt == Attempt.FAILED) {
                break;
            }
            if (attempt == Attempt.SENT) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Retries every undelivered notification once, oldest first. After a failure the later
     * notifications of the same item wait for the next trigger.
     *
     * @return number delivered
     */
    public int redeliverPending() {
        List<NotificationEvent> pending = persistence.call("load pending notifications",
                itemStore::findPendingNotifications).orElse(List.of());
        if (pending.isEmpty()) {
            return 0;
        }
        log.info("Redelivering {} pending notifications", pending.size());
        Set<Long> held = new HashSet<>();
        int delivered = 0;
        for (NotificationEvent event : pending) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (held.contains(event.getItemId())) {
                continue;
            }
            Attempt attempt = attempt(event);
            if (attempt == Attempt.SENT) {
                delivered++;
            } else if (attempt == Attempt.FAILED) {
                held.add(event.getItemId());
            }
        }
        return delivered;
    }

    public DeliveryResult notifyPermanentFailure(WatchlistItem item) {
        return send(item.getOwnerId(), messages.permanentFailure(item));
    }

    private Attempt attempt(NotificationEvent event) {
        if (event == null || event.getId() == null) {
            return Attempt.FAILED;
        }
        Optional<Optional<WatchlistItem>> loaded = persistence.call("load item " + event.getItemId(),
                () -> itemStore.findItem(event.getItemId()));
        if (loaded.isEmpty()) {
            return Attempt.FAILED;
        }
        Optional<WatchlistItem> found = loaded.get();
        if (found.isEmpty() || found.get().isRemoved()) {
            log.info("Drop notification {}: item {} is gone", event.getId(), event.getItemId());
            persistence.run("drop notification " + event.getId(), () -> itemStore.markSuperseded(event.getId()));
            return Attempt.DROPPED;
        }
        WatchlistItem item = found.get();
        if (item.getLastNotifiedPrice() != null && event.getPrice().compareTo(item.getLastNotifiedPrice()) >= 0) {
            log.info("Drop notification {}: {} is not below last notified {}",
                    event.getId(), event.getPrice(), item.getLastNotifiedPrice());
            persistence.run("drop notification " + event.getId(), () -> itemStore.markSuperseded(event.getId()));
            return Attempt.DROPPED;
        }
        DeliveryResult result = send(event.getOwnerId(), messages.priceDrop(item, event));
        if (!result.delivered()) {
            persistence.run("count delivery attempt " + event.getId(), () -> itemStore.recordDeliveryAttempt(event.getId()));
            log.warn("Notification {} for item {} not delivered, retried on next cycle", event.getId(), item.getId());
            return Attempt.FAILED;
        }
        Instant deliveredAt = Instant.now(clock);
        boolean recorded = persistence.call("mark notification delivered " + event.getId(),
                () -> itemStore.markDelivered(event.getId(), deliveredAt)).orElse(false);
        if (!recorded) {
            log.warn("Notification {} sent but its delivery could not be recorded", event.getId());
        }
        log.info("Notified owner {} about item {} at {}", event.getOwnerId(), item.getId(), event.getPrice());
        return Attempt.SENT;
    }

    private DeliveryResult send(String ownerId, String text) {
        try {
            DeliveryResult result = messageSender.send(ownerId, text);
            return result == null ? DeliveryResult.FAILED : result;
        } catch (RuntimeException ex) {
            log.warn("Message sender failed for owner {}", ownerId, ex);
            return DeliveryResult.FAILED;
        }
    }

    private enum Attempt {
        SENT,
        FAILED,
        DROPPED
    }
}
