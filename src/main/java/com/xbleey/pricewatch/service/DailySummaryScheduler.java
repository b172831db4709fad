package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.client.MessageSender;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.DeliveryResult;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.repository.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Sends each owner one digest of their active items per local day while live price queries
 * are disabled. The fire date is stored only after the digest went out, so a failed send is
 * retried on the next tick and a restart never repeats a delivered one.
 */
@Service
public class DailySummaryScheduler {

    private static final Logger log = LoggerFactory.getLogger(DailySummaryScheduler.class);

    private final ItemStore itemStore;
    private final DailySummaryFireStore fireStore;
    private final MessageSender messageSender;
    private final PriceAlertMessages messages;
    private final PersistenceRetrier persistence;
    private final PriceWatchProperties properties;
    private final Clock clock;

    public DailySummaryScheduler(
            ItemStore itemStore,
            DailySummaryFireStore fireStore,
            MessageSender messageSender,
            PriceAlertMessages messages,
            PersistenceRetrier persistence,
            PriceWatchProperties properties,
            Clock clock
    ) {
        this.itemStore = itemStore;
        this.fireStore = fireStore;
        this.messageSender = messageSender;
        this.messages = messages;
        this.persistence = persistence;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "0 * * * * *")
    public void onTick() {
        if (properties.getPricing().isLiveQueryEnabled()) {
            return;
        }
        runIfDue();
    }

    /**
     * @return number of summaries delivered by this tick
     */
    public int runIfDue() {
        PriceWatchProperties.DailySummary config = properties.getDailySummary();
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(config.getZone()));
        LocalDate today = now.toLocalDate();
        List<String> owners = persistence.call("load summary owners", itemStore::findOwnersWithActiveItems)
                .orElse(List.of());
        int sent = 0;
        for (String ownerId : owners) {
            if (now.toLocalTime().isBefore(config.timeFor(ownerId))) {
                continue;
            }
            Optional<Optional<LocalDate>> lastFire = persistence.call("load summary fire date of " + ownerId,
                    () -> fireStore.lastFireDate(ownerId));
            if (lastFire.isEmpty()) {
                continue;
            }
            if (lastFire.get().filter(date -> !date.isBefore(today)).isPresent()) {
                continue;
            }
            if (fireFor(ownerId, today)) {
                sent++;
            }
        }
        return sent;
    }

    private boolean fireFor(String ownerId, LocalDate today) {
        List<WatchlistItem> items = persistence.call("load active items of " + ownerId,
                () -> itemStore.findActiveItemsByOwner(ownerId)).orElse(List.of());
        if (items.isEmpty()) {
            return false;
        }
        DeliveryResult result;
        try {
            result = messageSender.send(ownerId, messages.dailySummary(items));
        } catch (RuntimeException ex) {
            log.warn("Message sender failed for owner {}", ownerId, ex);
            result = DeliveryResult.FAILED;
        }
        if (result == null || !result.delivered()) {
            log.warn("Daily summary for owner {} not delivered, retried on next tick", ownerId);
            return false;
        }
        Instant firedAt = Instant.now(clock);
        if (!persistence.run("save summary fire date of " + ownerId, () -> fireStore.markFired(ownerId, today, firedAt))) {
            log.warn("Daily summary for owner {} sent but its fire date could not be stored", ownerId);
        }
        log.info("Daily summary with {} items sent to owner {}", items.size(), ownerId);
        return true;
    }
}
