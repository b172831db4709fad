package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.enums.ItemStatus;
import com.xbleey.pricewatch.enums.StaleReason;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.repository.DuplicateWatchlistItemException;
import com.xbleey.pricewatch.support.InMemoryItemStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatchlistServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private final InMemoryItemStore store = new InMemoryItemStore();
    private final WatchlistService service = new WatchlistService(store, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void addStartsActiveAtInitialPrice() {
        WatchlistItem item = service.add("42", " B0TEST ", new BigDecimal("100"), new BigDecimal("80"), "Kettle");

        assertThat(item.getId()).isNotNull();
        assertThat(item.getProductId()).isEqualTo("B0TEST");
        assertThat(item.getStatus()).isEqualTo(ItemStatus.ACTIVE);
        assertThat(item.getCurrentPrice()).isEqualByComparingTo("100");
        assertThat(item.getLastNotifiedPrice()).isNull();
        assertThat(item.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void secondActiveItemForSameProductIsRejected() {
        service.add("42", "B0TEST", new BigDecimal("100"), null, null);

        assertThatThrownBy(() -> service.add("42", "B0TEST", new BigDecimal("90"), null, null))
                .isInstanceOf(DuplicateWatchlistItemException.class);
    }

    @Test
    void productCanBeWatchedAgainAfterRemoval() {
        WatchlistItem first = service.add("42", "B0TEST", new BigDecimal("100"), null, null);

        assertThat(service.remove(first.getId())).isTrue();
        WatchlistItem second = service.add("42", "B0TEST", new BigDecimal("90"), null, null);

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(service.list("42")).extracting(WatchlistItem::getId).containsExactly(second.getId());
        assertThat(store.get(first.getId()).getRemovedAt()).isEqualTo(NOW);
    }

    @Test
    void removingTwiceReportsNothingRemoved() {
        WatchlistItem item = service.add("42", "B0TEST", new BigDecimal("100"), null, null);

        assertThat(service.remove(item.getId())).isTrue();
        assertThat(service.remove(item.getId())).isFalse();
    }

    @Test
    void reactivateOnlyAppliesToStaleItems() {
        WatchlistItem item = service.add("42", "B0TEST", new BigDecimal("100"), null, null);
        assertThat(service.reactivate(item.getId())).isFalse();

        WatchlistItem stale = store.get(item.getId());
        stale.setStatus(ItemStatus.STALE);
        stale.setStaleReason(StaleReason.PERMANENT_ERROR);
        stale.setConsecutiveFailures(1);
        store.put(stale);

        assertThat(service.reactivate(item.getId())).isTrue();
        WatchlistItem active = store.get(item.getId());
        assertThat(active.getStatus()).isEqualTo(ItemStatus.ACTIVE);
        assertThat(active.getStaleReason()).isNull();
        assertThat(active.getConsecutiveFailures()).isZero();
    }

    @Test
    void invalidPricesAreRejected() {
        assertThatThrownBy(() -> service.add("42", "B0TEST", BigDecimal.ZERO, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.add("42", "B0TEST", new BigDecimal("10"), new BigDecimal("-1"), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.add(" ", "B0TEST", new BigDecimal("10"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
