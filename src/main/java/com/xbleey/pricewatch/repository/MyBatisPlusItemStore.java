package com.xbleey.pricewatch.repository;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.xbleey.pricewatch.enums.ItemStatus;
import com.xbleey.pricewatch.enums.StaleReason;
import com.xbleey.pricewatch.mapper.DailySummaryFireMapper;
import com.xbleey.pricewatch.mapper.NotificationEventMapper;
import com.xbleey.pricewatch.mapper.PriceObservationMapper;
import com.xbleey.pricewatch.mapper.WatchlistItemMapper;
import com.xbleey.pricewatch.model.DailySummaryFire;
import com.xbleey.pricewatch.model.ItemCheckResult;
import com.xbleey.pricewatch.model.NotificationEvent;
import com.xbleey.pricewatch.model.PriceObservation;
import com.xbleey.pricewatch.model.WatchlistItem;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class MyBatisPlusItemStore implements ItemStore {

    private final WatchlistItemMapper itemMapper;
    private final PriceObservationMapper observationMapper;
    private final NotificationEventMapper notificationMapper;
    private final DailySummaryFireMapper summaryFireMapper;

    public MyBatisPlusItemStore(
            WatchlistItemMapper itemMapper,
            PriceObservationMapper observationMapper,
            NotificationEventMapper notificationMapper,
            DailySummaryFireMapper summaryFireMapper
    ) {
        this.itemMapper = itemMapper;
        this.observationMapper = observationMapper;
        this.notificationMapper = notificationMapper;
        this.summaryFireMapper = summaryFireMapper;
    }

    @Override
    @Transactional
    public WatchlistItem createItem(WatchlistItem item) {
        LambdaQueryWrapper<WatchlistItem> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(WatchlistItem::getOwnerId, item.getOwnerId())
                .eq(WatchlistItem::getProductId, item.getProductId())
                .ne(WatchlistItem::getStatus, ItemStatus.REMOVED)
                .last("for update");
        if (itemMapper.selectCount(wrapper) > 0) {
            throw new DuplicateWatchlistItemException(item.getOwnerId(), item.getProductId());
        }
        itemMapper.insert(item);
        return item;
    }

    @Override
    public Optional<WatchlistItem> findItem(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(itemMapper.selectById(id));
    }

    @Override
    public List<WatchlistItem> findItemsByOwner(String ownerId) {
        LambdaQueryWrapper<WatchlistItem> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(WatchlistItem::getOwnerId, ownerId)
                .ne(WatchlistItem::getStatus, ItemStatus.REMOVED)
                .orderByAsc(WatchlistItem::getCreatedAt);
        return List.copyOf(itemMapper.selectList(wrapper));
    }

    @Override
    public List<WatchlistItem> findCheckableItems() {
        LambdaQueryWrapper<WatchlistItem> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(WatchlistItem::getStatus, ItemStatus.ACTIVE)
                .or(w -> w.eq(WatchlistItem::getStatus, ItemStatus.STALE)
                        .eq(WatchlistItem::getStaleReason, StaleReason.FAILURE_THRESHOLD))
                .orderByAsc(WatchlistItem::getId);
        return List.copyOf(itemMapper.selectList(wrapper));
    }

    @Override
    public List<WatchlistItem> findActiveItemsByOwner(String ownerId) {
        LambdaQueryWrapper<WatchlistItem> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(WatchlistItem::getOwnerId, ownerId)
                .eq(WatchlistItem::getStatus, ItemStatus.ACTIVE)
                .orderByAsc(WatchlistItem::getCreatedAt);
        return List.copyOf(itemMapper.selectList(wrapper));
    }

    @Override
    public List<String> findOwnersWithActiveItems() {
        LambdaQueryWrapper<WatchlistItem> wrapper = new LambdaQueryWrapper<>();
        wrapper.select(WatchlistItem::getOwnerId)
                .eq(WatchlistItem::getStatus, ItemStatus.ACTIVE)
                .groupBy(WatchlistItem::getOwnerId);
        return itemMapper.selectList(wrapper).stream()
                .map(WatchlistItem::getOwnerId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    @Override
    public boolean markRemoved(Long id, Instant removedAt) {
        if (id == null) {
            return false;
        }
        LambdaUpdateWrapper<WatchlistItem> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(WatchlistItem::getId, id)
                .ne(WatchlistItem::getStatus, ItemStatus.REMOVED)
                .set(WatchlistItem::getStatus, ItemStatus.REMOVED)
                .set(WatchlistItem::getRemovedAt, removedAt);
        return itemMapper.update(null, wrapper) > 0;
    }

    @Override
    public boolean reactivate(Long id) {
        if (id == null) {
            return false;
        }
        LambdaUpdateWrapper<WatchlistItem> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(WatchlistItem::getId, id)
                .eq(WatchlistItem::getStatus, ItemStatus.STALE)
                .set(WatchlistItem::getStatus, ItemStatus.ACTIVE)
                .set(WatchlistItem::getStaleReason, null)
                .set(WatchlistItem::getConsecutiveFailures, 0);
        return itemMapper.update(null, wrapper) > 0;
    }

    @Override
    @Transactional
    public boolean applyCheck(ItemCheckResult result) {
        WatchlistItem item = result.item();
        LambdaUpdateWrapper<WatchlistItem> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(WatchlistItem::getId, item.getId())
                .ne(WatchlistItem::getStatus, ItemStatus.REMOVED)
                .and(w -> w.isNull(WatchlistItem::getLastCheckedAt)
                        .or()
                        .le(WatchlistItem::getLastCheckedAt, item.getLastCheckedAt()))
                .set(WatchlistItem::getTitle, item.getTitle())
                .set(WatchlistItem::getCurrency, item.getCurrency())
                .set(WatchlistItem::getCurrentPrice, item.getCurrentPrice())
                .set(WatchlistItem::getConsecutiveFailures, item.getConsecutiveFailures())
                .set(WatchlistItem::getStatus, item.getStatus())
                .set(WatchlistItem::getStaleReason, item.getStaleReason())
                .set(WatchlistItem::getLastCheckedAt, item.getLastCheckedAt());
        if (itemMapper.update(null, wrapper) == 0) {
            return false;
        }
        // ids are assigned on insert; clear them so a retried transaction inserts fresh rows
        result.observation().setId(null);
        observationMapper.insert(result.observation());
        if (result.hasNotification()) {
            result.notification().setId(null);
            notificationMapper.insert(result.notification());
        }
        return true;
    }

    @Override
    public List<PriceObservation> findObservations(Long itemId, int limit) {
        int safeLimit = Math.max(0, limit);
        if (itemId == null || safeLimit == 0) {
            return List.of();
        }
        LambdaQueryWrapper<PriceObservation> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(PriceObservation::getItemId, itemId)
                .orderByDesc(PriceObservation::getObservedAt)
                .orderByDesc(PriceObservation::getId)
                .last("limit " + safeLimit);
        return List.copyOf(observationMapper.selectList(wrapper));
    }

    @Override
    public Optional<BigDecimal> findLowestPendingPrice(Long itemId) {
        LambdaQueryWrapper<NotificationEvent> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(NotificationEvent::getItemId, itemId)
                .eq(NotificationEvent::isDelivered, false)
                .eq(NotificationEvent::isSuperseded, false)
                .orderByAsc(NotificationEvent::getPrice)
                .last("limit 1");
        return Optional.ofNullable(notificationMapper.selectOne(wrapper))
                .map(NotificationEvent::getPrice);
    }

    @Override
    public List<NotificationEvent> findPendingNotifications() {
        LambdaQueryWrapper<NotificationEvent> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(NotificationEvent::isDelivered, false)
                .eq(NotificationEvent::isSuperseded, false)
                .orderByAsc(NotificationEvent::getDecidedAt)
                .orderByAsc(NotificationEvent::getId);
        return List.copyOf(notificationMapper.selectList(wrapper));
    }

    @Override
    public List<NotificationEvent> findPendingNotifications(Long itemId) {
        if (itemId == null) {
            return List.of();
        }
        LambdaQueryWrapper<NotificationEvent> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(NotificationEvent::getItemId, itemId)
                .eq(NotificationEvent::isDelivered, false)
                .eq(NotificationEvent::isSuperseded, false)
                .orderByAsc(NotificationEvent::getDecidedAt)
                .orderByAsc(NotificationEvent::getId);
        return List.copyOf(notificationMapper.selectList(wrapper));
    }

    @Override
    @Transactional
    public boolean markDelivered(Long eventId, Instant deliveredAt) {
        NotificationEvent event = notificationMapper.selectById(eventId);
        if (event == null || event.isDelivered()) {
            return false;
        }
        LambdaUpdateWrapper<NotificationEvent> eventUpdate = new LambdaUpdateWrapper<>();
        eventUpdate.eq(NotificationEvent::getId, eventId)
                .eq(NotificationEvent::isDelivered, false)
                .set(NotificationEvent::isDelivered, true)
                .set(NotificationEvent::getDeliveredAt, deliveredAt);
        if (notificationMapper.update(null, eventUpdate) == 0) {
            return false;
        }
        LambdaUpdateWrapper<WatchlistItem> itemUpdate = new LambdaUpdateWrapper<>();
        itemUpdate.eq(WatchlistItem::getId, event.getItemId())
                .and(w -> w.isNull(WatchlistItem::getLastNotifiedPrice)
                        .or()
                        .gt(WatchlistItem::getLastNotifiedPrice, event.getPrice()))
                .set(WatchlistItem::getLastNotifiedPrice, event.getPrice());
        itemMapper.update(null, itemUpdate);
        return true;
    }

    @Override
    public void recordDeliveryAttempt(Long eventId) {
        LambdaUpdateWrapper<NotificationEvent> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(NotificationEvent::getId, eventId)
                .setSql("attempts = attempts + 1");
        notificationMapper.update(null, wrapper);
    }

    @Override
    public boolean markSuperseded(Long eventId) {
        LambdaUpdateWrapper<NotificationEvent> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(NotificationEvent::getId, eventId)
                .eq(NotificationEvent::isDelivered, false)
                .set(NotificationEvent::isSuperseded, true);
        return notificationMapper.update(null, wrapper) > 0;
    }

    @Override
    public Optional<LocalDate> findLastSummaryDate(String ownerId) {
        if (ownerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(summaryFireMapper.selectById(ownerId))
                .map(DailySummaryFire::getLastFireDate);
    }

    @Override
    @Transactional
    public void saveLastSummaryDate(String ownerId, LocalDate date, Instant firedAt) {
        DailySummaryFire record = new DailySummaryFire();
        record.setOwnerId(ownerId);
        record.setLastFireDate(date);
        record.setFiredAt(firedAt);
        if (summaryFireMapper.updateById(record) == 0) {
            summaryFireMapper.insert(record);
        }
    }
}
