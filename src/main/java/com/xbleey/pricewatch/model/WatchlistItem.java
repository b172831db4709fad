package com.xbleey.pricewatch.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.xbleey.pricewatch.enums.ItemStatus;
import com.xbleey.pricewatch.enums.StaleReason;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@TableName("watchlist_item")
public class WatchlistItem {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("owner_id")
    private String ownerId;

    @TableField("product_id")
    private String productId;

    @TableField("title")
    private String title;

    @TableField("currency")
    private String currency;

    @TableField("initial_price")
    private BigDecimal initialPrice;

    @TableField("target_price")
    private BigDecimal targetPrice;

    @TableField("current_price")
    private BigDecimal currentPrice;

    @TableField("last_notified_price")
    private BigDecimal lastNotifiedPrice;

    @TableField("consecutive_failures")
    private int consecutiveFailures;

    @TableField("status")
    private ItemStatus status;

    @TableField("stale_reason")
    private StaleReason staleReason;

    @TableField("last_checked_at")
    private Instant lastCheckedAt;

    @TableField("created_at")
    private Instant createdAt;

    @TableField("removed_at")
    private Instant removedAt;

    public boolean hasTarget() {
        return targetPrice != null;
    }

    /**
     * Target price when the owner declared one, otherwise the initial price.
     */
    public BigDecimal threshold() {
        return hasTarget() ? targetPrice : initialPrice;
    }

    public boolean isRemoved() {
        return status == ItemStatus.REMOVED;
    }

    /**
     * ACTIVE items and items gone stale through repeated failures are checked every cycle.
     * Items stale through a permanent error wait for re-activation.
     */
    public boolean isCheckable() {
        if (status == ItemStatus.ACTIVE) {
            return true;
        }
        return status == ItemStatus.STALE && staleReason == StaleReason.FAILURE_THRESHOLD;
    }

    public WatchlistItem copy() {
        WatchlistItem copy = new WatchlistItem();
        copy.setId(id);
        copy.setOwnerId(ownerId);
        copy.setProductId(productId);
        copy.setTitle(title);
        copy.setCurrency(currency);
        copy.setInitialPrice(initialPrice);
        copy.setTargetPrice(targetPrice);
        copy.setCurrentPrice(currentPrice);
        copy.setLastNotifiedPrice(lastNotifiedPrice);
        copy.setConsecutiveFailures(consecutiveFailures);
        copy.setStatus(status);
        copy.setStaleReason(staleReason);
        copy.setLastCheckedAt(lastCheckedAt);
        copy.setCreatedAt(createdAt);
        copy.setRemovedAt(removedAt);
        return copy;
    }
}
