package com.xbleey.pricewatch.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@TableName("notification_event")
public class NotificationEvent {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("item_id")
    private Long itemId;

    @TableField("owner_id")
    private String ownerId;

    @TableField("price")
    private BigDecimal price;

    @TableField("decided_at")
    private Instant decidedAt;

    @TableField("delivered")
    private boolean delivered;

    @TableField("delivered_at")
    private Instant deliveredAt;

    @TableField("superseded")
    private boolean superseded;

    @TableField("attempts")
    private int attempts;

    public NotificationEvent(Long itemId, String ownerId, BigDecimal price, Instant decidedAt) {
        this.itemId = itemId;
        this.ownerId = ownerId;
        this.price = price;
        this.decidedAt = decidedAt;
    }

    public boolean isPending() {
        return !delivered && !superseded;
    }
}
