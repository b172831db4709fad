package com.xbleey.pricewatch.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@TableName("daily_summary_fire")
public class DailySummaryFire {

    @TableId(value = "owner_id", type = IdType.INPUT)
    private String ownerId;

    @TableField("last_fire_date")
    private LocalDate lastFireDate;

    @TableField("fired_at")
    private Instant firedAt;
}
