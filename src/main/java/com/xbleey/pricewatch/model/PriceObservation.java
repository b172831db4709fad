package com.xbleey.pricewatch.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.xbleey.pricewatch.enums.ObservationOutcome;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@TableName("price_observation")
public class PriceObservation {

    @TableId(type = IdType.AUTO)
    private Long id;

    @TableField("item_id")
    private Long itemId;

    @TableField("price")
    private BigDecimal price;

    @TableField("currency")
    private String currency;

    @TableField("observed_at")
    private Instant observedAt;

    @TableField("outcome")
    private ObservationOutcome outcome;

    @TableField("detail")
    private String detail;

    public static PriceObservation priced(Long itemId, BigDecimal price, String currency, Instant observedAt) {
        PriceObservation observation = new PriceObservation();
        observation.setItemId(itemId);
        observation.setPrice(price);
        observation.setCurrency(currency);
        observation.setObservedAt(observedAt);
        observation.setOutcome(ObservationOutcome.PRICE);
        return observation;
    }

    public static PriceObservation failed(Long itemId, ObservationOutcome outcome, String detail, Instant observedAt) {
        PriceObservation observation = new PriceObservation();
        observation.setItemId(itemId);
        observation.setObservedAt(observedAt);
        observation.setOutcome(outcome);
        observation.setDetail(detail);
        return observation;
    }
}
