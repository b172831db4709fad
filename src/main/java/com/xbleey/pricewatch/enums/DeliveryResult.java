package com.xbleey.pricewatch.enums;

public enum DeliveryResult {
    DELIVERED,
    FAILED;

    public boolean delivered() {
        return this == DELIVERED;
    }
}
