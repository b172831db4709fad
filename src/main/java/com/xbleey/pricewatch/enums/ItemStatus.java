package com.xbleey.pricewatch.enums;

public enum ItemStatus {
    ACTIVE,
    STALE,
    REMOVED
}
