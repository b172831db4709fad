package com.xbleey.pricewatch.enums;

public enum ObservationOutcome {
    PRICE,
    RATE_LIMITED,
    TRANSIENT,
    PERMANENT
}
