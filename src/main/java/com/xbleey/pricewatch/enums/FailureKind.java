package com.xbleey.pricewatch.enums;

public enum FailureKind {
    RATE_LIMITED,
    TRANSIENT,
    PERMANENT;

    public boolean retryable() {
        return this != PERMANENT;
    }

    public ObservationOutcome toOutcome() {
        return switch (this) {
            case RATE_LIMITED -> ObservationOutcome.RATE_LIMITED;
            case TRANSIENT -> ObservationOutcome.TRANSIENT;
            case PERMANENT -> ObservationOutcome.PERMANENT;
        };
    }
}
