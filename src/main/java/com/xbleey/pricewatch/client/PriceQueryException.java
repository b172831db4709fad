package com.xbleey.pricewatch.client;

import com.xbleey.pricewatch.enums.FailureKind;

/**
 * A pricing call that did not yield a price, classified for the backoff decision.
 */
public class PriceQueryException extends Exception {

    private final FailureKind kind;

    public PriceQueryException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PriceQueryException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public static PriceQueryException rateLimited(String message) {
        return new PriceQueryException(FailureKind.RATE_LIMITED, message);
    }

    public static PriceQueryException transientFailure(String message) {
        return new PriceQueryException(FailureKind.TRANSIENT, message);
    }

    public static PriceQueryException transientFailure(String message, Throwable cause) {
        return new PriceQueryException(FailureKind.TRANSIENT, message, cause);
    }

    public static PriceQueryException permanent(String message) {
        return new PriceQueryException(FailureKind.PERMANENT, message);
    }
}
