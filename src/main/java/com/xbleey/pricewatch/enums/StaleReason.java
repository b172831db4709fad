package com.xbleey.pricewatch.enums;

public enum StaleReason {
    /**
     * Retries were exhausted in enough consecutive cycles; still checked on schedule.
     */
    FAILURE_THRESHOLD,
    /**
     * The product identifier no longer resolves; not checked until re-activated.
     */
    PERMANENT_ERROR
}
