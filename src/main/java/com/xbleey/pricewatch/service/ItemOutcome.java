package com.xbleey.pricewatch.service;

/**
 * How a single item's check ended within a cycle.
 */
enum ItemOutcome {
    /** Price observed and recorded. */
    CHECKED,
    /** No rate limiter slot in time, or the item changed underneath; not a failure. */
    SKIPPED,
    /** Retryable failures used up the attempts; checked again next cycle. */
    DEFERRED,
    /** Permanent pricing error, item moved to STALE. */
    STALE,
    /** Persistence kept failing or something unexpected broke. */
    FAILED,
    /** Shutdown reached the item before its state was written. */
    ABANDONED
}
