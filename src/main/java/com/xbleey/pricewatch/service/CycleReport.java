package com.xbleey.pricewatch.service;

import java.time.Duration;
import java.time.Instant;

public record CycleReport(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        int items,
        int checked,
        int skipped,
        int deferred,
        int stale,
        int failed,
        int abandoned,
        int notificationsCreated,
        int notificationsDelivered,
        int redelivered
) {

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
