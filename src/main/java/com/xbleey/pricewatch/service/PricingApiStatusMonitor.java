package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchMailProperties;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks pricing outages across items and cycles and mails operators when one starts
 * (throttled) and when it ends.
 */
@Service
public class PricingApiStatusMonitor {

    private final OperatorMailService mailService;
    private final PriceWatchProperties properties;
    private final Duration notifyInterval;
    private final Clock clock;
    private final Object lock = new Object();
    private Instant firstFailureAt;
    private Instant lastNotificationAt;

    public PricingApiStatusMonitor(
            OperatorMailService mailService,
            PriceWatchProperties properties,
            PriceWatchMailProperties mailProperties,
            Clock clock
    ) {
        this.mailService = mailService;
        this.properties = properties;
        this.notifyInterval = mailProperties.getErrorNotifyInterval();
        this.clock = clock;
    }

    public void recordFailure(String errorDetail) {
        Instant now = Instant.now(clock);
        PricingApiErrorMessage message = null;
        synchronized (lock) {
            if (firstFailureAt == null) {
                firstFailureAt = now;
            }
            if (shouldNotify(now)) {
                message = new PricingApiErrorMessage(now, apiUrl(), errorDetail, Duration.between(firstFailureAt, now));
                lastNotificationAt = now;
            }
        }
        if (message != null) {
            mailService.notifyApiError(message);
        }
    }

    public void recordSuccess() {
        PricingApiResumeMessage message;
        Instant now = Instant.now(clock);
        synchronized (lock) {
            if (firstFailureAt == null) {
                return;
            }
            message = new PricingApiResumeMessage(now, firstFailureAt, Duration.between(firstFailureAt, now), apiUrl());
            firstFailureAt = null;
            lastNotificationAt = null;
        }
        mailService.notifyApiResume(message);
    }

    public boolean isFailing() {
        synchronized (lock) {
            return firstFailureAt != null;
        }
    }

    private boolean shouldNotify(Instant now) {
        if (lastNotificationAt == null) {
            return true;
        }
        return Duration.between(lastNotificationAt, now).compareTo(notifyInterval) >= 0;
    }

    private String apiUrl() {
        return properties.getPricing().getApiUrl() == null ? null : properties.getPricing().getApiUrl().toString();
    }
}
