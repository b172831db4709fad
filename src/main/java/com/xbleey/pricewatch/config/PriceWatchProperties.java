package com.xbleey.pricewatch.config;

import com.xbleey.pricewatch.enums.PricingRegion;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Scheduler configuration. Bound and validated once at startup; an invalid value aborts the
 * application context.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pricewatch")
public class PriceWatchProperties {

    private Pricing pricing = new Pricing();
    private Check check = new Check();
    private Backoff backoff = new Backoff();
    private DailySummary dailySummary = new DailySummary();
    private Telegram telegram = new Telegram();

    @Data
    public static class Pricing {

        private boolean liveQueryEnabled = true;
        private URI apiUrl;
        private PricingRegion region = PricingRegion.IT;
        private double requestsPerSecond = 1.0;
        private Double requestsPerSecondFloor;
        private int burst = 1;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(10);
        private String affiliateTag;

        public double effectiveFloor() {
            return requestsPerSecondFloor == null ? requestsPerSecond : requestsPerSecondFloor;
        }
    }

    @Data
    public static class Check {

        private int intervalHours = 6;
        private Duration initialDelay = Duration.ofSeconds(30);
        private int workers = 4;
        private int persistenceAttempts = 3;
    }

    @Data
    public static class Backoff {

        private Duration base = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private int failureStaleThreshold = 3;
    }

    @Data
    public static class DailySummary {

        private int hour = 9;
        private int minute = 0;
        private ZoneId zone = ZoneId.of("Europe/Rome");
        private Map<String, String> ownerTimes = new HashMap<>();

        public LocalTime time() {
            return LocalTime.of(hour, minute);
        }

        public LocalTime timeFor(String ownerId) {
            String override = ownerTimes == null || ownerId == null ? null : ownerTimes.get(ownerId);
            if (override == null || override.isBlank()) {
                return time();
            }
            return LocalTime.parse(override.trim());
        }
    }

    @Data
    public static class Telegram {

        private URI apiUrl = URI.create("https://api.telegram.org");
        private String botToken;
    }

    @PostConstruct
    public void validate() {
        if (pricing.isLiveQueryEnabled()) {
            if (pricing.getApiUrl() == null) {
                throw new IllegalStateException("pricewatch.pricing.api-url must be configured when live queries are enabled");
            }
            if (pricing.getRegion() == null) {
                throw new IllegalStateException("pricewatch.pricing.region must be configured when live queries are enabled");
            }
        }
        if (pricing.getRequestsPerSecond() <= 0) {
            throw new IllegalStateException("pricewatch.pricing.requests-per-second must be > 0");
        }
        if (pricing.effectiveFloor() <= 0 || pricing.effectiveFloor() > pricing.getRequestsPerSecond()) {
            throw new IllegalStateException("pricewatch.pricing.requests-per-second-floor must be > 0 and <= requests-per-second");
        }
        if (pricing.getBurst() < 1) {
            throw new IllegalStateException("pricewatch.pricing.burst must be >= 1");
        }
        requirePositive(pricing.getAcquireTimeout(), "pricewatch.pricing.acquire-timeout");
        requirePositive(pricing.getCallTimeout(), "pricewatch.pricing.call-timeout");
        if (check.getIntervalHours() < 1) {
            throw new IllegalStateException("pricewatch.check.interval-hours must be >= 1");
        }
        if (check.getWorkers() < 1) {
            throw new IllegalStateException("pricewatch.check.workers must be >= 1");
        }
        if (check.getPersistenceAttempts() < 1) {
            throw new IllegalStateException("pricewatch.check.persistence-attempts must be >= 1");
        }
        requirePositive(backoff.getBase(), "pricewatch.backoff.base");
        requirePositive(backoff.getMaxDelay(), "pricewatch.backoff.max-delay");
        if (backoff.getMaxAttempts() < 1) {
            throw new IllegalStateException("pricewatch.backoff.max-attempts must be >= 1");
        }
        if (backoff.getFailureStaleThreshold() < 1) {
            throw new IllegalStateException("pricewatch.backoff.failure-stale-threshold must be >= 1");
        }
        validateDailySummary();
    }

    private void validateDailySummary() {
        if (dailySummary.getZone() == null) {
            throw new IllegalStateException("pricewatch.daily-summary.zone must be configured");
        }
        try {
            dailySummary.time();
        } catch (DateTimeException ex) {
            throw new IllegalStateException("pricewatch.daily-summary.hour/minute is not a valid time of day", ex);
        }
        if (dailySummary.getOwnerTimes() == null) {
            return;
        }
        for (Map.Entry<String, String> entry : dailySummary.getOwnerTimes().entrySet()) {
            try {
                dailySummary.timeFor(entry.getKey());
            } catch (DateTimeException ex) {
                throw new IllegalStateException(
                        "pricewatch.daily-summary.owner-times." + entry.getKey() + " must be HH:mm", ex
                );
            }
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException(name + " must be > 0");
        }
    }
}
