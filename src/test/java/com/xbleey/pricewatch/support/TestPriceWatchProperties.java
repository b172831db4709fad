package com.xbleey.pricewatch.support;

import com.xbleey.pricewatch.config.PriceWatchProperties;

import java.net.URI;
import java.time.Duration;

public final class TestPriceWatchProperties {

    private TestPriceWatchProperties() {
    }

    /**
     * Valid properties with a fast rate limit and millisecond backoff, so tests do not sleep.
     */
    public static PriceWatchProperties fast() {
        PriceWatchProperties properties = new PriceWatchProperties();
        properties.getPricing().setApiUrl(URI.create("http://localhost:8090"));
        properties.getPricing().setRequestsPerSecond(1000);
        properties.getPricing().setBurst(100);
        properties.getPricing().setAcquireTimeout(Duration.ofSeconds(5));
        properties.getCheck().setWorkers(4);
        properties.getCheck().setPersistenceAttempts(3);
        properties.getBackoff().setBase(Duration.ofMillis(1));
        properties.getBackoff().setMaxDelay(Duration.ofMillis(5));
        properties.getBackoff().setMaxAttempts(3);
        properties.getBackoff().setFailureStaleThreshold(3);
        return properties;
    }
}
