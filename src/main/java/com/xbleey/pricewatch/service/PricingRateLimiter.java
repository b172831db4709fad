package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every outbound pricing call of the process.
 */
@Component
public class PricingRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(PricingRateLimiter.class);
    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final int burst;
    private final double floor;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition refilled = lock.newCondition();
    private double rate;
    private double tokens;
    private long lastRefillNanos;

    @Autowired
    public PricingRateLimiter(PriceWatchProperties properties) {
        this(
                properties.getPricing().getRequestsPerSecond(),
                properties.getPricing().effectiveFloor(),
                properties.getPricing().getBurst()
        );
    }

    PricingRateLimiter(double requestsPerSecond, double floor, int burst) {
        this.burst = burst;
        this.floor = floor;
        this.rate = Math.max(requestsPerSecond, floor);
        this.tokens = burst;
        this.lastRefillNanos = System.nanoTime();
    }

    /**
     * Takes one token, waiting at most {@code timeout} for it.
     *
     * @return true when a token was granted, false when the timeout elapsed first
     */
    public boolean acquire(Duration timeout) throws InterruptedException {
        long remaining = timeout == null ? 0 : Math.max(0, timeout.toNanos());
        lock.lockInterruptibly();
        try {
            while (true) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return true;
                }
                if (remaining <= 0) {
                    return false;
                }
                long untilNextToken = (long) Math.ceil((1.0 - tokens) / rate * NANOS_PER_SECOND);
                remaining = refilled.awaitNanos(Math.min(Math.max(untilNextToken, 1L), remaining));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a performance tier signal. The rate never drops below the configured floor.
     */
    public double adjustRate(double requestsPerSecond) {
        lock.lock();
        try {
            refill();
            double previous = rate;
            rate = Math.max(requestsPerSecond, floor);
            refilled.signalAll();
            if (previous != rate) {
                log.info("Pricing rate changed {} -> {} req/s", previous, rate);
            }
            return rate;
        } finally {
            lock.unlock();
        }
    }

    public double currentRate() {
        lock.lock();
        try {
            return rate;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = System.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(burst, tokens + elapsed * rate / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }
}
