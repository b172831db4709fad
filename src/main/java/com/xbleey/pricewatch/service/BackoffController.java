package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.FailureKind;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Random;

/**
 * Decides whether a failed pricing call is retried within the cycle and how long to wait.
 */
@Component
public class BackoffController {

    private final Duration base;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final Random random;

    public BackoffController(PriceWatchProperties properties, Random backoffRandom) {
        this.base = properties.getBackoff().getBase();
        this.maxDelay = properties.getBackoff().getMaxDelay();
        this.maxAttempts = properties.getBackoff().getMaxAttempts();
        this.random = backoffRandom;
    }

    /**
     * @param attempt number of attempts already made for the item in this cycle, starting at 1
     */
    public boolean shouldRetry(FailureKind kind, int attempt) {
        return kind != null && kind.retryable() && attempt < maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * {@code base * 2^attempt} capped at the max delay, plus jitter in {@code [0, delay)}.
     */
    public Duration delayFor(int attempt) {
        long baseMillis = base.toMillis();
        long capMillis = maxDelay.toMillis();
        int shift = Math.min(Math.max(attempt, 0), 30);
        long delay = baseMillis > (capMillis >> shift) ? capMillis : Math.min(capMillis, baseMillis << shift);
        if (delay <= 0) {
            return Duration.ZERO;
        }
        long jitter = (long) (random.nextDouble() * delay);
        return Duration.ofMillis(delay + jitter);
    }

    public void pause(int attempt) throws InterruptedException {
        Duration delay = delayFor(attempt);
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
