package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.config.PriceWatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Retries a single persistence step a bounded number of times. Each step is atomic, so a
 * failed attempt leaves nothing behind and can simply run again.
 */
@Component
public class PersistenceRetrier {

    private static final Logger log = LoggerFactory.getLogger(PersistenceRetrier.class);

    private final int attempts;

    public PersistenceRetrier(PriceWatchProperties properties) {
        this.attempts = properties.getCheck().getPersistenceAttempts();
    }

    /**
     * @return the step's result, or empty when every attempt failed
     */
    public <T> Optional<T> call(String step, Supplier<T> action) {
        DataAccessException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return Optional.ofNullable(action.get());
            } catch (DataAccessException ex) {
                last = ex;
                log.debug("Persistence step '{}' failed (attempt {}/{})", step, attempt, attempts, ex);
            }
        }
        log.warn("Persistence step '{}' failed after {} attempts", step, attempts, last);
        return Optional.empty();
    }

    public boolean run(String step, Runnable action) {
        return call(step, () -> {
            action.run();
            return Boolean.TRUE;
        }).isPresent();
    }
}
