package com.xbleey.pricewatch.service;

import com.xbleey.pricewatch.client.PriceQuerier;
import com.xbleey.pricewatch.client.PriceQueryException;
import com.xbleey.pricewatch.client.PriceQuote;
import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.enums.FailureKind;
import com.xbleey.pricewatch.enums.PricingRegion;
import com.xbleey.pricewatch.model.ItemCheckResult;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.repository.ItemStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs check cycles over the watchlist. At most one cycle runs at a time; a tick that arrives
 * while one is in flight is dropped. Items of a cycle are checked by a bounded worker pool that
 * shares the single {@link PricingRateLimiter}.
 */
@Service
public class CheckCycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CheckCycleCoordinator.class);
    private static final String CYCLE_ID_KEY = "cycle.id";

    private final ItemStore itemStore;
    private final PriceQuerier priceQuerier;
    private final PricingRateLimiter rateLimiter;
    private final BackoffController backoff;
    private final PriceStateMachine stateMachine;
    private final NotificationDispatcher dispatcher;
    private final PricingApiStatusMonitor statusMonitor;
    private final PersistenceRetrier persistence;
    private final PriceWatchProperties properties;
    private final Clock clock;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public CheckCycleCoordinator(
            ItemStore itemStore,
            PriceQuerier priceQuerier,
            PricingRateLimiter rateLimiter,
            BackoffController backoff,
            PriceStateMachine stateMachine,
            NotificationDispatcher dispatcher,
            PricingApiStatusMonitor statusMonitor,
            PersistenceRetrier persistence,
            PriceWatchProperties properties,
            Clock clock
    ) {
        this.itemStore = itemStore;
        this.priceQuerier = priceQuerier;
        this.rateLimiter = rateLimiter;
        this.backoff = backoff;
        this.stateMachine = stateMachine;
        this.dispatcher = dispatcher;
        this.statusMonitor = statusMonitor;
        this.persistence = persistence;
        this.properties = properties;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(properties.getCheck().getWorkers(), workerThreadFactory());
    }

    @Scheduled(
            fixedRateString = "#{@priceWatchProperties.check.intervalHours * 3600000L}",
            initialDelayString = "#{@priceWatchProperties.check.initialDelay.toMillis()}"
    )
    public void onTick() {
        if (!properties.getPricing().isLiveQueryEnabled()) {
            log.debug("Skip check tick: live price queries disabled");
            return;
        }
        runCycle();
    }

    /**
     * @return the cycle's report, or empty when the cycle was dropped because another one is
     * running or the coordinator is shutting down
     */
    public Optional<CycleReport> runCycle() {
        if (shuttingDown.get()) {
            log.info("Check cycle not started: shutting down");
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Check cycle tick dropped: previous cycle still running");
            return Optional.empty();
        }
        String cycleId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            return Optional.of(executeCycle(cycleId));
        } finally {
            MDC.remove(CYCLE_ID_KEY);
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        workers.shutdownNow();
        try {
            Duration grace = properties.getPricing().getCallTimeout();
            if (!workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Price check workers did not stop within {}", grace);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private CycleReport executeCycle(String cycleId) {
        Instant startedAt = Instant.now(clock);
        int redelivered = dispatcher.redeliverPending();
        List<WatchlistItem> items = persistence.call("load checkable items", itemStore::findCheckableItems)
                .orElse(List.of());
        log.info("Check cycle started: {} items", items.size());

        List<Future<ItemResult>> futures = new ArrayList<>(items.size());
        for (WatchlistItem item : items) {
            try {
                futures.add(workers.submit(withCycleId(cycleId, () -> checkItem(item))));
            } catch (RejectedExecutionException ex) {
                log.info("Check cycle stopped submitting items: workers shut down");
                break;
            }
        }

        Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
        int created = 0;
        int delivered = 0;
        boolean interrupted = false;
        for (Future<ItemResult> future : futures) {
            ItemResult result;
            if (interrupted) {
                future.cancel(true);
                result = ItemResult.of(ItemOutcome.ABANDONED);
            } else {
                try {
                    result = future.get();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    future.cancel(true);
                    result = ItemResult.of(ItemOutcome.ABANDONED);
                } catch (CancellationException ex) {
                    result = ItemResult.of(ItemOutcome.ABANDONED);
                } catch (ExecutionException ex) {
                    if (ex.getCause() instanceof InterruptedException) {
                        result = ItemResult.of(ItemOutcome.ABANDONED);
                    } else {
                        log.warn("Item check failed unexpectedly", ex.getCause());
                        result = ItemResult.of(ItemOutcome.FAILED);
                    }
                }
            }
            counts.merge(result.outcome(), 1, Integer::sum);
            if (result.notificationCreated()) {
                created++;
            }
            delivered += result.notificationsDelivered();
        }
        int abandoned = counts.getOrDefault(ItemOutcome.ABANDONED, 0) + items.size() - futures.size();

        CycleReport report = new CycleReport(
                cycleId,
                startedAt,
                Instant.now(clock),
                items.size(),
                counts.getOrDefault(ItemOutcome.CHECKED, 0),
                counts.getOrDefault(ItemOutcome.SKIPPED, 0),
                counts.getOrDefault(ItemOutcome.DEFERRED, 0),
                counts.getOrDefault(ItemOutcome.STALE, 0),
                counts.getOrDefault(ItemOutcome.FAILED, 0),
                abandoned,
                created,
                delivered,
                redelivered
        );
        log.info("Check cycle finished in {}: checked={} skipped={} deferred={} stale={} failed={} abandoned={} "
                        + "notifications created={} delivered={} redelivered={}",
                report.duration(), report.checked(), report.skipped(), report.deferred(), report.stale(),
                report.failed(), report.abandoned(), created, delivered, redelivered);
        return report;
    }

    private ItemResult checkItem(WatchlistItem item) throws InterruptedException {
        if (shuttingDown.get() || Thread.currentThread().isInterrupted()) {
            return ItemResult.of(ItemOutcome.ABANDONED);
        }
        PricingRegion region = properties.getPricing().getRegion();
        Duration acquireTimeout = properties.getPricing().getAcquireTimeout();
        int attempt = 0;
        while (true) {
            if (!rateLimiter.acquire(acquireTimeout)) {
                log.info("Item {} skipped this cycle: no pricing slot within {}", item.getId(), acquireTimeout);
                return ItemResult.of(ItemOutcome.SKIPPED);
            }
            attempt++;
            FailureKind kind;
            String detail;
            try {
                PriceQuote quote = priceQuerier.query(item.getProductId(), region);
                if (quote == null || quote.price() == null) {
                    throw PriceQueryException.transientFailure("No price returned for " + item.getProductId());
                }
                statusMonitor.recordSuccess();
                if (shuttingDown.get()) {
                    return ItemResult.of(ItemOutcome.ABANDONED);
                }
                return applyPrice(item, quote);
            } catch (PriceQueryException ex) {
                kind = ex.kind();
                detail = ex.getMessage();
            } catch (RuntimeException ex) {
                log.debug("Unexpected pricing error for item {}", item.getId(), ex);
                kind = FailureKind.TRANSIENT;
                detail = ex.getClass().getSimpleName() + ": " + ex.getMessage();
            }
            if (shuttingDown.get() || Thread.currentThread().isInterrupted()) {
                log.debug("Item {} abandoned: shutdown interrupted its pricing call", item.getId());
                return ItemResult.of(ItemOutcome.ABANDONED);
            }
            if (kind == FailureKind.PERMANENT) {
                return applyPermanentFailure(item, detail);
            }
            if (backoff.shouldRetry(kind, attempt)) {
                log.debug("Item {} attempt {}/{} failed ({}), retrying: {}",
                        item.getId(), attempt, backoff.maxAttempts(), kind, detail);
                backoff.pause(attempt - 1);
                continue;
            }
            statusMonitor.recordFailure(kind + ": " + detail);
            return applyRetriesExhausted(item, kind, detail);
        }
    }

    private ItemResult applyPrice(WatchlistItem item, PriceQuote quote) {
        Optional<Optional<BigDecimal>> pending = persistence.call("load pending notification of item " + item.getId(),
                () -> itemStore.findLowestPendingPrice(item.getId()));
        if (pending.isEmpty()) {
            return ItemResult.of(ItemOutcome.FAILED);
        }
        ItemCheckResult result = stateMachine.onPrice(item, quote, pending.get().orElse(null), Instant.now(clock));
        ItemOutcome outcome = apply(result);
        if (outcome != ItemOutcome.CHECKED || !result.hasNotification()) {
            return ItemResult.of(outcome);
        }
        int delivered = dispatcher.deliverPending(item.getId());
        return new ItemResult(ItemOutcome.CHECKED, true, delivered);
    }

    private ItemResult applyPermanentFailure(WatchlistItem item, String detail) {
        ItemCheckResult result = stateMachine.onPermanentFailure(item, detail, Instant.now(clock));
        ItemOutcome outcome = apply(result);
        if (outcome == ItemOutcome.CHECKED) {
            dispatcher.notifyPermanentFailure(result.item());
            return ItemResult.of(ItemOutcome.STALE);
        }
        return ItemResult.of(outcome);
    }

    private ItemResult applyRetriesExhausted(WatchlistItem item, FailureKind kind, String detail) {
        log.warn("Item {} ({}) deferred to next cycle after {} attempts: {}",
                item.getId(), item.getProductId(), backoff.maxAttempts(), detail);
        ItemCheckResult result = stateMachine.onRetriesExhausted(item, kind, detail, Instant.now(clock));
        ItemOutcome outcome = apply(result);
        return ItemResult.of(outcome == ItemOutcome.CHECKED ? ItemOutcome.DEFERRED : outcome);
    }

    private ItemOutcome apply(ItemCheckResult result) {
        Long itemId = result.item().getId();
        Optional<Boolean> applied = persistence.call("apply check of item " + itemId,
                () -> itemStore.applyCheck(result));
        if (applied.isEmpty()) {
            return ItemOutcome.FAILED;
        }
        if (!applied.get()) {
            log.info("Item {} changed during its check (removed or newer result), result discarded", itemId);
            return ItemOutcome.SKIPPED;
        }
        return ItemOutcome.CHECKED;
    }

    private static <T> Callable<T> withCycleId(String cycleId, Callable<T> task) {
        return () -> {
            MDC.put(CYCLE_ID_KEY, cycleId);
            try {
                return task.call();
            } finally {
                MDC.remove(CYCLE_ID_KEY);
            }
        };
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "price-check-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record ItemResult(ItemOutcome outcome, boolean notificationCreated, int notificationsDelivered) {

        static ItemResult of(ItemOutcome outcome) {
            return new ItemResult(outcome, false, 0);
        }
    }
}
