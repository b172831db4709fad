package com.xbleey.pricewatch.controller;

import com.xbleey.pricewatch.config.PriceWatchProperties;
import com.xbleey.pricewatch.service.CheckCycleCoordinator;
import com.xbleey.pricewatch.service.PricingApiStatusMonitor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness. Readiness needs the database; Redis only caches, so a Redis outage
 * is reported but does not make the service unready.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final Clock clock;
    private final CheckCycleCoordinator coordinator;
    private final PricingApiStatusMonitor statusMonitor;
    private final PriceWatchProperties properties;
    @Nullable
    private final DataSource dataSource;
    @Nullable
    private final RedisConnectionFactory redisConnectionFactory;

    public HealthController(
            Clock clock,
            CheckCycleCoordinator coordinator,
            PricingApiStatusMonitor statusMonitor,
            PriceWatchProperties properties,
            @Nullable DataSource dataSource,
            @Nullable RedisConnectionFactory redisConnectionFactory
    ) {
        this.clock = clock;
        this.coordinator = coordinator;
        this.statusMonitor = statusMonitor;
        this.properties = properties;
        this.dataSource = dataSource;
        this.redisConnectionFactory = redisConnectionFactory;
    }

    @GetMapping("/live")
    public Map<String, Object> liveness() {
        return Map.of(
                "status", "UP",
                "timestamp", Instant.now(clock).toString()
        );
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return readiness();
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> readiness() {
        Map<String, Map<String, Object>> checks = new LinkedHashMap<>();
        boolean ready = database(checks);
        redis(checks);
        checks.put("scheduler", scheduler());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? "UP" : "DOWN");
        body.put("timestamp", Instant.now(clock).toString());
        body.put("checks", checks);
        if (ready) {
            return ResponseEntity.ok(body);
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean database(Map<String, Map<String, Object>> checks) {
        if (dataSource == null) {
            checks.put("database", Map.of("status", "SKIPPED"));
            return true;
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(VALIDATION_TIMEOUT_SECONDS);
            checks.put("database", valid
                    ? Map.of("status", "UP")
                    : down("Connection validation returned false"));
            return valid;
        } catch (Exception ex) {
            checks.put("database", down(describe(ex)));
            return false;
        }
    }

    private void redis(Map<String, Map<String, Object>> checks) {
        if (redisConnectionFactory == null) {
            checks.put("redis", Map.of("status", "SKIPPED"));
            return;
        }
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            String ping = connection.ping();
            checks.put("redis", "PONG".equalsIgnoreCase(ping)
                    ? Map.of("status", "UP")
                    : down("Unexpected ping response: " + orDash(ping)));
        } catch (Exception ex) {
            checks.put("redis", down(describe(ex)));
        }
    }

    private Map<String, Object> scheduler() {
        Map<String, Object> scheduler = new LinkedHashMap<>();
        scheduler.put("mode", properties.getPricing().isLiveQueryEnabled() ? "LIVE" : "DAILY_SUMMARY");
        scheduler.put("cycleRunning", coordinator.isRunning());
        scheduler.put("pricingApi", statusMonitor.isFailing() ? "FAILING" : "OK");
        return scheduler;
    }

    private static Map<String, Object> down(String message) {
        return Map.of("status", "DOWN", "message", message);
    }

    private static String describe(Exception ex) {
        return ex.getClass().getSimpleName() + ": " + orDash(ex.getMessage());
    }

    private static String orDash(String message) {
        return message == null || message.isBlank() ? "-" : message;
    }
}
