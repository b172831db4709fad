package com.xbleey.pricewatch.controller;

import com.xbleey.pricewatch.service.CheckCycleCoordinator;
import com.xbleey.pricewatch.service.CycleReport;
import com.xbleey.pricewatch.service.PricingRateLimiter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
public class CycleController {

    private final CheckCycleCoordinator coordinator;
    private final PricingRateLimiter rateLimiter;

    public CycleController(CheckCycleCoordinator coordinator, PricingRateLimiter rateLimiter) {
        this.coordinator = coordinator;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Runs a cycle on the calling thread; answers 409 when one is already running.
     */
    @PostMapping("/cycles/run")
    public ResponseEntity<Map<String, Object>> runCycle() {
        Optional<CycleReport> report = coordinator.runCycle();
        if (report.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "dropped"));
        }
        CycleReport value = report.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("cycleId", value.cycleId());
        body.put("durationMs", value.duration().toMillis());
        body.put("items", value.items());
        body.put("checked", value.checked());
        body.put("skipped", value.skipped());
        body.put("deferred", value.deferred());
        body.put("stale", value.stale());
        body.put("failed", value.failed());
        body.put("abandoned", value.abandoned());
        body.put("notificationsCreated", value.notificationsCreated());
        body.put("notificationsDelivered", value.notificationsDelivered());
        body.put("redelivered", value.redelivered());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/pricing/rate")
    public Map<String, Object> currentRate() {
        return Map.of("requestsPerSecond", rateLimiter.currentRate());
    }

    @PutMapping("/pricing/rate")
    public Map<String, Object> adjustRate(@RequestParam("value") double requestsPerSecond) {
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("value must be a positive number");
        }
        double applied = rateLimiter.adjustRate(requestsPerSecond);
        return Map.of(
                "status", "ok",
                "requestsPerSecond", applied
        );
    }
}
