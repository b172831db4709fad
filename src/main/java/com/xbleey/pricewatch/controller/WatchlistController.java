package com.xbleey.pricewatch.controller;

import com.xbleey.pricewatch.model.PriceObservation;
import com.xbleey.pricewatch.model.WatchlistItem;
import com.xbleey.pricewatch.service.WatchlistService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/watchlist")
public class WatchlistController {

    private final WatchlistService watchlistService;

    public WatchlistController(WatchlistService watchlistService) {
        this.watchlistService = watchlistService;
    }

    @PostMapping
    public ResponseEntity<WatchlistItem> add(@RequestBody AddItemRequest request) {
        WatchlistItem created = watchlistService.add(
                request.ownerId(),
                request.productId(),
                request.initialPrice(),
                request.targetPrice(),
                request.title()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<WatchlistItem> list(@RequestParam("ownerId") String ownerId) {
        return watchlistService.list(ownerId);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable("id") Long id) {
        if (!watchlistService.remove(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("status", "not_found", "id", id));
        }
        return ResponseEntity.ok(Map.of("status", "removed", "id", id));
    }

    @PostMapping("/{id}/reactivate")
    public ResponseEntity<Map<String, Object>> reactivate(@PathVariable("id") Long id) {
        if (!watchlistService.reactivate(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("status", "not_stale", "id", id));
        }
        return ResponseEntity.ok(Map.of("status", "active", "id", id));
    }

    @GetMapping("/{id}/observations")
    public List<PriceObservation> observations(
            @PathVariable("id") Long id,
            @RequestParam(name = "length", defaultValue = "100") int length
    ) {
        return watchlistService.observations(id, length);
    }

    public record AddItemRequest(
            String ownerId,
            String productId,
            BigDecimal initialPrice,
            BigDecimal targetPrice,
            String title
    ) {
    }
}
