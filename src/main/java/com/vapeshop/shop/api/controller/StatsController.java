package com.vapeshop.shop.api.controller;

import com.vapeshop.shop.domain.model.Stats;
import com.vapeshop.shop.service.StatsAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin statistics endpoint.
 *
 * @author Vape Shop Team
 */
@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final StatsAggregator statsAggregator;

    public StatsController(StatsAggregator statsAggregator) {
        this.statsAggregator = statsAggregator;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Stats> getStats() {
        return ResponseEntity.ok(statsAggregator.get());
    }
}
