package com.supplyradar.api;

import com.supplyradar.api.dto.TokenResponse;
import com.supplyradar.history.SupplyHistory;
import com.supplyradar.history.SupplyHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;

/**
 * GET /api/v1/supply/history and /tokens. Collection blocks on RPC, so it runs on boundedElastic.
 */
@RestController
@RequestMapping("/api/v1/supply")
@RequiredArgsConstructor
public class SupplyHistoryController {

    private final SupplyHistoryService supplyHistoryService;

    @GetMapping("/history")
    public Mono<SupplyHistory> history(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return Mono.fromCallable(() -> supplyHistoryService.collectWithDefaults(from, to))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tokens")
    public List<TokenResponse> tokens() {
        return supplyHistoryService.configuredQueries().stream()
                .map(TokenResponse::from)
                .toList();
    }
}
