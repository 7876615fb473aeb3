package com.pricehistory.marketdata.controller;

import com.pricehistory.common.classifier.AssetClassifier;
import com.pricehistory.common.exception.AggregateFetchException;
import com.pricehistory.common.exception.FailureKind;
import com.pricehistory.common.exception.MarketDataException;
import com.pricehistory.common.model.Interval;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.returns.ReturnKind;
import com.pricehistory.common.returns.ReturnsCalculator;
import com.pricehistory.common.returns.ReturnsTable;
import com.pricehistory.common.returns.TimeStep;
import com.pricehistory.marketdata.model.ErrorResponse;
import com.pricehistory.marketdata.model.ReturnsReport;
import com.pricehistory.marketdata.provider.PriceHistoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-data")
public class PriceHistoryController {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryController.class);

    private final PriceHistoryProvider provider;

    public PriceHistoryController(PriceHistoryProvider provider) {
        this.provider = provider;
    }

    @GetMapping("/series/{symbol}")
    public Mono<ResponseEntity<?>> getSeries(@PathVariable String symbol,
                                             @RequestParam(defaultValue = "daily") String period,
                                             @RequestParam(required = false) String interval,
                                             @RequestParam(defaultValue = "true") boolean adjusted) {
        return Mono.defer(() -> provider.fetchSeries(symbol, Period.fromValue(period), interval(interval), adjusted))
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(toErrorResponse("series", e)));
    }

    @GetMapping("/table")
    public Mono<ResponseEntity<?>> getTable(@RequestParam(required = false) List<String> symbols,
                                            @RequestParam(defaultValue = "daily") String period,
                                            @RequestParam(required = false) String interval,
                                            @RequestParam(defaultValue = "true") boolean adjusted) {
        return Mono.defer(() -> provider.fetchTable(symbols, Period.fromValue(period), interval(interval), adjusted))
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(toErrorResponse("table", e)));
    }

    @GetMapping("/returns")
    public Mono<ResponseEntity<?>> getReturns(@RequestParam(required = false) List<String> symbols,
                                              @RequestParam(defaultValue = "daily") String period,
                                              @RequestParam(required = false) String interval,
                                              @RequestParam(defaultValue = "true") boolean adjusted,
                                              @RequestParam(defaultValue = "log") String kind) {
        return Mono.defer(() -> {
                Period p = Period.fromValue(period);
                Interval i = interval(interval);
                ReturnKind returnKind = ReturnKind.fromValue(kind);
                double timeStep = TimeStep.of(p, i);
                return provider.fetchTable(symbols, p, i, adjusted)
                    .map(table -> report(ReturnsCalculator.compute(table, returnKind), timeStep));
            })
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(toErrorResponse("returns", e)));
    }

    @GetMapping("/coins")
    public ResponseEntity<List<String>> coins() {
        return ResponseEntity.ok(AssetClassifier.coinNames());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static Interval interval(String raw) {
        return raw == null || raw.isBlank() ? null : Interval.fromValue(raw);
    }

    private static ReturnsReport report(ReturnsTable returns, double timeStep) {
        Map<String, Double> annualized = new LinkedHashMap<>();
        if (!returns.rows().isEmpty()) {
            returns.symbols().forEach(s -> annualized.put(s, returns.mean(s) / timeStep));
        }
        return new ReturnsReport(timeStep, annualized, returns);
    }

    static ResponseEntity<ErrorResponse> toErrorResponse(String operation, Throwable e) {
        if (!(e instanceof MarketDataException mde)) {
            log.error("Unexpected failure. operation={}", operation, e);
            return ResponseEntity.internalServerError()
                .body(new ErrorResponse(null, e.getMessage()));
        }
        FailureKind effective = mde instanceof AggregateFetchException agg ? agg.getCauseKind() : mde.getKind();
        HttpStatus status = statusFor(effective);
        log.warn("Request failed. operation={} kind={} status={} message={}",
                 operation, mde.getKind(), status.value(), mde.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(mde.getKind(), mde.getMessage()));
    }

    static HttpStatus statusFor(FailureKind kind) {
        return switch (kind) {
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case MALFORMED_RESPONSE, UPSTREAM_REJECTED -> HttpStatus.BAD_GATEWAY;
            case RETRY_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case AGGREGATE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
