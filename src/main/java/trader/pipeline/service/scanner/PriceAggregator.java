package trader.pipeline.service.scanner;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import trader.pipeline.client.MarketDataSource;
import trader.pipeline.config.ScannerProperties;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.config.VenueType;
import trader.pipeline.config.metrics.TimerUtils;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.EventType;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.model.PriceQuote;
import trader.pipeline.model.ScanResult;
import trader.pipeline.model.ScannerStats;
import trader.pipeline.model.Spread;
import trader.pipeline.model.VenueHealth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Polls every enabled venue concurrently and turns the responses into one batch of spreads per cycle.
 */
@Slf4j
@Service
public class PriceAggregator {

    private final MarketDataSource marketDataSource;
    private final ScannerProperties properties;
    private final SpreadCalculator spreadCalculator;
    private final PipelineEventBus eventBus;
    private final Counter spreadsDetectedCounter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Scheduler scanScheduler;

    private final List<VenueProperties> venues;
    private final Map<String, VenueCacheEntry> priceCache = new ConcurrentHashMap<>();
    private final Map<String, VenueHealthTracker> venueHealth = new ConcurrentHashMap<>();
    private final Sinks.Many<List<Spread>> spreadSink = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<ScanResult> scanResultSink = Sinks.many().multicast().directBestEffort();

    private final AtomicLong totalScans = new AtomicLong();
    private final AtomicLong successfulFetches = new AtomicLong();
    private final AtomicLong attemptedFetches = new AtomicLong();

    private volatile Disposable scanLoop;

    public PriceAggregator(MarketDataSource marketDataSource,
                           ScannerProperties properties,
                           SpreadCalculator spreadCalculator,
                           PipelineEventBus eventBus,
                           @Qualifier("spreadsDetectedCounter") Counter spreadsDetectedCounter,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           @Qualifier("scanScheduler") Scheduler scanScheduler) {
        this.marketDataSource = marketDataSource;
        this.properties = properties;
        this.spreadCalculator = spreadCalculator;
        this.eventBus = eventBus;
        this.spreadsDetectedCounter = spreadsDetectedCounter;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.scanScheduler = scanScheduler;
        this.venues = new CopyOnWriteArrayList<>(properties.getVenues());
    }

    /**
     * Runs one scan cycle. Never errors: venue failures and timeouts end up in {@link ScanResult#getErrors()}.
     */
    public Mono<ScanResult> scan(List<String> symbols) {
        return Mono.defer(() -> {
            List<VenueProperties> enabled = getEnabledVenues();
            Instant startedAt = clock.instant();
            return Flux.fromIterable(enabled)
                    .flatMap(venue -> fetchVenue(venue, symbols), Math.max(1, enabled.size()))
                    .collectList()
                    .map(fetches -> assemble(symbols, fetches, startedAt));
        });
    }

    private Mono<VenueFetch> fetchVenue(VenueProperties venue, List<String> symbols) {
        Duration timeout = properties.timeoutFor(venue);
        return TimerUtils.timedMono(
                        () -> marketDataSource.fetchPrices(venue, symbols, timeout),
                        meterRegistry, "pipeline.venue.fetch", "venue", venue.getName())
                .timeout(timeout)
                .map(quotes -> VenueFetch.success(venue.getName(), quotes))
                .defaultIfEmpty(VenueFetch.success(venue.getName(), List.of()))
                .onErrorResume(error -> {
                    log.warn("Failed to fetch prices from {}: {}", venue.getName(), describe(error));
                    return Mono.just(VenueFetch.failure(venue.getName(), describe(error)));
                });
    }

    private ScanResult assemble(List<String> symbols, List<VenueFetch> fetches, Instant startedAt) {
        Map<String, List<PriceQuote>> quotes = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        Instant now = clock.instant();

        for (VenueFetch fetch : fetches) {
            if (!isMonitored(fetch.getVenue())) {
                // removed while the fetch was in flight
                continue;
            }
            VenueHealthTracker health = venueHealth.computeIfAbsent(fetch.getVenue(), VenueHealthTracker::new);
            attemptedFetches.incrementAndGet();
            if (fetch.getError() == null) {
                quotes.put(fetch.getVenue(), fetch.getQuotes());
                priceCache.put(fetch.getVenue(), new VenueCacheEntry(fetch.getQuotes(), now));
                health.recordSuccess(now);
                successfulFetches.incrementAndGet();
            } else {
                errors.put(fetch.getVenue(), fetch.getError());
                health.recordFailure(fetch.getError());
            }
        }
        totalScans.incrementAndGet();

        List<Spread> spreads = spreadCalculator.calculate(
                symbols, quotes.values(), properties.getSignificanceFloorPercent(), now);
        spreadsDetectedCounter.increment(spreads.size());

        return ScanResult.builder()
                .quotes(Collections.unmodifiableMap(quotes))
                .errors(Collections.unmodifiableMap(errors))
                .spreads(Collections.unmodifiableList(spreads))
                .startedAt(startedAt)
                .duration(Duration.between(startedAt, now))
                .build();
    }

    public synchronized void start() {
        if (scanLoop != null && !scanLoop.isDisposed()) {
            log.info("Price aggregator already running");
            return;
        }
        List<String> symbols = List.copyOf(properties.getSymbols());
        log.info("Starting price scan every {} over {} venues for {}",
                properties.getInterval(), getEnabledVenues().size(), symbols);

        // At most one tick waits behind a slow cycle; cycles never overlap.
        scanLoop = Flux.interval(Duration.ZERO, properties.getInterval(), scanScheduler)
                .onBackpressureLatest()
                .concatMap(tick -> runCycle(symbols), 1)
                .subscribe(
                        result -> { },
                        error -> log.error("Price scan loop terminated: {}", error.getMessage(), error)
                );
    }

    public synchronized void stop() {
        if (scanLoop != null) {
            scanLoop.dispose();
            scanLoop = null;
            log.info("Price scan stopped after {} cycles", totalScans.get());
        }
    }

    /**
     * Registers a venue at runtime. The next scan cycle polls it.
     *
     * @throws IllegalArgumentException if the venue is incomplete or its name is already registered
     */
    public synchronized void addVenue(VenueProperties venue) {
        if (venue == null || venue.getName() == null || venue.getName().isBlank()) {
            throw new IllegalArgumentException("Venue name is required");
        }
        if (venue.getType() == null) {
            throw new IllegalArgumentException("Venue type is required for " + venue.getName());
        }
        if (venue.getType() == VenueType.HTTP && (venue.getApiUrl() == null || venue.getApiUrl().isBlank())) {
            throw new IllegalArgumentException("HTTP venue " + venue.getName() + " needs an api-url");
        }
        if (isMonitored(venue.getName())) {
            throw new IllegalArgumentException("Venue already registered: " + venue.getName());
        }
        venues.add(venue);
        log.info("Venue {} ({}) added, {} venues monitored", venue.getName(), venue.getType(), venues.size());
    }

    /**
     * Unregisters a venue and evicts its cached prices and health record.
     *
     * @return false if no venue with that name was registered
     */
    public synchronized boolean removeVenue(String name) {
        boolean removed = venues.removeIf(venue -> venue.getName().equals(name));
        if (removed) {
            priceCache.remove(name);
            venueHealth.remove(name);
            log.info("Venue {} removed, {} venues monitored", name, venues.size());
        }
        return removed;
    }

    public List<VenueProperties> getVenues() {
        return List.copyOf(venues);
    }

    public List<VenueProperties> getEnabledVenues() {
        return venues.stream()
                .filter(VenueProperties::isEnabled)
                .collect(Collectors.toList());
    }

    private boolean isMonitored(String name) {
        return venues.stream().anyMatch(venue -> venue.getName().equals(name));
    }

    public ScannerStats getStats() {
        List<String> names = getEnabledVenues().stream()
                .map(VenueProperties::getName)
                .collect(Collectors.toList());
        return ScannerStats.builder()
                .running(isRunning())
                .totalScans(getTotalScans())
                .successRate(getSuccessRate())
                .venuesMonitored(names.size())
                .venues(names)
                .build();
    }

    public boolean isRunning() {
        Disposable loop = scanLoop;
        return loop != null && !loop.isDisposed();
    }

    private Mono<ScanResult> runCycle(List<String> symbols) {
        return scan(symbols)
                .doOnNext(this::publish)
                .onErrorResume(error -> {
                    log.error("Scan cycle failed: {}", error.getMessage(), error);
                    return Mono.empty();
                });
    }

    void publish(ScanResult result) {
        scanResultSink.tryEmitNext(result);
        if (!result.getSpreads().isEmpty()) {
            log.debug("Scan produced {} spreads", result.getSpreads().size());
            spreadSink.tryEmitNext(result.getSpreads());
            eventBus.publish(PipelineEvent.builder()
                    .type(EventType.SPREADS)
                    .timestamp(clock.instant())
                    .spreads(result.getSpreads())
                    .build());
        }
        long scans = totalScans.get();
        if (scans % 100 == 0) {
            log.info("Scan #{} | {} ms | venue success rate {}%",
                    scans, result.getDuration().toMillis(), String.format("%.2f", getSuccessRate()));
        }
    }

    /**
     * One list per scan cycle that found at least one significant spread.
     */
    public Flux<List<Spread>> spreads() {
        return spreadSink.asFlux();
    }

    public Flux<ScanResult> scanResults() {
        return scanResultSink.asFlux();
    }

    public List<PriceQuote> getPrices(String venue) {
        VenueCacheEntry entry = priceCache.get(venue);
        if (entry == null || isStale(entry)) {
            return List.of();
        }
        return entry.getQuotes();
    }

    public Map<String, List<PriceQuote>> getAllPrices() {
        Map<String, List<PriceQuote>> prices = new LinkedHashMap<>();
        priceCache.forEach((venue, entry) -> {
            if (!isStale(entry)) {
                prices.put(venue, entry.getQuotes());
            }
        });
        return prices;
    }

    public List<Spread> getTopSpreads(int limit) {
        List<Spread> spreads = spreadCalculator.calculate(
                properties.getSymbols(), getAllPrices().values(), properties.getSignificanceFloorPercent(), clock.instant());
        return spreads.stream().limit(limit).collect(Collectors.toList());
    }

    public List<VenueHealth> getVenueHealth() {
        List<VenueHealth> health = new ArrayList<>();
        venueHealth.values().forEach(tracker -> health.add(tracker.snapshot()));
        return health;
    }

    public long getTotalScans() {
        return totalScans.get();
    }

    public double getSuccessRate() {
        long attempted = attemptedFetches.get();
        return attempted == 0 ? 0 : successfulFetches.get() * 100.0 / attempted;
    }

    private boolean isStale(VenueCacheEntry entry) {
        return Duration.between(entry.getFetchedAt(), clock.instant()).compareTo(properties.getPriceCacheTtl()) > 0;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    @PreDestroy
    public void onDestroy() {
        stop();
    }

    @Value
    static class VenueCacheEntry {
        List<PriceQuote> quotes;
        Instant fetchedAt;
    }

    @Value
    static class VenueFetch {
        String venue;
        List<PriceQuote> quotes;
        String error;

        static VenueFetch success(String venue, List<PriceQuote> quotes) {
            return new VenueFetch(venue, quotes, null);
        }

        static VenueFetch failure(String venue, String error) {
            return new VenueFetch(venue, List.of(), error);
        }
    }

    static class VenueHealthTracker {
        private final String venue;
        private long totalFetches;
        private long failedFetches;
        private int consecutiveFailures;
        private String lastError;
        private Instant lastSuccessAt;

        VenueHealthTracker(String venue) {
            this.venue = venue;
        }

        synchronized void recordSuccess(Instant at) {
            totalFetches++;
            consecutiveFailures = 0;
            lastSuccessAt = at;
        }

        synchronized void recordFailure(String error) {
            totalFetches++;
            failedFetches++;
            consecutiveFailures++;
            lastError = error;
        }

        synchronized VenueHealth snapshot() {
            return VenueHealth.builder()
                    .venue(venue)
                    .totalFetches(totalFetches)
                    .failedFetches(failedFetches)
                    .consecutiveFailures(consecutiveFailures)
                    .lastError(lastError)
                    .lastSuccessAt(lastSuccessAt)
                    .build();
        }
    }
}
