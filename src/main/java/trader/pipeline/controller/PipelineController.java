package trader.pipeline.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import trader.pipeline.config.VenueProperties;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.ConfigUpdate;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.service.orchestrator.ArbitrageOrchestrator;
import trader.pipeline.service.orchestrator.ModeChangeRejectedException;
import trader.pipeline.service.scanner.PriceAggregator;

import java.util.Map;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineController {
    private static final int DEFAULT_LIMIT = 20;

    private final ArbitrageOrchestrator orchestrator;
    private final PriceAggregator priceAggregator;
    private final PipelineEventBus eventBus;

    @Bean
    public RouterFunction<ServerResponse> pipelineRoutes() {
        return RouterFunctions.route()
                .path("/pipeline", this::buildPipelineRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildPipelineRoutes() {
        return RouterFunctions.route()
                .GET("/status", this::handleStatus)
                .GET("/stats/daily", this::handleDailyStats)
                .POST("/start", this::handleStart)
                .POST("/stop", this::handleStop)
                .PUT("/config", this::handleUpdateConfig)
                .POST("/circuit-breaker/reset", this::handleResetCircuitBreaker)
                .GET("/spreads", this::handleSpreads)
                .GET("/prices", this::handlePrices)
                .GET("/venues/health", this::handleVenueHealth)
                .GET("/venues", this::handleVenues)
                .POST("/venues", this::handleAddVenue)
                .DELETE("/venues/{name}", this::handleRemoveVenue)
                .GET("/scanner/stats", this::handleScannerStats)
                .GET("/trades", this::handleTrades)
                .GET("/events", this::handleEvents)
                .onError(IllegalArgumentException.class, (error, request) -> errorResponse(HttpStatus.BAD_REQUEST, error))
                .onError(ServerWebInputException.class, (error, request) -> errorResponse(HttpStatus.BAD_REQUEST, error))
                .onError(ModeChangeRejectedException.class, (error, request) -> errorResponse(HttpStatus.CONFLICT, error))
                .build();
    }

    private Mono<ServerResponse> handleStatus(ServerRequest request) {
        return ServerResponse.ok().bodyValue(orchestrator.getStatus());
    }

    private Mono<ServerResponse> handleDailyStats(ServerRequest request) {
        return ServerResponse.ok().bodyValue(orchestrator.getDailyStats());
    }

    private Mono<ServerResponse> handleStart(ServerRequest request) {
        if (!orchestrator.start()) {
            return ServerResponse.status(HttpStatus.CONFLICT)
                    .bodyValue(Map.of("error", "Pipeline was halted by the kill switch and cannot be restarted"));
        }
        return ServerResponse.ok().bodyValue(orchestrator.getStatus());
    }

    private Mono<ServerResponse> handleStop(ServerRequest request) {
        orchestrator.stop();
        return ServerResponse.ok().bodyValue(orchestrator.getStatus());
    }

    private Mono<ServerResponse> handleUpdateConfig(ServerRequest request) {
        return request.bodyToMono(ConfigUpdate.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Configuration body is required")))
                .flatMap(update -> {
                    orchestrator.updateConfig(update);
                    return ServerResponse.ok().bodyValue(orchestrator.getStatus());
                });
    }

    private Mono<ServerResponse> handleResetCircuitBreaker(ServerRequest request) {
        orchestrator.resetCircuitBreaker();
        return ServerResponse.ok().bodyValue(orchestrator.getStatus());
    }

    private Mono<ServerResponse> handleSpreads(ServerRequest request) {
        return Mono.fromCallable(() -> parseLimit(request))
                .flatMap(limit -> ServerResponse.ok().bodyValue(priceAggregator.getTopSpreads(limit)));
    }

    private Mono<ServerResponse> handlePrices(ServerRequest request) {
        return ServerResponse.ok().bodyValue(priceAggregator.getAllPrices());
    }

    private Mono<ServerResponse> handleVenueHealth(ServerRequest request) {
        return ServerResponse.ok().bodyValue(priceAggregator.getVenueHealth());
    }

    private Mono<ServerResponse> handleVenues(ServerRequest request) {
        return ServerResponse.ok().bodyValue(priceAggregator.getVenues());
    }

    private Mono<ServerResponse> handleAddVenue(ServerRequest request) {
        return request.bodyToMono(VenueProperties.class)
                .switchIfEmpty(Mono.error(new IllegalArgumentException("Venue body is required")))
                .flatMap(venue -> {
                    priceAggregator.addVenue(venue);
                    return ServerResponse.status(HttpStatus.CREATED).bodyValue(priceAggregator.getStats());
                });
    }

    private Mono<ServerResponse> handleRemoveVenue(ServerRequest request) {
        String name = request.pathVariable("name");
        if (!priceAggregator.removeVenue(name)) {
            return ServerResponse.status(HttpStatus.NOT_FOUND)
                    .bodyValue(Map.of("error", "Unknown venue: " + name));
        }
        return ServerResponse.ok().bodyValue(priceAggregator.getStats());
    }

    private Mono<ServerResponse> handleScannerStats(ServerRequest request) {
        return ServerResponse.ok().bodyValue(priceAggregator.getStats());
    }

    private Mono<ServerResponse> handleTrades(ServerRequest request) {
        return Mono.fromCallable(() -> parseLimit(request))
                .flatMap(limit -> ServerResponse.ok().bodyValue(orchestrator.getRecentTrades(limit)));
    }

    private Mono<ServerResponse> handleEvents(ServerRequest request) {
        Flux<ServerSentEvent<PipelineEvent>> events = eventBus.events()
                .onBackpressureDrop()
                .map(event -> ServerSentEvent.builder(event)
                        .event(event.getType().name())
                        .build());
        return ServerResponse.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(BodyInserters.fromServerSentEvents(events));
    }

    private int parseLimit(ServerRequest request) {
        int limit = request.queryParam("limit")
                .map(value -> {
                    try {
                        return Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid limit: " + value);
                    }
                })
                .orElse(DEFAULT_LIMIT);
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return limit;
    }

    private Mono<ServerResponse> errorResponse(HttpStatus status, Throwable error) {
        log.warn("Request rejected with {}: {}", status.value(), error.getMessage());
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ServerResponse.status(status).bodyValue(Map.of("error", message));
    }
}
