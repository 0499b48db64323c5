package com.chartsayer.position.controller;

import com.chartsayer.common.model.Platform;
import com.chartsayer.common.model.Position;
import com.chartsayer.common.model.PositionOwner;
import com.chartsayer.common.model.PositionStatus;
import com.chartsayer.common.model.PositionUpdateRequest;
import com.chartsayer.common.model.PositionsSummary;
import com.chartsayer.position.service.PositionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

/**
 * REST API over the position registry for the bot and webhook front ends.
 * Mutations act on behalf of the owner named by the {@code X-User-Id} and
 * {@code X-Platform} headers.
 */
@RestController
@RequestMapping("/api/v1/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    static final String USER_HEADER     = "X-User-Id";
    static final String PLATFORM_HEADER = "X-Platform";

    private final PositionService positionService;

    public PositionController(PositionService positionService) {
        this.positionService = positionService;
    }

    @PostMapping
    public Mono<ResponseEntity<Position>> createPosition(@RequestBody Map<String, Object> body) {
        log.info("Position create requested. userId={} symbol={}", body.get("user_id"), body.get("symbol"));
        return positionService.createPosition(body)
            .map(p -> ResponseEntity.status(HttpStatus.CREATED).body(p));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<Position>> getPosition(@PathVariable UUID id) {
        return positionService.getPosition(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<Position>> updatePosition(@PathVariable UUID id,
                                                         @RequestHeader(USER_HEADER) String userId,
                                                         @RequestHeader(PLATFORM_HEADER) String platform,
                                                         @RequestBody PositionUpdateRequest update) {
        log.info("Position update requested. id={} userId={}", id, userId);
        return positionService.updatePosition(id, owner(userId, platform), update)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/stop")
    public Mono<ResponseEntity<Position>> stopPosition(@PathVariable UUID id,
                                                       @RequestHeader(USER_HEADER) String userId,
                                                       @RequestHeader(PLATFORM_HEADER) String platform) {
        log.info("Position stop requested. id={} userId={}", id, userId);
        return positionService.stopPosition(id, owner(userId, platform))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/close")
    public Mono<ResponseEntity<Position>> closePosition(@PathVariable UUID id,
                                                        @RequestHeader(USER_HEADER) String userId,
                                                        @RequestHeader(PLATFORM_HEADER) String platform,
                                                        @RequestBody(required = false) PositionUpdateRequest extra) {
        log.info("Position close requested. id={} userId={}", id, userId);
        return positionService.closePosition(id, owner(userId, platform), extra)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /** Soft delete: the position is stopped and stays listable with {@code includeStopped}. */
    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Position>> softDeletePosition(@PathVariable UUID id,
                                                             @RequestHeader(USER_HEADER) String userId,
                                                             @RequestHeader(PLATFORM_HEADER) String platform) {
        log.info("Position soft delete requested. id={} userId={}", id, userId);
        return positionService.stopPosition(id, owner(userId, platform))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}/permanent")
    public Mono<ResponseEntity<Void>> deletePosition(@PathVariable UUID id,
                                                     @RequestHeader(USER_HEADER) String userId,
                                                     @RequestHeader(PLATFORM_HEADER) String platform) {
        log.info("Position permanent delete requested. id={} userId={}", id, userId);
        return positionService.deletePosition(id, owner(userId, platform))
            .map(deleted -> deleted
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/user/{platform}/{userId}")
    public Flux<Position> userPositions(@PathVariable String platform,
                                        @PathVariable String userId,
                                        @RequestParam(defaultValue = "false") boolean includeStopped) {
        return positionService.getUserPositions(userId, Platform.fromValue(platform), includeStopped);
    }

    @GetMapping("/user/{platform}/{userId}/active")
    public Flux<Position> activePositions(@PathVariable String platform, @PathVariable String userId) {
        return positionService.getUserActivePositions(userId, Platform.fromValue(platform));
    }

    @GetMapping("/user/{platform}/{userId}/summary")
    public Mono<PositionsSummary> summary(@PathVariable String platform, @PathVariable String userId) {
        return positionService.getPositionsSummary(userId, Platform.fromValue(platform));
    }

    @GetMapping("/user/{platform}/{userId}/symbol/{symbol}")
    public Mono<ResponseEntity<Position>> bySymbol(@PathVariable String platform,
                                                   @PathVariable String userId,
                                                   @PathVariable String symbol,
                                                   @RequestParam(defaultValue = "active") String status) {
        return positionService.getPositionBySymbolForUser(
                userId, Platform.fromValue(platform), symbol, PositionStatus.fromValue(status))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private static PositionOwner owner(String userId, String platform) {
        return PositionOwner.of(userId, Platform.fromValue(platform));
    }
}
