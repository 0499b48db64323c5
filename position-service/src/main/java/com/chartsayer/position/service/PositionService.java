package com.chartsayer.position.service;

import com.chartsayer.common.exception.InvalidPositionTransitionException;
import com.chartsayer.common.exception.PositionOwnershipException;
import com.chartsayer.common.exception.PositionValidationException;
import com.chartsayer.common.model.Platform;
import com.chartsayer.common.model.Position;
import com.chartsayer.common.model.PositionCreateRequest;
import com.chartsayer.common.model.PositionOwner;
import com.chartsayer.common.model.PositionStatus;
import com.chartsayer.common.model.PositionType;
import com.chartsayer.common.model.PositionUpdateRequest;
import com.chartsayer.common.model.PositionsSummary;
import com.chartsayer.position.repository.PositionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Business rules for the position registry: input validation, ownership and
 * status-transition checks. Storage is delegated to {@link PositionRepository}.
 *
 * <p>Not found is an empty {@code Mono}. Ownership mismatches and illegal transitions
 * are signalled with {@link PositionOwnershipException} and
 * {@link InvalidPositionTransitionException}; nothing is written in either case.
 */
@Service
public class PositionService {

    private static final Logger log = LoggerFactory.getLogger(PositionService.class);

    private final PositionRepository repository;
    private final ObjectMapper objectMapper;

    public PositionService(PositionRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a position from a raw snake_case field map, e.g. a decoded request body.
     */
    public Mono<Position> createPosition(Map<String, Object> data) {
        return Mono.fromCallable(() -> toCreateRequest(data))
            .flatMap(this::createPosition);
    }

    public Mono<Position> createPosition(PositionCreateRequest request) {
        return Mono.fromCallable(() -> validate(request))
            .flatMap(repository::createPosition);
    }

    /**
     * Maps a chart-analysis payload ({@code symbol}, {@code entry}, {@code take_profit},
     * {@code stop_loss}, {@code position_type}) to a new position and keeps the raw payload
     * as metadata. Empty when the payload cannot be turned into a valid position.
     */
    public Mono<Position> createPositionFromChartData(String userId, Platform platform, Map<String, Object> chartData) {
        return Mono.fromCallable(() -> fromChartData(userId, platform, chartData))
            .flatMap(this::createPosition)
            .doOnSuccess(p -> {
                if (p != null) {
                    log.info("Position created from chart data. id={} userId={} platform={}",
                             p.getId(), userId, platform);
                }
            })
            .onErrorResume(e -> {
                log.error("Failed to create position from chart data. userId={} platform={}",
                          userId, platform, e);
                return Mono.empty();
            });
    }

    public Mono<Position> getPosition(UUID positionId) {
        return repository.getPosition(positionId);
    }

    /**
     * Partial update on behalf of {@code requester}. A status change must be legal:
     * ACTIVE may move to CLOSED or STOPPED, terminal states cannot move at all.
     */
    public Mono<Position> updatePosition(UUID positionId, PositionOwner requester, PositionUpdateRequest update) {
        return Mono.fromCallable(() -> normalize(update))
            .flatMap(fields -> findOwned(positionId, requester)
                .flatMap(position -> {
                    PositionStatus requested = fields.status();
                    if (requested != null && requested != position.getStatus() && position.getStatus().isTerminal()) {
                        return Mono.error(new InvalidPositionTransitionException(
                            positionId, position.getStatus(), requested));
                    }
                    return repository.updatePosition(positionId, fields);
                }));
    }

    public Mono<Position> stopPosition(UUID positionId, PositionOwner requester) {
        return findOwned(positionId, requester)
            .flatMap(position -> requireActive(position, PositionStatus.STOPPED))
            .flatMap(position -> repository.stopPosition(positionId));
    }

    /**
     * Closes the position and applies {@code extra} fields (nullable). Any status in
     * {@code extra} is ignored.
     */
    public Mono<Position> closePosition(UUID positionId, PositionOwner requester, PositionUpdateRequest extra) {
        return Mono.fromCallable(() -> normalize(extra).withStatus(null))
            .flatMap(fields -> findOwned(positionId, requester)
                .flatMap(position -> requireActive(position, PositionStatus.CLOSED))
                .flatMap(position -> repository.closePosition(positionId, fields)));
    }

    /**
     * Permanently removes the position. {@code false} when it does not exist.
     */
    public Mono<Boolean> deletePosition(UUID positionId, PositionOwner requester) {
        return findOwned(positionId, requester)
            .flatMap(position -> repository.deletePosition(positionId))
            .defaultIfEmpty(false);
    }

    public Flux<Position> getUserPositions(String userId, Platform platform, boolean includeStopped) {
        return repository.getUserPositions(userId, platform, includeStopped);
    }

    public Flux<Position> getUserActivePositions(String userId, Platform platform) {
        return repository.getUserActivePositions(userId, platform);
    }

    public Mono<Position> getPositionBySymbolForUser(String userId, Platform platform, String symbol) {
        return getPositionBySymbolForUser(userId, platform, symbol, PositionStatus.ACTIVE);
    }

    /**
     * First position of the owner, in index order, whose symbol matches case-insensitively
     * and whose status equals {@code status}.
     */
    public Mono<Position> getPositionBySymbolForUser(String userId, Platform platform,
                                                     String symbol, PositionStatus status) {
        if (symbol == null || symbol.isBlank()) {
            return Mono.empty();
        }
        String wanted = symbol.trim();
        return repository.getUserPositions(userId, platform, status == PositionStatus.STOPPED)
            .filter(p -> p.getStatus() == status && wanted.equalsIgnoreCase(p.getSymbol()))
            .next();
    }

    public Mono<PositionsSummary> getPositionsSummary(String userId, Platform platform) {
        return repository.getUserPositions(userId, platform, true)
            .collectList()
            .map(PositionsSummary::of);
    }

    // ── internals ───────────────────────────────────────────────────────────

    private Mono<Position> findOwned(UUID positionId, PositionOwner requester) {
        return repository.getPosition(positionId)
            .flatMap(position -> {
                if (!position.isOwnedBy(requester)) {
                    log.warn("Ownership check failed. id={} owner={} requester={}",
                             positionId, position.getOwner(), requester);
                    return Mono.error(new PositionOwnershipException(positionId, requester));
                }
                return Mono.just(position);
            });
    }

    private Mono<Position> requireActive(Position position, PositionStatus requested) {
        if (position.getStatus().isTerminal()) {
            log.info("Rejected transition. id={} current={} requested={}",
                     position.getId(), position.getStatus(), requested);
            return Mono.error(new InvalidPositionTransitionException(
                position.getId(), position.getStatus(), requested));
        }
        return Mono.just(position);
    }

    private PositionCreateRequest toCreateRequest(Map<String, Object> data) {
        if (data == null) {
            throw new PositionValidationException("Position data is required");
        }
        try {
            return objectMapper.convertValue(data, PositionCreateRequest.class);
        } catch (IllegalArgumentException e) {
            throw new PositionValidationException("Invalid position data: " + e.getMessage(), e);
        }
    }

    private PositionCreateRequest validate(PositionCreateRequest request) {
        if (request == null) {
            throw new PositionValidationException("Position data is required");
        }
        if (request.userId() == null || request.userId().isBlank()) {
            throw new PositionValidationException("user_id is required");
        }
        if (request.platform() == null) {
            throw new PositionValidationException("platform is required");
        }
        if (request.symbol() == null || request.symbol().isBlank()) {
            throw new PositionValidationException("symbol is required");
        }
        if (request.type() == null) {
            throw new PositionValidationException("type is required");
        }
        if (request.entryPrice() == null || !(request.entryPrice() > 0)) {
            throw new PositionValidationException("entry_price must be greater than 0");
        }
        return request.withSymbol(normalizeSymbol(request.symbol()));
    }

    private PositionCreateRequest fromChartData(String userId, Platform platform, Map<String, Object> chartData) {
        Map<String, Object> data = chartData != null ? chartData : Map.of();
        Object rawSymbol = data.getOrDefault("symbol", "UNKNOWN");
        Object rawType = data.getOrDefault("position_type", "long");
        PositionType type = "long".equalsIgnoreCase(String.valueOf(rawType).trim())
            ? PositionType.LONG
            : PositionType.SHORT;
        return new PositionCreateRequest(
            userId,
            platform,
            String.valueOf(rawSymbol),
            type,
            toDouble(data.getOrDefault("entry", 0)),
            toDouble(data.get("take_profit")),
            toDouble(data.get("stop_loss")),
            null,
            null,
            null,
            new LinkedHashMap<>(data));
    }

    private static Double toDouble(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new PositionValidationException("Not a number: " + text, e);
        }
    }

    private static PositionUpdateRequest normalize(PositionUpdateRequest update) {
        PositionUpdateRequest fields = update != null ? update : PositionUpdateRequest.empty();
        if (fields.entryPrice() != null && !(fields.entryPrice() > 0)) {
            throw new PositionValidationException("entry_price must be greater than 0");
        }
        if (fields.symbol() != null) {
            if (fields.symbol().isBlank()) {
                throw new PositionValidationException("symbol must not be blank");
            }
            return fields.withSymbol(normalizeSymbol(fields.symbol()));
        }
        return fields;
    }

    private static String normalizeSymbol(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
