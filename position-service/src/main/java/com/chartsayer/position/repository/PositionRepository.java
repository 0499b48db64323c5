package com.chartsayer.position.repository;

import com.chartsayer.common.exception.PositionStorageException;
import com.chartsayer.common.model.Platform;
import com.chartsayer.common.model.Position;
import com.chartsayer.common.model.PositionCreateRequest;
import com.chartsayer.common.model.PositionStatus;
import com.chartsayer.common.model.PositionUpdateRequest;
import com.chartsayer.position.storage.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Set;
import java.util.UUID;

/**
 * Position records and per-owner index sets on top of a {@link KeyValueStore}.
 *
 * <p><strong>Keys:</strong>
 * <ul>
 *   <li>{@code position:<id>}: the JSON record</li>
 *   <li>{@code position:user:<platform>:<user_id>}: set of the owner's position ids</li>
 * </ul>
 *
 * <p>Record and index are two independent writes, always record first. A crash in
 * between leaves a position that is fetchable by id but missing from listings, never
 * an index entry pointing at nothing. {@link PositionIndexReconciler} repairs both
 * directions after the fact.
 *
 * <p>No business rules here: ownership and transition checks live in
 * {@code PositionService}.
 */
@Repository
public class PositionRepository {

    private static final Logger log = LoggerFactory.getLogger(PositionRepository.class);

    private final KeyValueStore store;
    private final Clock clock;
    private final String prefix;

    public PositionRepository(KeyValueStore store,
                              Clock clock,
                              @Value("${chartsayer.positions.key-prefix:position}") String prefix) {
        this.store  = store;
        this.clock  = clock;
        this.prefix = prefix;
    }

    public String positionKey(UUID positionId) {
        return prefix + ":" + positionId;
    }

    public String userIndexKey(String userId, Platform platform) {
        return prefix + ":user:" + platform.value() + ":" + userId;
    }

    String indexKeyPattern() {
        return prefix + ":user:*";
    }

    String recordKeyPattern() {
        return prefix + ":*";
    }

    /**
     * Assigns id and timestamps, writes the record, then indexes it under its owner.
     * Fails with {@link PositionStorageException} if the record write fails; an index
     * write failure is only logged.
     */
    public Mono<Position> createPosition(PositionCreateRequest request) {
        return Mono.fromCallable(() -> newPosition(request))
            .flatMap(position -> write(position, "create")
                .flatMap(saved -> store.addToSet(
                        userIndexKey(saved.getUserId(), saved.getPlatform()), saved.getId().toString())
                    .doOnNext(added -> {
                        if (added == 0) {
                            log.warn("Position not indexed. id={} userId={} platform={}",
                                     saved.getId(), saved.getUserId(), saved.getPlatform());
                        }
                    })
                    .thenReturn(saved)))
            .doOnSuccess(p -> log.info("Position created. id={} userId={} platform={} symbol={}",
                                       p.getId(), p.getUserId(), p.getPlatform(), p.getSymbol()))
            .doOnError(e -> log.error("Failed to create position. owner={}", request.owner(), e));
    }

    public Mono<Position> getPosition(UUID positionId) {
        return store.getJson(positionKey(positionId), Position.class);
    }

    /**
     * Merges the provided fields into the stored record. Empty if the position does not exist.
     */
    public Mono<Position> updatePosition(UUID positionId, PositionUpdateRequest update) {
        return getPosition(positionId)
            .flatMap(position -> {
                position.applyUpdate(update, now());
                return write(position, "update");
            })
            .doOnSuccess(p -> {
                if (p != null) {
                    log.info("Position updated. id={} userId={}", p.getId(), p.getUserId());
                }
            });
    }

    /**
     * Soft delete. Rewrites the record even when it is already STOPPED.
     */
    public Mono<Position> stopPosition(UUID positionId) {
        return getPosition(positionId)
            .flatMap(position -> {
                position.stop(now());
                return write(position, "stop");
            })
            .doOnSuccess(p -> {
                if (p != null) {
                    log.info("Position stopped. id={} userId={}", p.getId(), p.getUserId());
                }
            });
    }

    /**
     * Marks the position CLOSED and applies {@code extra} (nullable). {@code closed_at}
     * is stamped on the first close only.
     */
    public Mono<Position> closePosition(UUID positionId, PositionUpdateRequest extra) {
        return getPosition(positionId)
            .flatMap(position -> {
                position.close(extra, now());
                return write(position, "close");
            })
            .doOnSuccess(p -> {
                if (p != null) {
                    log.info("Position closed. id={} userId={} closedAt={}",
                             p.getId(), p.getUserId(), p.getClosedAt());
                }
            });
    }

    /**
     * Deletes the record and prunes it from its owner's index.
     * Emits {@code false} when the record did not exist.
     */
    public Mono<Boolean> deletePosition(UUID positionId) {
        return getPosition(positionId)
            .flatMap(position -> store.delete(positionKey(positionId))
                .flatMap(deleted -> {
                    if (!deleted) {
                        return Mono.<Boolean>error(
                            new PositionStorageException("delete", positionKey(positionId)));
                    }
                    return store.removeFromSet(
                            userIndexKey(position.getUserId(), position.getPlatform()), positionId.toString())
                        .doOnNext(removed -> log.info("Position deleted. id={} userId={} indexEntriesRemoved={}",
                                                      positionId, position.getUserId(), removed))
                        .thenReturn(true);
                }))
            .defaultIfEmpty(false);
    }

    /**
     * Positions in the owner's index, in index order. Ids whose record is missing are
     * skipped. STOPPED positions are left out unless {@code includeStopped}.
     */
    public Flux<Position> getUserPositions(String userId, Platform platform, boolean includeStopped) {
        String indexKey = userIndexKey(userId, platform);
        return store.getSetMembers(indexKey)
            .flatMapMany(Flux::fromIterable)
            .flatMapSequential(rawId -> parseId(rawId)
                .flatMap(this::getPosition)
                .switchIfEmpty(Mono.fromRunnable(() ->
                    log.debug("Skipping dangling index entry. key={} id={}", indexKey, rawId))))
            .filter(p -> includeStopped || p.getStatus() != PositionStatus.STOPPED);
    }

    public Flux<Position> getUserActivePositions(String userId, Platform platform) {
        return getUserPositions(userId, platform, false)
            .filter(p -> p.getStatus() == PositionStatus.ACTIVE);
    }

    // ── index maintenance (used by PositionIndexReconciler) ─────────────────

    /** Ids of every stored record, found by key scan. */
    Flux<UUID> scanPositionIds() {
        String indexPrefix = prefix + ":user:";
        int idOffset = prefix.length() + 1;
        return store.keys(recordKeyPattern())
            .filter(key -> !key.startsWith(indexPrefix))
            .flatMap(key -> parseId(key.substring(idOffset)));
    }

    Flux<String> scanIndexKeys() {
        return store.keys(indexKeyPattern());
    }

    Mono<Boolean> indexContains(Position position) {
        return store.getSetMembers(userIndexKey(position.getUserId(), position.getPlatform()))
            .map(members -> members.contains(position.getId().toString()));
    }

    Mono<Long> addToIndex(Position position) {
        return store.addToSet(userIndexKey(position.getUserId(), position.getPlatform()),
                              position.getId().toString());
    }

    Mono<Set<String>> indexMembers(String indexKey) {
        return store.getSetMembers(indexKey);
    }

    Mono<Boolean> recordExists(String rawId) {
        return parseId(rawId)
            .flatMap(id -> store.exists(positionKey(id)))
            .defaultIfEmpty(false);
    }

    Mono<Long> removeFromIndex(String indexKey, String rawId) {
        return store.removeFromSet(indexKey, rawId);
    }

    // ── internals ───────────────────────────────────────────────────────────

    private Position newPosition(PositionCreateRequest request) {
        LocalDateTime now = now();
        return Position.builder()
            .id(UUID.randomUUID())
            .userId(request.userId())
            .platform(request.platform())
            .symbol(request.symbol())
            .type(request.type())
            .entryPrice(request.entryPrice())
            .takeProfit(request.takeProfit())
            .stopLoss(request.stopLoss())
            .quantity(request.quantity())
            .leverage(request.leverage())
            .status(PositionStatus.ACTIVE)
            .createdAt(now)
            .updatedAt(now)
            .notes(request.notes())
            .metadata(request.metadata() != null ? new LinkedHashMap<>(request.metadata()) : new LinkedHashMap<>())
            .build();
    }

    private Mono<Position> write(Position position, String operation) {
        String key = positionKey(position.getId());
        return store.setJson(key, position, null)
            .flatMap(written -> written
                ? Mono.just(position)
                : Mono.error(new PositionStorageException(operation, key)));
    }

    private Mono<UUID> parseId(String rawId) {
        try {
            return Mono.just(UUID.fromString(rawId));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed position id. id={}", rawId);
            return Mono.empty();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
