package com.chartsayer.position.repository;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Repairs drift between position records and the per-owner index sets.
 *
 * <p>Record and index are written independently, so a crash or a failed index write can
 * leave a record that no listing returns, and a delete interrupted after the record
 * removal can leave an index entry pointing at nothing. A pass:
 * <ol>
 *   <li>scans every {@code position:<id>} record and re-adds missing ids to the owner's index;</li>
 *   <li>scans every {@code position:user:*} set and prunes ids without a record.</li>
 * </ol>
 *
 * <p>When {@code chartsayer.positions.reconcile.enabled} is true a background loop runs a
 * pass every {@code chartsayer.positions.reconcile.interval}. Errors in one pass are logged
 * and the loop keeps going.
 */
@Component
public class PositionIndexReconciler {

    private static final Logger log = LoggerFactory.getLogger(PositionIndexReconciler.class);

    public record ReconciliationReport(long recordsScanned, long indexEntriesRestored, long danglingEntriesPruned) {}

    private final PositionRepository repository;

    @Value("${chartsayer.positions.reconcile.enabled:false}")
    private boolean enabled;

    @Value("${chartsayer.positions.reconcile.interval:PT15M}")
    private Duration interval;

    private Disposable loop;

    public PositionIndexReconciler(PositionRepository repository) {
        this.repository = repository;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Index reconciliation disabled");
            return;
        }
        log.info("Index reconciliation started. intervalSeconds={}", interval.toSeconds());
        loop = Flux.interval(interval, interval)
            .concatMap(tick -> reconcile()
                .onErrorResume(e -> {
                    log.warn("Index reconciliation pass failed (non-fatal)", e);
                    return Mono.empty();
                }))
            .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (loop != null) {
            loop.dispose();
        }
    }

    /**
     * Runs one reconciliation pass.
     */
    public Mono<ReconciliationReport> reconcile() {
        Mono<long[]> restore = repository.scanPositionIds()
            .concatMap(id -> repository.getPosition(id)
                .flatMap(position -> repository.indexContains(position)
                    .flatMap(indexed -> indexed
                        ? Mono.just(0L)
                        : repository.addToIndex(position)
                            .doOnNext(added -> log.warn("INDEX_RESTORED id={} userId={} platform={}",
                                position.getId(), position.getUserId(), position.getPlatform()))))
                .defaultIfEmpty(0L))
            .reduceWith(() -> new long[2], (acc, restored) -> {
                acc[0]++;
                acc[1] += restored;
                return acc;
            });

        Mono<Long> prune = repository.scanIndexKeys()
            .concatMap(indexKey -> repository.indexMembers(indexKey)
                .flatMapMany(Flux::fromIterable)
                .concatMap(rawId -> repository.recordExists(rawId)
                    .flatMap(exists -> exists
                        ? Mono.just(0L)
                        : repository.removeFromIndex(indexKey, rawId)
                            .doOnNext(removed -> log.warn("INDEX_PRUNED key={} id={}", indexKey, rawId)))))
            .reduce(0L, Long::sum);

        return restore.flatMap(counts -> prune.map(pruned ->
                new ReconciliationReport(counts[0], counts[1], pruned)))
            .doOnSuccess(report -> log.info("Index reconciliation complete. recordsScanned={} restored={} pruned={}",
                report.recordsScanned(), report.indexEntriesRestored(), report.danglingEntriesPruned()));
    }
}
