package com.chartsayer.position.repository;

import com.chartsayer.common.model.Platform;
import com.chartsayer.common.model.Position;
import com.chartsayer.position.config.PositionServiceConfig;
import com.chartsayer.position.repository.PositionIndexReconciler.ReconciliationReport;
import com.chartsayer.position.storage.InMemoryKeyValueStore;
import com.chartsayer.position.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PositionIndexReconcilerTest {

    private InMemoryKeyValueStore store;
    private PositionRepository repository;
    private PositionIndexReconciler reconciler;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
        store = new InMemoryKeyValueStore(new PositionServiceConfig().objectMapper(), clock);
        repository = new PositionRepository(store, clock, "position");
        reconciler = new PositionIndexReconciler(repository);
    }

    private Position create(String userId) {
        return repository.createPosition(PositionRepositoryTest.btcLong(userId, Platform.DISCORD)).block();
    }

    @Test
    @DisplayName("consistent store needs no repair")
    void nothingToDo() {
        create("u1");
        create("u2");

        StepVerifier.create(reconciler.reconcile())
            .expectNext(new ReconciliationReport(2, 0, 0))
            .verifyComplete();
    }

    @Test
    @DisplayName("record missing from its owner's index is re-indexed")
    void restoresMissingIndexEntry() {
        Position lost = create("u1");
        store.removeFromSet("position:user:discord:u1", lost.getId().toString()).block();
        assertEquals(List.of(), repository.getUserPositions("u1", Platform.DISCORD, true).collectList().block());

        StepVerifier.create(reconciler.reconcile())
            .expectNext(new ReconciliationReport(1, 1, 0))
            .verifyComplete();

        assertEquals(List.of(lost.getId()),
            repository.getUserPositions("u1", Platform.DISCORD, true).map(Position::getId).collectList().block());
    }

    @Test
    @DisplayName("index entries without a record are pruned")
    void prunesDanglingEntries() {
        Position kept = create("u1");
        String ghost = UUID.randomUUID().toString();
        store.addToSet("position:user:discord:u1", ghost, "garbage").block();

        StepVerifier.create(reconciler.reconcile())
            .expectNext(new ReconciliationReport(1, 0, 2))
            .verifyComplete();

        StepVerifier.create(store.getSetMembers("position:user:discord:u1"))
            .expectNext(Set.of(kept.getId().toString()))
            .verifyComplete();
    }

    @Test
    @DisplayName("disabled reconciler starts no loop and stops cleanly")
    void disabledLoop() {
        reconciler.start();
        reconciler.stop();
    }
}
