package com.ryuqq.provisioner.testkit.contract;

import com.ryuqq.provisioner.core.error.StateLockException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link StateStore} implementation must satisfy.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>load on a fresh store is empty</li>
 *   <li>save persists {@code serial + 1} and keeps the lineage</li>
 *   <li>a saved state loads back with identical entries and digest</li>
 *   <li>the lock fails fast for a second holder, including the same thread</li>
 *   <li>the lock is released when the action throws</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStateStoreContractTest extends AbstractStateStoreContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore() {
 *         return new MyStateStore(...);
 *     }
 * }
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public abstract class AbstractStateStoreContractTest {

    protected static final String TARGET_KEY = "PROJ";
    protected static final Instant CREATED_AT = Instant.parse("2024-03-01T10:15:30Z");

    protected StateStore store;

    /**
     * Creates a fresh, empty store for one test.
     *
     * @return the store under test
     */
    protected abstract StateStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ========== Load / Save ==========

    @Test
    void load_FreshStore_ReturnsEmpty() {
        // When
        Optional<State> loaded = store.load();

        // Then
        assertTrue(loaded.isEmpty(), "Fresh store should have no state");
        assertFalse(store.exists(), "Fresh store should not report an existing state");
    }

    @Test
    void save_AssignsNextSerialAndKeepsLineage() {
        // Given
        State empty = State.empty(TARGET_KEY);

        // When
        State first = store.save(empty);
        State second = store.save(first);

        // Then
        assertEquals(1L, first.serial());
        assertEquals(2L, second.serial());
        assertEquals(empty.lineage(), second.lineage());
        assertTrue(store.exists());
        assertEquals(2L, store.load().orElseThrow().serial());
    }

    @Test
    void save_ThenLoad_RoundTripsEntriesAndDigest() {
        // Given
        Address dataset = Address.of("dss_dataset", "orders");
        Address recipe = Address.of("dss_python_recipe", "compute_orders");
        Map<String, Object> recipeAttributes = Map.of(
            "inputs", List.of("orders"),
            "outputs", List.of("orders_clean"),
            "params", Map.of("threshold", 3, "enabled", true),
            "code", "print('hi')"
        );
        State state = State.empty(TARGET_KEY)
            .withEntry(dataset, StateEntry.created(Map.of("format", "csv"), Set.of(), 100, CREATED_AT))
            .withEntry(recipe, StateEntry.created(recipeAttributes, Set.of(dataset), 100, CREATED_AT));

        // When
        State saved = store.save(state);
        State loaded = store.load().orElseThrow();

        // Then
        assertEquals(saved.lineage(), loaded.lineage());
        assertEquals(saved.serial(), loaded.serial());
        assertEquals(saved.targetKey(), loaded.targetKey());
        assertEquals(saved.resources(), loaded.resources());
        assertEquals(saved.digest(), loaded.digest());
        assertEquals(Set.of(dataset), loaded.entry(recipe).orElseThrow().dependencies());
    }

    @Test
    void save_AfterDelete_EntryIsGone() {
        // Given
        Address dataset = Address.of("dss_dataset", "orders");
        State saved = store.save(State.empty(TARGET_KEY)
            .withEntry(dataset, StateEntry.created(Map.of("format", "csv"), Set.of(), 100, CREATED_AT)));

        // When
        store.save(saved.withoutEntry(dataset));

        // Then
        State loaded = store.load().orElseThrow();
        assertTrue(loaded.isEmpty());
        assertEquals(2L, loaded.serial());
    }

    // ========== Lock ==========

    @Test
    void withLock_ReturnsActionResult() {
        // When
        String result = store.withLock(() -> "done");

        // Then
        assertEquals("done", result);
    }

    @Test
    void withLock_HeldByAnotherThread_FailsFast() throws Exception {
        // Given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> holder = executor.submit(() -> store.withLock(() -> {
                entered.countDown();
                awaitQuietly(release);
                return "holder";
            }));
            assertTrue(entered.await(5, TimeUnit.SECONDS), "Holder should acquire the lock");

            // When / Then
            long start = System.nanoTime();
            assertThrows(StateLockException.class, () -> store.withLock(() -> "second"));
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 5,
                "Second acquisition should fail without waiting");

            release.countDown();
            assertEquals("holder", holder.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        // Released lock can be acquired again
        assertEquals("again", store.withLock(() -> "again"));
    }

    @Test
    void withLock_Nested_FailsFast() {
        // When / Then
        assertThrows(StateLockException.class,
            () -> store.withLock(() -> store.withLock(() -> "inner")));

        // Outer lock is released afterwards
        assertEquals("after", store.withLock(() -> "after"));
    }

    @Test
    void withLock_ActionThrows_ReleasesLock() {
        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> store.withLock(() -> {
                throw new IllegalStateException("boom");
            }));

        // Then
        assertEquals("boom", exception.getMessage());
        assertEquals("ok", store.withLock(() -> "ok"));
    }

    @Test
    void withLock_SaveInsideLock_IsVisibleAfterRelease() {
        // When
        State saved = store.withLock(() -> store.save(State.empty(TARGET_KEY)));

        // Then
        assertEquals(saved, store.load().orElseThrow());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Lock holder was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while holding the lock", e);
        }
    }
}
