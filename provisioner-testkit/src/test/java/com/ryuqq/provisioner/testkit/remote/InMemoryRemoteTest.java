package com.ryuqq.provisioner.testkit.remote;

import com.ryuqq.provisioner.core.model.Address;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRemoteTest {

    private static final Address DATASET = Address.of("dss_dataset", "orders");

    @Test
    void create_ExistingObject_Throws() {
        // Given
        InMemoryRemote remote = new InMemoryRemote();
        remote.create(DATASET, Map.of("format", "csv"));

        // When / Then
        assertThrows(IllegalStateException.class, () -> remote.create(DATASET, Map.of("format", "csv")));
    }

    @Test
    void update_MissingObject_Throws() {
        InMemoryRemote remote = new InMemoryRemote();

        assertThrows(IllegalStateException.class, () -> remote.update(DATASET, Map.of("format", "csv")));
    }

    @Test
    void delete_MissingObject_IsNoOp() {
        // Given
        InMemoryRemote remote = new InMemoryRemote();

        // When
        remote.delete(DATASET);

        // Then
        assertEquals(List.of("delete dss_dataset.orders"), remote.calls());
        assertFalse(remote.contains(DATASET));
    }

    @Test
    void failOn_ThrowsOnceThenSucceeds() {
        // Given
        InMemoryRemote remote = new InMemoryRemote()
            .failOn("create", DATASET, new IllegalStateException("quota exceeded"));

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> remote.create(DATASET, Map.of()));

        // Then
        assertEquals("quota exceeded", exception.getMessage());
        assertFalse(remote.contains(DATASET));
        remote.create(DATASET, Map.of());
        assertTrue(remote.contains(DATASET));
    }

    @Test
    void blockOn_HoldsCallUntilReleased() throws Exception {
        // Given
        InMemoryRemote remote = new InMemoryRemote();
        InMemoryRemote.Blocker blocker = remote.blockOn("create", DATASET);

        // When
        CompletableFuture<Map<String, Object>> call =
            CompletableFuture.supplyAsync(() -> remote.create(DATASET, Map.of("format", "csv")));

        // Then
        assertTrue(blocker.awaitEntered(5, TimeUnit.SECONDS));
        assertFalse(call.isDone());
        blocker.release();
        assertEquals("csv", call.get(5, TimeUnit.SECONDS).get("format"));
    }

    @Test
    void resolvingPlaceholders_ExpandsStoredStrings() {
        // Given
        InMemoryRemote remote = new InMemoryRemote().resolvingPlaceholders(Map.of("projectKey", "PROJ"));

        // When
        Map<String, Object> stored = remote.create(DATASET, Map.of("path", "${projectKey}/orders"));

        // Then
        assertEquals("PROJ/orders", stored.get("path"));
    }

    @Test
    void mutatingCalls_ExcludesReads() {
        // Given
        InMemoryRemote remote = new InMemoryRemote();
        remote.create(DATASET, Map.of());
        remote.read(DATASET);
        remote.delete(DATASET);

        // Then
        assertEquals(List.of("create dss_dataset.orders", "read dss_dataset.orders", "delete dss_dataset.orders"),
            remote.calls());
        assertEquals(List.of("create dss_dataset.orders", "delete dss_dataset.orders"), remote.mutatingCalls());
    }
}
