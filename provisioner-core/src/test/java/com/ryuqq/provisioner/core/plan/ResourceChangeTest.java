package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResourceChangeTest {

    private static final Resource DATASET = Resource.of("dss_dataset", "orders", Map.of("format", "csv"));

    @Test
    void create_HasNoBeforeSnapshot() {
        // When
        ResourceChange change = ResourceChange.create(DATASET, Set.of());

        // Then
        assertEquals(Action.CREATE, change.action());
        assertNull(change.before());
        assertEquals(Map.of("format", "csv"), change.after());
        assertEquals(Resource.DEFAULT_PRIORITY, change.priority());
    }

    @Test
    void update_WithoutDiff_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> ResourceChange.update(DATASET, Map.of("format", "json"), List.of(), Set.of()));
    }

    @Test
    void update_CarriesDiff() {
        // Given
        List<FieldDiff> diff = List.of(new FieldDiff("format", "json", "csv"));

        // When
        ResourceChange change = ResourceChange.update(DATASET, Map.of("format", "json"), diff, Set.of());

        // Then
        assertEquals(diff, change.diff());
        assertEquals("json", change.before().get("format"));
    }

    @Test
    void delete_HasNoAfterSnapshot() {
        // When
        ResourceChange change = ResourceChange.delete(DATASET.address(), Map.of("format", "csv"), Set.of(), 100);

        // Then
        assertEquals(Action.DELETE, change.action());
        assertNull(change.after());
        assertTrue(change.diff().isEmpty());
    }

    @Test
    void mismatchedSnapshots_ThrowException() {
        Address address = DATASET.address();

        assertThrows(IllegalArgumentException.class,
            () -> new ResourceChange(address, Action.CREATE, Map.of(), Map.of(), null, null, 100));
        assertThrows(IllegalArgumentException.class,
            () -> new ResourceChange(address, Action.DELETE, Map.of(), Map.of(), null, null, 100));
        assertThrows(IllegalArgumentException.class,
            () -> new ResourceChange(address, Action.NO_OP, Map.of(), null, null, null, 100));
        assertThrows(IllegalArgumentException.class,
            () -> new ResourceChange(address, Action.NO_OP, Map.of(), Map.of(),
                List.of(new FieldDiff("format", "a", "b")), null, 100));
    }

    @Test
    void action_ValuesAndSymbols() {
        assertEquals(Action.NO_OP, Action.fromValue("no-op"));
        assertEquals("+", Action.CREATE.getSymbol());
        assertFalse(Action.NO_OP.isMutating());
        assertTrue(Action.DELETE.isMutating());
        assertThrows(IllegalArgumentException.class, () -> Action.fromValue("replace"));
    }
}
