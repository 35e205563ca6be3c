package com.ryuqq.provisioner.core.normalize;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderResolverTest {

    private final PlaceholderResolver resolver = new PlaceholderResolver(Map.of("projectKey", "PROJ", "env", "dev"));

    @Test
    void resolve_ReplacesKnownVariables() {
        assertEquals("/data/PROJ/dev/orders", resolver.resolve("/data/${projectKey}/${env}/orders"));
    }

    @Test
    void resolve_UnknownVariable_IsLeftAsIs() {
        assertEquals("${unknown}/PROJ", resolver.resolve("${unknown}/${projectKey}"));
    }

    @Test
    void resolve_WalksMapsAndLists() {
        // Given
        Map<String, Object> attributes = Map.of(
            "paths", List.of("${projectKey}/a", "${projectKey}/b"),
            "params", Map.of("env", "${env}", "rows", 3L));

        // When
        Map<String, Object> resolved = resolver.resolveAll(attributes);

        // Then
        assertEquals(List.of("PROJ/a", "PROJ/b"), resolved.get("paths"));
        assertEquals(Map.of("env", "dev", "rows", 3L), resolved.get("params"));
    }

    @Test
    void resolveAll_ReturnsSortedCopyWithoutTouchingInput() {
        // Given
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("zone", "${env}");
        attributes.put("alpha", "${projectKey}");

        // When
        Map<String, Object> resolved = resolver.resolveAll(attributes);
        resolved.put("extra", "x");

        // Then
        assertEquals(List.of("alpha", "extra", "zone"), List.copyOf(resolved.keySet()));
        assertEquals("dev", resolved.get("zone"));
        assertEquals("${env}", attributes.get("zone"));
        assertFalse(attributes.containsKey("extra"));
    }

    @Test
    void resolve_NonStringValues_AreUnchanged() {
        assertEquals(3L, resolver.resolve(3L));
        assertEquals(Boolean.TRUE, resolver.resolve(Boolean.TRUE));
        assertNull(resolver.resolve(null));
        assertNull(resolver.resolveAll(null));
    }

    @Test
    void none_HasNoVariables() {
        assertTrue(PlaceholderResolver.none().variables().isEmpty());
        assertEquals("${projectKey}", PlaceholderResolver.none().resolve("${projectKey}"));
    }
}
