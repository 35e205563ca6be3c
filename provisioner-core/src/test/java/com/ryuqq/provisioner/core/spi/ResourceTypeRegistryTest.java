package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.error.UnknownResourceTypeException;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.ReferenceExtractor;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class ResourceTypeRegistryTest {

    @Mock
    private ResourceHandler handler;

    @Test
    void register_ThenGet_ReturnsRegistration() {
        // Given
        ResourceTypeRegistry registry = new ResourceTypeRegistry()
            .register(ResourceTypeRegistration.of("dss_dataset", handler))
            .register(ResourceTypeRegistration.of("dss_variables", handler).withPriority(0));

        // When & Then
        assertSame(handler, registry.get("dss_dataset").handler());
        assertEquals(0, registry.get("dss_variables").priority());
        assertEquals(Set.of("dss_dataset", "dss_variables"), registry.types());
        assertTrue(registry.contains("dss_dataset"));
    }

    @Test
    void register_Duplicate_ThrowsException() {
        // Given
        ResourceTypeRegistry registry = new ResourceTypeRegistry()
            .register(ResourceTypeRegistration.of("dss_dataset", handler));

        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> registry.register(ResourceTypeRegistration.of("dss_dataset", handler)));
    }

    @Test
    void get_Unknown_ThrowsUnknownResourceType() {
        // When
        UnknownResourceTypeException exception = assertThrows(UnknownResourceTypeException.class,
            () -> new ResourceTypeRegistry().get("dss_wiki"));

        // Then
        assertEquals("dss_wiki", exception.getResourceType());
        assertTrue(new ResourceTypeRegistry().find("dss_wiki").isEmpty());
    }

    @Test
    void registration_ValidatesTypeAndHandler() {
        assertThrows(IllegalArgumentException.class, () -> ResourceTypeRegistration.of("Dataset", handler));
        assertThrows(IllegalArgumentException.class, () -> ResourceTypeRegistration.of("dss_dataset", null));
        assertThrows(IllegalArgumentException.class,
            () -> ResourceTypeRegistration.of("dss_dataset", handler).withPriority(-1));
    }

    @Test
    void registration_NullReferences_DefaultsToNone() {
        // When
        ResourceTypeRegistration registration = new ResourceTypeRegistration("dss_dataset", 100, null, handler);

        // Then
        Resource resource = Resource.of("dss_dataset", "a", Map.of("zone", "raw"));
        assertTrue(registration.references().extract(resource).isEmpty());
    }

    @Test
    void registration_Resource_CarriesTypePriority() {
        // Given
        ResourceTypeRegistration registration = ResourceTypeRegistration.of("dss_scenario", handler)
            .withPriority(200)
            .withReferences(ReferenceExtractor.none());

        // When
        Resource resource = registration.resource("daily", Map.of("active", true));

        // Then
        assertEquals(Address.of("dss_scenario", "daily"), resource.address());
        assertEquals(200, resource.priority());
    }

    @Test
    void planContext_SeesDesiredAndState() {
        // Given
        Address desired = Address.parse("dss_dataset.a");
        Address tracked = Address.parse("dss_dataset.old");
        State state = State.empty("PROJ").withEntry(tracked,
            StateEntry.created(Map.of(), Set.of(), 100, Instant.parse("2024-03-01T10:00:00Z")));
        PlanContext context = new PlanContext("PROJ",
            Map.of(desired, Resource.of(desired, Map.of())), state);

        // When & Then
        assertTrue(context.exists(desired));
        assertTrue(context.exists(tracked));
        assertFalse(context.exists(Address.parse("dss_dataset.none")));
        assertTrue(context.desired(tracked).isEmpty());
        assertEquals(List.of(desired, tracked), List.copyOf(context.addresses()));
        assertEquals("PROJ", context.targetKey());
    }

    @Test
    void handlerValidate_DefaultsToNoErrors() {
        // Given
        ResourceHandler plain = new ResourceHandler() {
            @Override
            public Map<String, Object> create(HandlerContext context, Address address, Map<String, Object> attributes) {
                return attributes;
            }

            @Override
            public Optional<Map<String, Object>> read(HandlerContext context, Address address) {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> update(HandlerContext context, Address address, Map<String, Object> attributes) {
                return attributes;
            }

            @Override
            public void delete(HandlerContext context, Address address) {
            }
        };
        PlanContext context = new PlanContext("PROJ", Map.of(), State.empty("PROJ"));

        // When & Then
        assertTrue(plain.validate(Resource.of("dss_dataset", "a", Map.of()), context).isEmpty());
    }
}
