package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.error.UnknownResourceTypeException;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of resource types: the single type-dispatch point of the engine.
 *
 * <p>Thread-safe; registrations are normally made once at startup.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ResourceTypeRegistry {

    private final Map<String, ResourceTypeRegistration> registrations = new ConcurrentHashMap<>();

    /**
     * Registers a type.
     *
     * @param registration the registration
     * @return this registry
     * @throws IllegalArgumentException if the registration is null or the type is already registered
     */
    public ResourceTypeRegistry register(ResourceTypeRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        ResourceTypeRegistration previous = registrations.putIfAbsent(registration.type(), registration);
        if (previous != null) {
            throw new IllegalArgumentException("Resource type already registered: " + registration.type());
        }
        return this;
    }

    /**
     * Looks up a type.
     *
     * @param type the type tag
     * @return the registration
     * @throws UnknownResourceTypeException if the type is not registered
     */
    public ResourceTypeRegistration get(String type) {
        return find(type).orElseThrow(() -> new UnknownResourceTypeException(type));
    }

    /**
     * Looks up a type without failing.
     *
     * @param type the type tag
     * @return the registration, or empty
     */
    public Optional<ResourceTypeRegistration> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(registrations.get(type));
    }

    public boolean contains(String type) {
        return find(type).isPresent();
    }

    /**
     * Registered type tags, sorted.
     *
     * @return type tags
     */
    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeMap<>(registrations).keySet());
    }
}
