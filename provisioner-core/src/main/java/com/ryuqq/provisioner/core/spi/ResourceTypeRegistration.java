package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.ReferenceExtractor;
import com.ryuqq.provisioner.core.model.Resource;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Binding of a resource type tag to its priority class, reference extractor and handler.
 *
 * @param type the type tag (e.g. {@code dss_dataset})
 * @param priority the priority class of every resource of this type
 * @param references implicit reference extractor
 * @param handler CRUD handler
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceTypeRegistration(
    String type,
    int priority,
    ReferenceExtractor references,
    ResourceHandler handler
) {

    private static final Pattern TYPE_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if type is invalid, priority is negative or handler is null
     */
    public ResourceTypeRegistration {
        if (type == null || !TYPE_PATTERN.matcher(type).matches()) {
            throw new IllegalArgumentException("type must match " + TYPE_PATTERN.pattern() + " (current: " + type + ")");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be non-negative (current: " + priority + ")");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (references == null) {
            references = ReferenceExtractor.none();
        }
    }

    /**
     * Registration with the default priority and no implicit references.
     *
     * @param type the type tag
     * @param handler CRUD handler
     * @return registration
     */
    public static ResourceTypeRegistration of(String type, ResourceHandler handler) {
        return new ResourceTypeRegistration(type, Resource.DEFAULT_PRIORITY, ReferenceExtractor.none(), handler);
    }

    /**
     * Copy with a different priority class.
     *
     * @param newPriority the priority class
     * @return new registration
     */
    public ResourceTypeRegistration withPriority(int newPriority) {
        return new ResourceTypeRegistration(type, newPriority, references, handler);
    }

    /**
     * Copy with a different reference extractor.
     *
     * @param newReferences the extractor
     * @return new registration
     */
    public ResourceTypeRegistration withReferences(ReferenceExtractor newReferences) {
        return new ResourceTypeRegistration(type, priority, newReferences, handler);
    }

    /**
     * Builds a desired resource of this type carrying the type's priority class.
     *
     * @param name resource name
     * @param attributes attributes
     * @return resource
     */
    public Resource resource(String name, Map<String, ?> attributes) {
        return Resource.of(Address.of(type, name), attributes).withPriority(priority);
    }
}
