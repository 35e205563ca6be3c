package com.ryuqq.provisioner.core.error;

import java.util.List;

/**
 * A resource type has no registration (and therefore no handler).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class UnknownResourceTypeException extends ValidationException {

    private final String resourceType;

    public UnknownResourceTypeException(String resourceType) {
        super(ErrorCode.UNKNOWN_RESOURCE_TYPE, List.of("Unknown resource type: " + resourceType));
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
