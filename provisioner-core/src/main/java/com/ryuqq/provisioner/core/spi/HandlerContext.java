package com.ryuqq.provisioner.core.spi;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Context passed to every {@link ResourceHandler} call.
 *
 * @param targetKey the remote project the engine provisions into
 * @param variables placeholder variables (always includes {@code projectKey})
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record HandlerContext(
    String targetKey,
    Map<String, String> variables
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if targetKey is null or blank
     */
    public HandlerContext {
        if (targetKey == null || targetKey.isBlank()) {
            throw new IllegalArgumentException("targetKey cannot be null or blank");
        }
        variables = variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(variables));
    }
}
