package com.ryuqq.provisioner.adapter.file.state;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a single state entry.
 *
 * @param attributes recorded attributes
 * @param dependencies dependency addresses
 * @param priority priority class
 * @param createdAt creation time
 * @param updatedAt last change time
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceDocument(
    Map<String, Object> attributes,
    List<String> dependencies,
    int priority,
    Instant createdAt,
    Instant updatedAt
) {
}
