package com.ryuqq.provisioner.adapter.file.plan;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a saved plan.
 *
 * @param formatVersion artifact format version
 * @param metadata plan metadata
 * @param changes ordered changes
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record PlanDocument(
    int formatVersion,
    Metadata metadata,
    List<Change> changes
) {

    /**
     * Current artifact format version.
     */
    public static final int CURRENT_FORMAT_VERSION = 1;

    /**
     * JSON form of the plan metadata.
     */
    public record Metadata(
        String targetKey,
        Instant createdAt,
        boolean destroy,
        boolean refresh,
        String stateLineage,
        long stateSerial,
        String stateDigest,
        String configDigest,
        String engineVersion
    ) {
    }

    /**
     * JSON form of a single change.
     */
    public record Change(
        String address,
        String action,
        Map<String, Object> before,
        Map<String, Object> after,
        List<Diff> diff,
        List<String> dependencies,
        int priority
    ) {
    }

    /**
     * JSON form of a field difference.
     */
    public record Diff(
        String field,
        Object before,
        Object after
    ) {
    }
}
