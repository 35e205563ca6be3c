package com.ryuqq.provisioner.adapter.file.state;

import java.util.Map;

/**
 * JSON form of the state file.
 *
 * <pre>
 * { "version": 1, "lineage": "...", "serial": 3, "targetKey": "PRJ", "digest": "...",
 *   "resources": { "dss_dataset.a": { "attributes": {...}, "dependencies": [...], ... } } }
 * </pre>
 *
 * @param version file format version
 * @param lineage lineage UUID
 * @param serial serial number
 * @param targetKey target project key
 * @param digest SHA-256 of the canonical address to attributes map
 * @param resources entries by address
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record StateDocument(
    int version,
    String lineage,
    long serial,
    String targetKey,
    String digest,
    Map<String, ResourceDocument> resources
) {

    /**
     * Current file format version.
     */
    public static final int CURRENT_VERSION = 1;
}
