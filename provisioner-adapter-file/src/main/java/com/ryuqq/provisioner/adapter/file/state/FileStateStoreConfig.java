package com.ryuqq.provisioner.adapter.file.state;

import java.nio.file.Path;

/**
 * File state store settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>statePath: the JSON state file (required)</li>
 *   <li>backupSuffix: suffix of the previous-version copy (default {@code .backup})</li>
 *   <li>lockSuffix: suffix of the advisory lock file (default {@code .lock})</li>
 *   <li>fsync: force the temp file to disk before the rename (default true)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param statePath state file path
 * @param backupSuffix backup file suffix
 * @param lockSuffix lock file suffix
 * @param fsync whether to fsync before rename
 */
public record FileStateStoreConfig(Path statePath, String backupSuffix, String lockSuffix, boolean fsync) {

    /**
     * Default settings for the given state file.
     *
     * @param statePath state file path
     */
    public FileStateStoreConfig(Path statePath) {
        this(statePath, ".backup", ".lock", true);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a setting is invalid
     */
    public FileStateStoreConfig {
        if (statePath == null) {
            throw new IllegalArgumentException("statePath cannot be null");
        }
        if (statePath.getFileName() == null) {
            throw new IllegalArgumentException("statePath must name a file (current: " + statePath + ")");
        }
        if (backupSuffix == null || backupSuffix.isBlank()) {
            throw new IllegalArgumentException("backupSuffix cannot be null or blank");
        }
        if (lockSuffix == null || lockSuffix.isBlank()) {
            throw new IllegalArgumentException("lockSuffix cannot be null or blank");
        }
        if (backupSuffix.equals(lockSuffix)) {
            throw new IllegalArgumentException("backupSuffix and lockSuffix must differ (current: " + lockSuffix + ")");
        }
    }

    /**
     * Creates a new instance with a different fsync flag.
     *
     * @param fsync the new flag
     * @return new config
     */
    public FileStateStoreConfig withFsync(boolean fsync) {
        return new FileStateStoreConfig(statePath, backupSuffix, lockSuffix, fsync);
    }

    /**
     * Path of the previous-version copy.
     *
     * @return backup path
     */
    public Path backupPath() {
        return siblingWithSuffix(backupSuffix);
    }

    /**
     * Path of the advisory lock file.
     *
     * @return lock path
     */
    public Path lockPath() {
        return siblingWithSuffix(lockSuffix);
    }

    private Path siblingWithSuffix(String suffix) {
        return statePath.resolveSibling(statePath.getFileName().toString() + suffix);
    }
}
