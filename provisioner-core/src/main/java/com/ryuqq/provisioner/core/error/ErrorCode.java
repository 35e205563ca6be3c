package com.ryuqq.provisioner.core.error;

/**
 * Standardized error codes for the provisioning engine.
 *
 * <p>Each engine error carries a unique code so that callers (CLI, CI pipelines,
 * UI layers) can decide how to react without parsing messages.</p>
 *
 * <p><strong>Format:</strong> PRV-{CATEGORY}{NUMBER}</p>
 * <ul>
 *   <li>1xx: Validation errors (nothing mutated)</li>
 *   <li>2xx: State errors (lock, staleness, ownership, storage, saved plans)</li>
 *   <li>3xx: Apply errors (partial progress preserved)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_FAILED("PRV-100", "Resource validation failed", ErrorCategory.RECOVERABLE),
    UNKNOWN_RESOURCE_TYPE("PRV-101", "Unknown resource type", ErrorCategory.RECOVERABLE),
    DUPLICATE_ADDRESS("PRV-102", "Duplicate resource address", ErrorCategory.RECOVERABLE),
    UNRESOLVED_REFERENCE("PRV-103", "Reference to unknown address", ErrorCategory.RECOVERABLE),
    DEPENDENCY_CYCLE("PRV-110", "Dependency cycle detected", ErrorCategory.RECOVERABLE),

    // ==================== State Errors (2xx) ====================

    STATE_LOCKED("PRV-200", "State is locked by another process", ErrorCategory.RECOVERABLE),
    STALE_PLAN("PRV-210", "Plan is stale; re-run plan", ErrorCategory.RECOVERABLE),
    STATE_TARGET_MISMATCH("PRV-220", "State belongs to a different target", ErrorCategory.FATAL),
    STATE_STORAGE_FAILED("PRV-230", "State storage failure", ErrorCategory.FATAL),
    PLAN_FILE_INVALID("PRV-240", "Saved plan cannot be read or written", ErrorCategory.RECOVERABLE),

    // ==================== Apply Errors (3xx) ====================

    APPLY_FAILED("PRV-300", "Apply failed", ErrorCategory.RECOVERABLE),
    APPLY_CANCELED("PRV-310", "Apply canceled", ErrorCategory.RECOVERABLE);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - caller can fix the input or re-run plan/apply.
         */
        RECOVERABLE,

        /**
         * Fatal errors - state file needs manual inspection.
         */
        FATAL
    }
}
