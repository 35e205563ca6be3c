package com.ryuqq.provisioner.core.error;

/**
 * Base exception for all provisioning engine errors.
 *
 * <p>Carries an {@link ErrorCode} for standardized error handling. All engine errors
 * are unchecked and are raised to the caller of plan/apply; the engine performs no
 * silent recovery.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public abstract class ProvisionerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ProvisionerException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected ProvisionerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ProvisionerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
