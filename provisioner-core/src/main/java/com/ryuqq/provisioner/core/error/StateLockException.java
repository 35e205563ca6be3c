package com.ryuqq.provisioner.core.error;

/**
 * The state lock is held by another process (or another caller in this process).
 *
 * <p>Acquisition never blocks: the caller should retry later.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StateLockException extends ProvisionerException {

    public StateLockException(String message) {
        super(ErrorCode.STATE_LOCKED, message);
    }

    public StateLockException(String message, Throwable cause) {
        super(ErrorCode.STATE_LOCKED, message, cause);
    }
}
