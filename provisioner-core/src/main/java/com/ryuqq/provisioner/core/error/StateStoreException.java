package com.ryuqq.provisioner.core.error;

/**
 * The state could not be read or written (I/O failure, corrupt content, digest mismatch).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StateStoreException extends ProvisionerException {

    public StateStoreException(String message) {
        super(ErrorCode.STATE_STORAGE_FAILED, message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(ErrorCode.STATE_STORAGE_FAILED, message, cause);
    }
}
