package com.ryuqq.provisioner.core.error;

/**
 * A saved plan artifact could not be read or written.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class PlanFileException extends ProvisionerException {

    public PlanFileException(String message) {
        super(ErrorCode.PLAN_FILE_INVALID, message);
    }

    public PlanFileException(String message, Throwable cause) {
        super(ErrorCode.PLAN_FILE_INVALID, message, cause);
    }
}
