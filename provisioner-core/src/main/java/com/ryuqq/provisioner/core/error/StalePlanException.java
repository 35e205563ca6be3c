package com.ryuqq.provisioner.core.error;

/**
 * A saved plan no longer matches the live state (lineage, serial or digest changed).
 *
 * <p>Raised before any change is attempted; the caller must re-plan.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StalePlanException extends ProvisionerException {

    public StalePlanException(String message) {
        super(ErrorCode.STALE_PLAN, message);
    }
}
