package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.plan.ApplyResult;

/**
 * A handler operation failed mid-apply.
 *
 * <p>Carries the partial {@link ApplyResult} (everything completed before the failure,
 * already persisted to state) and the address that failed. The handler's exception is
 * the cause. Re-running plan then apply retries only the unfinished addresses.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ApplyException extends ProvisionerException {

    private final transient ApplyResult result;
    private final Address address;

    public ApplyException(ApplyResult result, Address address, Throwable cause) {
        super(ErrorCode.APPLY_FAILED,
            "Apply failed on " + address + ": " + (cause == null ? "unknown error" : cause.getMessage()),
            cause);
        this.result = result;
        this.address = address;
    }

    public ApplyResult getResult() {
        return result;
    }

    public Address getAddress() {
        return address;
    }
}
