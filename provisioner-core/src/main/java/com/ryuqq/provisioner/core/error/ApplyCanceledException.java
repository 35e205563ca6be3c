package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.plan.ApplyResult;

/**
 * Cooperative cancellation was observed between changes.
 *
 * <p>Distinct from {@link ApplyException} so callers can treat it as user-initiated.
 * Carries the partial {@link ApplyResult}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ApplyCanceledException extends ProvisionerException {

    private final transient ApplyResult result;

    public ApplyCanceledException(ApplyResult result) {
        super(ErrorCode.APPLY_CANCELED,
            "Apply canceled after " + result.completed().size() + " completed change(s)");
        this.result = result;
    }

    public ApplyResult getResult() {
        return result;
    }
}
