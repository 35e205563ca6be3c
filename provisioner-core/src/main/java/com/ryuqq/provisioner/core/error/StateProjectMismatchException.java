package com.ryuqq.provisioner.core.error;

/**
 * The loaded state belongs to a different target than the current configuration.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StateProjectMismatchException extends ProvisionerException {

    private final String expected;
    private final String actual;

    public StateProjectMismatchException(String expected, String actual) {
        super(ErrorCode.STATE_TARGET_MISMATCH,
            "State target key mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
