package com.ryuqq.provisioner.core.error;

import java.util.List;

/**
 * One or more desired resources failed validation during planning.
 *
 * <p>Raised before anything is mutated. The message lists every error so that a
 * single plan run reports all problems at once.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ValidationException extends ProvisionerException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        this(ErrorCode.VALIDATION_FAILED, errors);
    }

    protected ValidationException(ErrorCode errorCode, List<String> errors) {
        super(errorCode, buildMessage(errorCode, errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(ErrorCode errorCode, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        StringBuilder sb = new StringBuilder(errorCode.getDefaultMessage()).append(':');
        for (String error : errors) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
