package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.Address;

import java.util.List;

/**
 * A resource references an address that is neither desired nor tracked in state.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class UnresolvedReferenceException extends ValidationException {

    private final Address from;
    private final Address reference;

    public UnresolvedReferenceException(Address from, Address reference) {
        super(ErrorCode.UNRESOLVED_REFERENCE, List.of(from + " references unknown address " + reference));
        this.from = from;
        this.reference = reference;
    }

    public Address getFrom() {
        return from;
    }

    public Address getReference() {
        return reference;
    }
}
