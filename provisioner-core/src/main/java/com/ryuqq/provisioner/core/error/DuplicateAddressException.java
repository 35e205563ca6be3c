package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.Address;

import java.util.List;

/**
 * Multiple desired resources share the same address.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DuplicateAddressException extends ValidationException {

    private final Address address;

    public DuplicateAddressException(Address address) {
        super(ErrorCode.DUPLICATE_ADDRESS, List.of("Duplicate resource address: " + address));
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
