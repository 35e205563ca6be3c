package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.Address;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The dependency graph contains a cycle.
 *
 * <p>{@link #getCycle()} is the full cycle path in traversal order, closed by
 * repeating its first address (e.g. {@code [a, b, a]}).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DependencyCycleException extends ProvisionerException {

    private final List<Address> cycle;

    public DependencyCycleException(List<Address> cycle) {
        super(ErrorCode.DEPENDENCY_CYCLE, ErrorCode.DEPENDENCY_CYCLE.getDefaultMessage() + ": "
            + cycle.stream().map(Address::getValue).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<Address> getCycle() {
        return cycle;
    }
}
