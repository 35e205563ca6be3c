package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.state.State;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only view handed to {@link ResourceHandler#validate(Resource, PlanContext)}.
 *
 * <p>Merges the desired set with the addresses already tracked in state so that
 * handlers can check cross-resource constraints (e.g. a recipe's output dataset
 * exists either in the configuration or in the remote project).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PlanContext {

    private final String targetKey;
    private final Map<Address, Resource> desired;
    private final State state;

    /**
     * Creates a plan context.
     *
     * @param targetKey the remote project key
     * @param desired desired resources in declaration order
     * @param state the state being planned against
     * @throws IllegalArgumentException if any argument is null
     */
    public PlanContext(String targetKey, Map<Address, Resource> desired, State state) {
        if (targetKey == null || desired == null || state == null) {
            throw new IllegalArgumentException("targetKey, desired and state cannot be null");
        }
        this.targetKey = targetKey;
        this.desired = Collections.unmodifiableMap(new LinkedHashMap<>(desired));
        this.state = state;
    }

    public String targetKey() {
        return targetKey;
    }

    /**
     * Looks up a desired resource.
     *
     * @param address the address
     * @return the desired resource, or empty if the address is not declared
     */
    public Optional<Resource> desired(Address address) {
        return Optional.ofNullable(desired.get(address));
    }

    /**
     * Checks whether an address is declared or tracked in state.
     *
     * @param address the address
     * @return true if the address is known to this plan
     */
    public boolean exists(Address address) {
        return desired.containsKey(address) || state.contains(address);
    }

    /**
     * All known addresses (desired ∪ state), sorted.
     *
     * @return the address set
     */
    public Set<Address> addresses() {
        Set<Address> all = new TreeSet<>(desired.keySet());
        all.addAll(state.resources().keySet());
        return Collections.unmodifiableSet(all);
    }

    public State state() {
        return state;
    }
}
