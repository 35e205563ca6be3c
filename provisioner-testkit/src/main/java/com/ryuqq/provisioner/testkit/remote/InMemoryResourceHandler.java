package com.ryuqq.provisioner.testkit.remote;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.spi.HandlerContext;
import com.ryuqq.provisioner.core.spi.PlanContext;
import com.ryuqq.provisioner.core.spi.ResourceHandler;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * {@link ResourceHandler} backed by an {@link InMemoryRemote}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InMemoryResourceHandler implements ResourceHandler {

    private final InMemoryRemote remote;
    private final BiFunction<Resource, PlanContext, List<String>> validator;

    public InMemoryResourceHandler(InMemoryRemote remote) {
        this(remote, (resource, context) -> Collections.emptyList());
    }

    /**
     * Creates a handler with plan-time validation.
     *
     * @param remote the fake remote
     * @param validator validation function
     */
    public InMemoryResourceHandler(InMemoryRemote remote, BiFunction<Resource, PlanContext, List<String>> validator) {
        if (remote == null) {
            throw new IllegalArgumentException("remote cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        this.remote = remote;
        this.validator = validator;
    }

    @Override
    public List<String> validate(Resource resource, PlanContext context) {
        return validator.apply(resource, context);
    }

    @Override
    public Map<String, Object> create(HandlerContext context, Address address, Map<String, Object> attributes) {
        return remote.create(address, attributes);
    }

    @Override
    public Optional<Map<String, Object>> read(HandlerContext context, Address address) {
        return remote.read(address);
    }

    @Override
    public Map<String, Object> update(HandlerContext context, Address address, Map<String, Object> attributes) {
        return remote.update(address, attributes);
    }

    @Override
    public void delete(HandlerContext context, Address address) {
        remote.delete(address);
    }
}
