package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-type CRUD handler against the remote system.
 *
 * <p>Handlers are black boxes to the engine. They are called one at a time, in plan
 * order, and any exception they throw stops the apply.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>{@code create}/{@code update} return the attributes observed after the call; those are recorded in state</li>
 *   <li>{@code read} returns empty when the object no longer exists remotely</li>
 *   <li>{@code validate} returns human-readable errors and must not call the remote system</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ResourceHandler {

    /**
     * Validates a desired resource during planning.
     *
     * @param resource the desired resource
     * @param context the merged desired/state view
     * @return validation errors (empty if valid)
     */
    default List<String> validate(Resource resource, PlanContext context) {
        return Collections.emptyList();
    }

    /**
     * Creates the remote object.
     *
     * @param context handler context
     * @param address the address being created
     * @param attributes desired attributes
     * @return attributes observed after creation
     */
    Map<String, Object> create(HandlerContext context, Address address, Map<String, Object> attributes);

    /**
     * Reads the remote object.
     *
     * @param context handler context
     * @param address the address to read
     * @return observed attributes, or empty if the object does not exist
     */
    Optional<Map<String, Object>> read(HandlerContext context, Address address);

    /**
     * Updates the remote object.
     *
     * @param context handler context
     * @param address the address being updated
     * @param attributes desired attributes
     * @return attributes observed after the update
     */
    Map<String, Object> update(HandlerContext context, Address address, Map<String, Object> attributes);

    /**
     * Deletes the remote object.
     *
     * @param context handler context
     * @param address the address being deleted
     */
    void delete(HandlerContext context, Address address);
}
