package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.Resource;

import java.util.List;

/**
 * Source of the desired resource set (the schema/configuration layer).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResourceProvider {

    /**
     * Produces the desired resources in declaration order.
     *
     * @return desired resources
     */
    List<Resource> resources();
}
