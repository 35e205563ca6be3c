/**
 * Reusable contract tests for {@link com.ryuqq.provisioner.core.spi.StateStore} implementations
 * and the end-to-end plan/apply cycle.
 *
 * <p>Adapter modules extend these classes and supply a store factory.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.contract;
