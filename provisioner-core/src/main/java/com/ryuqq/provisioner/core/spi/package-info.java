/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams between the engine and the outside world.</p>
 *
 * <h2>Implemented by adapters</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.StateStore} - Persisted state with atomic save and an exclusive lock</li>
 * </ul>
 *
 * <h2>Implemented by integrators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceHandler} - Per-type CRUD against the remote system</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceProvider} - Desired resources from the configuration layer</li>
 * </ul>
 *
 * <h2>Type dispatch</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceTypeRegistry} - Type tag to priority, references and handler</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.spi;
