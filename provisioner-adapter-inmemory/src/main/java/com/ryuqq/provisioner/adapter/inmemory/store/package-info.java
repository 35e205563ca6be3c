/**
 * In-memory implementation of the state store SPI.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.inmemory.store.InMemoryStateStore} - Atomic-reference backed state with a non-reentrant lock</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All operations are safe to call from multiple threads. The lock excludes concurrent
 * apply/refresh workflows the same way the file-based store does across processes.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.inmemory.store;
