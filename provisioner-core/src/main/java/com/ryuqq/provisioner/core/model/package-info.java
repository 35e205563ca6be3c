/**
 * Core domain model package containing resource addresses and desired resources.
 *
 * <p>This package defines the immutable value types the engine consumes from the
 * schema layer:</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.Address} - {@code {type}.{name}} unique resource address</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.Resource} - Desired resource (attributes, explicit dependencies, priority class)</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.Attributes} - Deep, key-sorted, immutable attribute normalization</li>
 * </ul>
 *
 * <h2>Functions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.ReferenceExtractor} - Per-type implicit reference extraction</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Determinism:</strong> Attribute maps and dependency sets are always sorted</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.model;
