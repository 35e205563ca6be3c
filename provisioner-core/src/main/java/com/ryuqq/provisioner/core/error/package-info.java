/**
 * Engine error taxonomy.
 *
 * <p>Every engine error extends {@link com.ryuqq.provisioner.core.error.ProvisionerException}
 * and carries an {@link com.ryuqq.provisioner.core.error.ErrorCode}.</p>
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li><strong>Validation</strong> (unknown type, duplicate address, unresolved reference) - nothing mutated</li>
 *   <li><strong>DependencyCycle</strong> - carries the full cycle path</li>
 *   <li><strong>StateLock</strong> - lock held elsewhere, fail fast</li>
 *   <li><strong>StalePlan</strong> - saved plan no longer matches state</li>
 *   <li><strong>StateProjectMismatch</strong> - state belongs to another target</li>
 *   <li><strong>Apply</strong> / <strong>Cancel</strong> - partial result preserved and persisted</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.error;
