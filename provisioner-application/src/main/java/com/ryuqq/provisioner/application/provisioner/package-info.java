/**
 * Provisioner 진입점 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.application.provisioner.Provisioner} - plan, apply, destroy, refresh, drift, state</li>
 *   <li>{@link com.ryuqq.provisioner.application.provisioner.ProvisioningEngine} - 기본 구현</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.provisioner;
