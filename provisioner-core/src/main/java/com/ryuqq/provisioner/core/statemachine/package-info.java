/**
 * Apply 중 변경 단위 상태 머신 패키지.
 *
 * <p>{@link com.ryuqq.provisioner.core.statemachine.ChangeExecution}은 각 변경이
 * {@link com.ryuqq.provisioner.core.statemachine.ChangeState}의 PENDING → APPLYING → APPLIED/FAILED
 * 순서로만 진행되도록 보장하고, 전이를 진행 알림으로 내보냅니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.statemachine;
