/**
 * Apply 실행 보조 타입 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.executor.ProgressListener} - 변경 단위 진행 알림</li>
 *   <li>{@link com.ryuqq.provisioner.core.executor.ApplyPhase} - START, DONE, FAILED</li>
 *   <li>{@link com.ryuqq.provisioner.core.executor.CancellationSignal} - 변경 사이의 협조적 취소</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.executor;
