/**
 * Plan 적용 패키지.
 *
 * <p>{@link com.ryuqq.provisioner.application.apply.ApplyExecutor}는 잠금, staleness 검증,
 * 변경 단위 상태 전이, 변경마다의 State 영속화를 담당합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.apply;
