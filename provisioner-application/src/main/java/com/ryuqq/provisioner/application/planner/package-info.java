/**
 * 계획 생성 패키지.
 *
 * <p>{@link com.ryuqq.provisioner.application.planner.Planner}는 desired 집합과 State를 비교해
 * 결정적 순서의 Plan을 만듭니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.planner;
