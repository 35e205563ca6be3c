/**
 * 계획(Plan) 및 적용 결과 타입 패키지.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.plan.Action} - CREATE, UPDATE, DELETE, NO_OP</li>
 *   <li>{@link com.ryuqq.provisioner.core.plan.ResourceChange} - 주소별 변경 (before/after 스냅샷, 필드 diff)</li>
 *   <li>{@link com.ryuqq.provisioner.core.plan.Plan} - 순서가 결정된 변경 목록 + 메타데이터</li>
 *   <li>{@link com.ryuqq.provisioner.core.plan.PlanMetadata} - staleness 검증용 lineage/serial/digest</li>
 *   <li>{@link com.ryuqq.provisioner.core.plan.ApplyResult} - 완료된 변경, 실패한 변경, 오류 상세</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.core.plan;
