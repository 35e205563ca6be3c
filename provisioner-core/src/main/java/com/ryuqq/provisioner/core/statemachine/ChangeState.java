package com.ryuqq.provisioner.core.statemachine;

/**
 * Apply 중 단일 변경의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (핸들러 호출 시작)
 * APPLYING
 *    │
 *    ├─► APPLIED (핸들러 성공 + State 영속화)
 *    │
 *    └─► FAILED (핸들러 실패)
 *
 * 금지된 전이:
 * - APPLIED → APPLYING ❌
 * - FAILED → APPLYING ❌
 * - PENDING → APPLIED ❌
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ChangeState {

    /**
     * 대기 중 (아직 적용 시작 안 됨).
     */
    PENDING,

    /**
     * 핸들러 호출 중.
     */
    APPLYING,

    /**
     * 적용 완료 (State에 반영됨).
     */
    APPLIED,

    /**
     * 적용 실패.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return APPLIED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == APPLIED || this == FAILED;
    }
}
