package com.ryuqq.provisioner.core.statemachine;

import com.ryuqq.provisioner.core.executor.ApplyPhase;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.plan.ResourceChange;

/**
 * Apply 중 단일 변경의 진행 추적기.
 *
 * <p>허용되는 전이만 수행하고, 전이마다 대응하는 {@link ApplyPhase}를 리스너에 알립니다.</p>
 * <ul>
 *   <li>PENDING → APPLYING: {@link ApplyPhase#START}</li>
 *   <li>APPLYING → APPLIED: {@link ApplyPhase#DONE}</li>
 *   <li>APPLYING → FAILED: {@link ApplyPhase#FAILED}</li>
 * </ul>
 *
 * <p>종료 상태(APPLIED, FAILED)에서의 전이와 단계를 건너뛰는 전이는
 * {@link IllegalStateException}입니다. 스레드 안전하지 않으며 변경 하나당 하나씩 생성합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ChangeExecution {

    private final ResourceChange change;
    private final ProgressListener listener;
    private ChangeState state = ChangeState.PENDING;

    /**
     * 생성자.
     *
     * @param change 대상 변경
     * @param listener 전이 알림을 받을 리스너
     * @throws IllegalArgumentException change 또는 listener가 null인 경우
     */
    public ChangeExecution(ResourceChange change, ProgressListener listener) {
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.change = change;
        this.listener = listener;
    }

    /**
     * 핸들러 호출 시작 (PENDING → APPLYING).
     */
    public void start() {
        moveTo(ChangeState.APPLYING);
    }

    /**
     * 핸들러 성공과 State 저장 완료 (APPLYING → APPLIED).
     */
    public void complete() {
        moveTo(ChangeState.APPLIED);
    }

    /**
     * 핸들러 또는 State 저장 실패 (APPLYING → FAILED).
     */
    public void fail() {
        moveTo(ChangeState.FAILED);
    }

    public ChangeState state() {
        return state;
    }

    public ResourceChange change() {
        return change;
    }

    private void moveTo(ChangeState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition %s from terminal state: %s → %s", change.address(), state, next));
        }
        boolean valid = switch (state) {
            case PENDING -> next == ChangeState.APPLYING;
            case APPLYING -> next == ChangeState.APPLIED || next == ChangeState.FAILED;
            case APPLIED, FAILED -> false;
        };
        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid transition for %s: %s → %s", change.address(), state, next));
        }
        state = next;
        listener.onProgress(change, phaseOf(next));
    }

    private static ApplyPhase phaseOf(ChangeState state) {
        return switch (state) {
            case APPLYING -> ApplyPhase.START;
            case APPLIED -> ApplyPhase.DONE;
            case FAILED -> ApplyPhase.FAILED;
            case PENDING -> throw new IllegalStateException("PENDING has no progress phase");
        };
    }
}
