package com.ryuqq.provisioner.core.executor;

import com.ryuqq.provisioner.core.plan.ResourceChange;

/**
 * Apply 진행 상황 콜백.
 *
 * <p>알림 전용입니다. 리스너가 던진 예외는 로그로 남기고 무시되며 Apply 흐름에 영향을 주지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProgressListener listener = (change, phase) -&gt;
 *     System.out.println(phase + " " + change.action().getSymbol() + " " + change.address());
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * 진행 단계 알림.
     *
     * @param change 대상 변경
     * @param phase 진행 단계
     */
    void onProgress(ResourceChange change, ApplyPhase phase);

    /**
     * 아무것도 하지 않는 리스너.
     *
     * @return no-op 리스너
     */
    static ProgressListener noop() {
        return (change, phase) -> { };
    }
}
