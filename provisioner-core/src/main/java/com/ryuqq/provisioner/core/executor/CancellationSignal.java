package com.ryuqq.provisioner.core.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협조적 취소 신호.
 *
 * <p>Apply는 각 변경을 시작하기 전에 신호를 확인합니다. 진행 중인 핸들러 호출은
 * 중단하지 않으며, 현재 변경이 끝난 뒤 멈춥니다.</p>
 *
 * <p>다른 스레드(예: SIGINT 처리기)에서 {@link #cancel()}을 호출해도 안전합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicBoolean canceled = new AtomicBoolean(false);

    /**
     * 취소 요청.
     *
     * @return 이번 호출로 처음 취소된 경우 true
     */
    public boolean cancel() {
        return canceled.compareAndSet(false, true);
    }

    /**
     * 취소 요청 여부 확인.
     *
     * @return 취소가 요청되었으면 true
     */
    public boolean isCanceled() {
        return canceled.get();
    }

    /**
     * 새 신호 생성 (취소되지 않은 상태).
     *
     * @return CancellationSignal
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }
}
