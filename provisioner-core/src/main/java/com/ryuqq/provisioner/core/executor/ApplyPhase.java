package com.ryuqq.provisioner.core.executor;

/**
 * 변경 단위 진행 단계.
 *
 * <p>{@link ProgressListener}는 변경마다 START를 한 번 받고, 이어서 DONE 또는 FAILED를 한 번 받습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ApplyPhase {

    /**
     * 핸들러 호출 직전.
     */
    START,

    /**
     * 핸들러 성공 및 State 영속화 완료.
     */
    DONE,

    /**
     * 핸들러 실패.
     */
    FAILED
}
