package com.ryuqq.provisioner.application.planner;

import com.ryuqq.provisioner.core.config.EngineConfig;

/**
 * 계획 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>destroy: State의 모든 리소스를 삭제하는 계획 생성 (desired 무시)</li>
 *   <li>refresh: 계획 전 원격 상태를 다시 읽어 State 갱신</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param destroy destroy 계획 여부
 * @param refresh 계획 전 refresh 여부
 */
public record PlanOptions(boolean destroy, boolean refresh) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: destroy=false, refresh=true</p>
     */
    public PlanOptions() {
        this(false, true);
    }

    /**
     * 엔진 설정의 refresh 기본값을 따르는 옵션.
     *
     * @param config 엔진 설정
     * @return PlanOptions
     */
    public static PlanOptions defaults(EngineConfig config) {
        return new PlanOptions(false, config.refresh());
    }

    /**
     * destroy만 변경한 새 인스턴스 생성.
     *
     * @param destroy 새로운 destroy 여부
     * @return 새 PlanOptions 인스턴스
     */
    public PlanOptions withDestroy(boolean destroy) {
        return new PlanOptions(destroy, this.refresh);
    }

    /**
     * refresh만 변경한 새 인스턴스 생성.
     *
     * @param refresh 새로운 refresh 여부
     * @return 새 PlanOptions 인스턴스
     */
    public PlanOptions withRefresh(boolean refresh) {
        return new PlanOptions(this.destroy, refresh);
    }
}
