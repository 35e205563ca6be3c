package com.ryuqq.provisioner.application.provisioner;

import com.ryuqq.provisioner.application.drift.DriftReport;
import com.ryuqq.provisioner.application.planner.PlanOptions;
import com.ryuqq.provisioner.core.executor.CancellationSignal;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.plan.ApplyResult;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.state.State;

import java.util.List;

/**
 * 선언적 프로비저닝 진입점.
 *
 * <p>desired 리소스 집합으로 계획을 만들고, 계획을 적용하며, State를 조회/갱신합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Plan plan = provisioner.plan(provider, new PlanOptions());
 * if (plan.hasChanges()) {
 *     ApplyResult result = provisioner.apply(plan, (change, phase) -&gt; log.info("{} {}", phase, change.address()));
 * }
 * </pre>
 *
 * <p><strong>저장된 계획:</strong> Plan은 파일로 저장했다가 나중에 적용할 수 있습니다.
 * 그 사이 State가 바뀌었으면 apply가 {@link com.ryuqq.provisioner.core.error.StalePlanException}으로 거부합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Provisioner {

    /**
     * ResourceProvider의 desired 집합으로 계획 생성.
     *
     * @param provider desired 리소스 제공자
     * @param options 계획 옵션
     * @return Plan
     */
    default Plan plan(ResourceProvider provider, PlanOptions options) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        return plan(provider.resources(), options);
    }

    /**
     * desired 리소스로 계획 생성.
     *
     * <p>refresh 옵션이 켜져 있으면 State 잠금 안에서 drift를 먼저 반영합니다.</p>
     *
     * @param resources desired 리소스 (선언 순서)
     * @param options 계획 옵션
     * @return Plan
     * @throws com.ryuqq.provisioner.core.error.ValidationException 검증 실패 시
     * @throws com.ryuqq.provisioner.core.error.DependencyCycleException 순환 의존성이 있는 경우
     * @throws com.ryuqq.provisioner.core.error.StateLockException refresh 중 잠금을 얻지 못한 경우
     */
    Plan plan(List<Resource> resources, PlanOptions options);

    /**
     * 계획 적용.
     *
     * @param plan 적용할 Plan
     * @param listener 진행 리스너
     * @param cancellation 취소 신호
     * @return 결과
     * @throws com.ryuqq.provisioner.core.error.ApplyException 핸들러 실패 시 (부분 결과 포함)
     * @throws com.ryuqq.provisioner.core.error.ApplyCanceledException 취소 시 (부분 결과 포함)
     */
    ApplyResult apply(Plan plan, ProgressListener listener, CancellationSignal cancellation);

    default ApplyResult apply(Plan plan, ProgressListener listener) {
        return apply(plan, listener, CancellationSignal.create());
    }

    default ApplyResult apply(Plan plan) {
        return apply(plan, ProgressListener.noop(), CancellationSignal.create());
    }

    /**
     * State의 모든 리소스 삭제.
     *
     * @param options 계획 옵션
     * @param listener 진행 리스너
     * @param cancellation 취소 신호
     * @return 결과
     */
    ApplyResult destroy(PlanOptions options, ProgressListener listener, CancellationSignal cancellation);

    default ApplyResult destroy() {
        return destroy(null, ProgressListener.noop(), CancellationSignal.create());
    }

    /**
     * 계획 생성 후 바로 적용.
     *
     * @param resources desired 리소스
     * @param options 계획 옵션
     * @param listener 진행 리스너
     * @param cancellation 취소 신호
     * @return 결과
     */
    default ApplyResult planAndApply(List<Resource> resources, PlanOptions options,
                                     ProgressListener listener, CancellationSignal cancellation) {
        return apply(plan(resources, options), listener, cancellation);
    }

    /**
     * 원격 상태를 다시 읽어 State를 갱신하고 저장.
     *
     * @return 갱신된 State (변경이 없으면 기존 State)
     */
    State refresh();

    /**
     * Drift 감지 (저장하지 않음).
     *
     * @return 감지 결과
     */
    DriftReport drift();

    /**
     * 현재 State 조회.
     *
     * @return 저장된 State, 없으면 빈 State
     */
    State state();
}
