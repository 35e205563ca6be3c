package com.ryuqq.provisioner.application.provisioner;

import com.ryuqq.provisioner.application.apply.ApplyExecutor;
import com.ryuqq.provisioner.application.drift.DriftDetector;
import com.ryuqq.provisioner.application.drift.DriftReport;
import com.ryuqq.provisioner.application.planner.PlanOptions;
import com.ryuqq.provisioner.application.planner.Planner;
import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.error.StateProjectMismatchException;
import com.ryuqq.provisioner.core.executor.CancellationSignal;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.plan.ApplyResult;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * {@link Provisioner} 기본 구현.
 *
 * <p>{@link Planner}, {@link ApplyExecutor}, {@link DriftDetector}를 하나의 StateStore와
 * 레지스트리 위에서 조합합니다.</p>
 *
 * <p><strong>잠금 범위:</strong></p>
 * <ul>
 *   <li>plan (refresh=true): drift 감지 + 계획 생성 + drift 저장 전체 (계획이 실패하면 저장하지 않음)</li>
 *   <li>plan (refresh=false): 잠금 없음 (읽기 전용)</li>
 *   <li>apply, destroy, refresh: 전체 실행 동안</li>
 *   <li>drift, state: 잠금 없음</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningEngine implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngine.class);

    private final StateStore store;
    private final EngineConfig config;
    private final Planner planner;
    private final ApplyExecutor executor;
    private final DriftDetector detector;

    /**
     * 시스템 Clock을 사용하는 생성자.
     *
     * @param store State 저장소
     * @param registry 리소스 타입 레지스트리
     * @param config 엔진 설정
     */
    public ProvisioningEngine(StateStore store, ResourceTypeRegistry registry, EngineConfig config) {
        this(store, registry, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store State 저장소
     * @param registry 리소스 타입 레지스트리
     * @param config 엔진 설정
     * @param clock 시각 소스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ProvisioningEngine(StateStore store, ResourceTypeRegistry registry, EngineConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
        this.planner = new Planner(registry, config, clock);
        this.executor = new ApplyExecutor(store, registry, planner, config, clock);
        this.detector = new DriftDetector(registry, config, clock);
    }

    @Override
    public Plan plan(List<Resource> resources, PlanOptions options) {
        PlanOptions effective = options == null ? PlanOptions.defaults(config) : options;
        if (!effective.refresh()) {
            return planner.plan(resources, loadState(), effective);
        }
        return store.withLock(() -> {
            State current = loadState();
            Optional<DriftReport> drift = detectDrift(current);
            if (drift.isEmpty()) {
                return planner.plan(resources, current, effective);
            }
            // refresh 결과는 계획이 성공한 뒤에만 저장하므로, save가 만들 serial로 먼저 계획
            State expected = drift.get().newState().nextSerial();
            Plan plan = planner.plan(resources, expected, effective);
            State saved = persist(current, drift.get());
            return saved.equals(expected) ? plan : planner.plan(resources, saved, effective);
        });
    }

    @Override
    public ApplyResult apply(Plan plan, ProgressListener listener, CancellationSignal cancellation) {
        return executor.apply(plan, listener, cancellation);
    }

    @Override
    public ApplyResult destroy(PlanOptions options, ProgressListener listener, CancellationSignal cancellation) {
        return executor.destroy(options, listener, cancellation);
    }

    @Override
    public State refresh() {
        return store.withLock(() -> {
            State current = loadState();
            return detectDrift(current).map(report -> persist(current, report)).orElse(current);
        });
    }

    @Override
    public DriftReport drift() {
        return detector.detect(loadState());
    }

    @Override
    public State state() {
        return loadState();
    }

    public EngineConfig config() {
        return config;
    }

    private State loadState() {
        State state = store.load().orElseGet(() -> State.empty(config.targetKey()));
        if (!config.targetKey().equals(state.targetKey())) {
            throw new StateProjectMismatchException(config.targetKey(), state.targetKey());
        }
        return state;
    }

    private Optional<DriftReport> detectDrift(State state) {
        if (state.isEmpty()) {
            return Optional.empty();
        }
        DriftReport report = detector.detect(state);
        return report.hasDrift() ? Optional.of(report) : Optional.empty();
    }

    private State persist(State current, DriftReport report) {
        State saved = store.save(report.newState());
        log.info("Refresh persisted {} drifted resources (serial {} → {})",
            report.changes().size(), current.serial(), saved.serial());
        return saved;
    }
}
