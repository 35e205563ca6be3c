package com.ryuqq.provisioner.application.apply;

import com.ryuqq.provisioner.application.planner.PlanOptions;
import com.ryuqq.provisioner.application.planner.Planner;
import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.error.ApplyCanceledException;
import com.ryuqq.provisioner.core.error.ApplyException;
import com.ryuqq.provisioner.core.error.StalePlanException;
import com.ryuqq.provisioner.core.error.StateProjectMismatchException;
import com.ryuqq.provisioner.core.executor.ApplyPhase;
import com.ryuqq.provisioner.core.executor.CancellationSignal;
import com.ryuqq.provisioner.core.executor.ProgressListener;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.ApplyResult;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.plan.PlanMetadata;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import com.ryuqq.provisioner.core.spi.HandlerContext;
import com.ryuqq.provisioner.core.spi.ResourceHandler;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import com.ryuqq.provisioner.core.statemachine.ChangeExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plan 적용 실행자.
 *
 * <p>State 잠금을 잡은 상태에서 Plan의 변경을 기록된 순서대로 하나씩 적용하고,
 * 변경이 성공할 때마다 즉시 State를 영속화합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. withLock 진입 (이미 잠겨 있으면 StateLockException)
 * 2. State 로드 (없으면 Plan 메타데이터의 lineage/serial로 빈 State 구성)
 * 3. target key 검증 → StateProjectMismatchException
 * 4. lineage → serial → digest 순서로 staleness 검증 → StalePlanException
 * 5. For each change (NO_OP 제외):
 *    a. 취소 신호 확인 → ApplyCanceledException
 *    b. PENDING → APPLYING, listener START
 *    c. handler create/update/delete
 *    d. 성공: State 반영 + save, APPLYING → APPLIED, listener DONE
 *    e. 핸들러 실패: APPLYING → FAILED, listener FAILED, ApplyException (부분 결과 포함)
 *    f. save 실패: 원격 변경은 이미 반영됨. FAILED로 보고하고 ApplyException에 기록 누락을 명시
 * </pre>
 *
 * <p><strong>실패 정책:</strong> 롤백하지 않습니다. 이미 완료된 변경은 State에 남고,
 * 다음 plan이 남은 차이를 다시 계산합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ApplyExecutor {

    private static final Logger log = LoggerFactory.getLogger(ApplyExecutor.class);

    private final StateStore store;
    private final ResourceTypeRegistry registry;
    private final Planner planner;
    private final EngineConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store State 저장소
     * @param registry 리소스 타입 레지스트리
     * @param planner destroy 계획 생성용 Planner
     * @param config 엔진 설정
     * @param clock State 항목 시각용 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ApplyExecutor(StateStore store, ResourceTypeRegistry registry, Planner planner,
                         EngineConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (planner == null) {
            throw new IllegalArgumentException("planner cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.registry = registry;
        this.planner = planner;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Plan 적용.
     *
     * @param plan 적용할 Plan
     * @param listener 진행 리스너
     * @param cancellation 취소 신호
     * @return 성공 결과
     * @throws com.ryuqq.provisioner.core.error.StateLockException 잠금이 이미 잡혀 있는 경우
     * @throws StalePlanException Plan 이후 State가 바뀐 경우
     * @throws StateProjectMismatchException State 또는 Plan의 target key가 다른 경우
     * @throws ApplyException 핸들러가 실패한 경우 (부분 결과 포함)
     * @throws ApplyCanceledException 취소된 경우 (부분 결과 포함)
     */
    public ApplyResult apply(Plan plan, ProgressListener listener, CancellationSignal cancellation) {
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        ProgressListener safeListener = listener == null ? ProgressListener.noop() : listener;
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;

        return store.withLock(() -> {
            State state = loadForApply(plan.metadata());
            checkTarget(plan.metadata(), state);
            checkStale(plan.metadata(), state);
            return execute(plan, state, safeListener, signal);
        });
    }

    /**
     * State의 모든 리소스 삭제.
     *
     * <p>같은 잠금 안에서 destroy Plan을 만들고 바로 적용하므로 staleness가 발생하지 않습니다.</p>
     *
     * @param options 계획 옵션 (refresh 플래그 기록용)
     * @param listener 진행 리스너
     * @param cancellation 취소 신호
     * @return 성공 결과
     * @throws ApplyException 핸들러가 실패한 경우 (부분 결과 포함)
     * @throws ApplyCanceledException 취소된 경우 (부분 결과 포함)
     */
    public ApplyResult destroy(PlanOptions options, ProgressListener listener, CancellationSignal cancellation) {
        PlanOptions destroyOptions = (options == null ? PlanOptions.defaults(config) : options).withDestroy(true);
        ProgressListener safeListener = listener == null ? ProgressListener.noop() : listener;
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;

        return store.withLock(() -> {
            Optional<State> persisted = store.load();
            if (persisted.isEmpty()) {
                log.info("No state recorded for {}; nothing to destroy", config.targetKey());
                return ApplyResult.empty();
            }
            Plan plan = planner.planDestroy(persisted.get(), destroyOptions);
            return execute(plan, persisted.get(), safeListener, signal);
        });
    }

    private State loadForApply(PlanMetadata metadata) {
        Optional<State> persisted = store.load();
        if (persisted.isPresent()) {
            return persisted.get();
        }
        // 저장된 State가 없으면 Plan 시점의 빈 State로 시작
        return new State(metadata.stateLineage(), metadata.stateSerial(), config.targetKey(), Collections.emptyMap());
    }

    private void checkTarget(PlanMetadata metadata, State state) {
        if (!config.targetKey().equals(state.targetKey())) {
            throw new StateProjectMismatchException(config.targetKey(), state.targetKey());
        }
        if (!config.targetKey().equals(metadata.targetKey())) {
            throw new StateProjectMismatchException(config.targetKey(), metadata.targetKey());
        }
    }

    private static void checkStale(PlanMetadata metadata, State state) {
        if (!state.lineage().equals(metadata.stateLineage())) {
            throw new StalePlanException("State lineage changed; re-run plan");
        }
        if (state.serial() != metadata.stateSerial()) {
            throw new StalePlanException("State serial changed; re-run plan");
        }
        if (!state.digest().equals(metadata.stateDigest())) {
            throw new StalePlanException("State digest changed; re-run plan");
        }
    }

    private ApplyResult execute(Plan plan, State initial, ProgressListener listener, CancellationSignal signal) {
        HandlerContext context = new HandlerContext(config.targetKey(), config.placeholderVariables());
        ProgressListener safeListener = (change, phase) -> notify(listener, change, phase);
        List<ResourceChange> completed = new ArrayList<>();
        State state = initial;

        log.info("Apply started: {} changes against {} (serial {})",
            plan.changes().size(), state.targetKey(), state.serial());

        for (ResourceChange change : plan.changes()) {
            if (change.action() == Action.NO_OP) {
                continue;
            }
            if (signal.isCanceled()) {
                log.warn("Apply canceled after {} changes; next was {}", completed.size(), change.address());
                throw new ApplyCanceledException(ApplyResult.canceled(completed));
            }

            ChangeExecution execution = new ChangeExecution(change, safeListener);
            execution.start();

            State next;
            try {
                next = applyChange(context, change, state);
            } catch (RuntimeException e) {
                execution.fail();
                log.error("Apply failed at {} ({}): {}", change.address(), change.action(), execution.state(), e);
                throw new ApplyException(ApplyResult.failure(completed, change, errorDetail(e)), change.address(), e);
            }

            try {
                state = store.save(next);
            } catch (RuntimeException e) {
                execution.fail();
                log.error("{} {} reached the remote system but the state save failed; the next plan will not see it",
                    change.action(), change.address(), e);
                String detail = "Remote change applied but not recorded in state: " + errorDetail(e);
                throw new ApplyException(ApplyResult.failure(completed, change, detail), change.address(), e);
            }

            completed.add(change);
            execution.complete();
            log.debug("Applied {} {} → {} (serial {})",
                change.action(), change.address(), execution.state(), state.serial());
        }

        ApplyResult result = ApplyResult.success(completed);
        log.info("Apply completed: {}", result.summary());
        return result;
    }

    private State applyChange(HandlerContext context, ResourceChange change, State state) {
        ResourceHandler handler = registry.get(change.address().getType()).handler();
        Instant now = clock.instant();

        switch (change.action()) {
            case CREATE: {
                Map<String, Object> observed = handler.create(context, change.address(), change.after());
                StateEntry entry = StateEntry.created(orDesired(observed, change), change.dependencies(),
                    change.priority(), now);
                return state.withEntry(change.address(), entry);
            }
            case UPDATE: {
                Map<String, Object> observed = handler.update(context, change.address(), change.after());
                Optional<StateEntry> existing = state.entry(change.address());
                StateEntry entry = existing.isPresent()
                    ? existing.get().updated(orDesired(observed, change), change.dependencies(), change.priority(), now)
                    : StateEntry.created(orDesired(observed, change), change.dependencies(), change.priority(), now);
                return state.withEntry(change.address(), entry);
            }
            case DELETE:
                handler.delete(context, change.address());
                return state.withoutEntry(change.address());
            default:
                throw new IllegalStateException("Unexpected action for apply: " + change.action());
        }
    }

    private static Map<String, Object> orDesired(Map<String, Object> observed, ResourceChange change) {
        return observed == null ? change.after() : observed;
    }

    private static String errorDetail(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getName() : e.getMessage();
    }

    private static void notify(ProgressListener listener, ResourceChange change, ApplyPhase phase) {
        try {
            listener.onProgress(change, phase);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {} {}; ignoring", change.address(), phase, e);
        }
    }
}
