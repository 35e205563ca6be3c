package com.ryuqq.provisioner.application.drift;

import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Attributes;
import com.ryuqq.provisioner.core.normalize.AttributeComparator;
import com.ryuqq.provisioner.core.normalize.PlaceholderResolver;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.FieldDiff;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import com.ryuqq.provisioner.core.spi.HandlerContext;
import com.ryuqq.provisioner.core.spi.ResourceHandler;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 원격 시스템과 State의 차이(drift) 감지기.
 *
 * <p>State에 기록된 모든 주소를 타입 핸들러로 다시 읽어 비교합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>원격에 없음 → DELETE (newState에서 항목 제거)</li>
 *   <li>속성이 다름 (placeholder 정규화 후) → UPDATE (newState에서 속성 교체)</li>
 *   <li>CREATE는 만들지 않음 (State에 없는 원격 객체는 추적 대상이 아님)</li>
 * </ul>
 *
 * <p>감지만 하며 영속화하지 않습니다. 저장 여부는 호출자가 {@link DriftReport#hasDrift()}로 결정합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final ResourceTypeRegistry registry;
    private final EngineConfig config;
    private final AttributeComparator comparator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param registry 리소스 타입 레지스트리
     * @param config 엔진 설정
     * @param clock 갱신 시각용 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DriftDetector(ResourceTypeRegistry registry, EngineConfig config, Clock clock) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.config = config;
        this.comparator = new AttributeComparator(new PlaceholderResolver(config.placeholderVariables()));
        this.clock = clock;
    }

    /**
     * Drift 감지.
     *
     * @param state 기준 State
     * @return 감지 결과
     */
    public DriftReport detect(State state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        HandlerContext context = new HandlerContext(config.targetKey(), config.placeholderVariables());
        List<ResourceChange> changes = new ArrayList<>();
        State newState = state;

        for (Map.Entry<Address, StateEntry> tracked : state.resources().entrySet()) {
            Address address = tracked.getKey();
            StateEntry entry = tracked.getValue();
            ResourceHandler handler = registry.get(address.getType()).handler();

            Optional<Map<String, Object>> observed = handler.read(context, address);
            if (observed.isEmpty()) {
                log.info("Drift detected: {} no longer exists remotely", address);
                changes.add(ResourceChange.delete(address, entry.attributes(), entry.dependencies(), entry.priority()));
                newState = newState.withoutEntry(address);
                continue;
            }

            Map<String, Object> actual = Attributes.copyOf(observed.get());
            List<FieldDiff> diffs = comparator.compareAll(entry.attributes(), actual);
            if (!diffs.isEmpty()) {
                log.info("Drift detected: {} changed fields {}", address,
                    diffs.stream().map(FieldDiff::field).toList());
                changes.add(new ResourceChange(address, Action.UPDATE, entry.attributes(), actual, diffs,
                    entry.dependencies(), entry.priority()));
                newState = newState.withEntry(address, entry.withAttributes(actual, clock.instant()));
            }
        }

        log.debug("Drift check of {} tracked resources found {} changes", state.resources().size(), changes.size());
        return new DriftReport(changes, newState);
    }
}
