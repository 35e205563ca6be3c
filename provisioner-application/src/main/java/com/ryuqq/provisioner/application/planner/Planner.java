package com.ryuqq.provisioner.application.planner;

import com.ryuqq.provisioner.core.config.EngineConfig;
import com.ryuqq.provisioner.core.error.DuplicateAddressException;
import com.ryuqq.provisioner.core.error.StateProjectMismatchException;
import com.ryuqq.provisioner.core.error.UnresolvedReferenceException;
import com.ryuqq.provisioner.core.error.ValidationException;
import com.ryuqq.provisioner.core.graph.DependencyGraph;
import com.ryuqq.provisioner.core.graph.GraphNode;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;
import com.ryuqq.provisioner.core.normalize.AttributeComparator;
import com.ryuqq.provisioner.core.normalize.PlaceholderResolver;
import com.ryuqq.provisioner.core.plan.FieldDiff;
import com.ryuqq.provisioner.core.plan.Plan;
import com.ryuqq.provisioner.core.plan.PlanMetadata;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import com.ryuqq.provisioner.core.spi.PlanContext;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistration;
import com.ryuqq.provisioner.core.spi.ResourceTypeRegistry;
import com.ryuqq.provisioner.core.state.CanonicalDigest;
import com.ryuqq.provisioner.core.state.State;
import com.ryuqq.provisioner.core.state.StateEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Diff/Plan 엔진.
 *
 * <p>desired 리소스 집합과 현재 State를 비교해 순서가 결정된 {@link Plan}을 만듭니다.
 * 순수 계산이며 State를 변경하거나 원격 시스템을 호출하지 않습니다.</p>
 *
 * <p><strong>검증 순서 (실패 시 아무것도 변경되지 않음):</strong></p>
 * <ol>
 *   <li>State target key 일치 ({@link StateProjectMismatchException})</li>
 *   <li>주소 중복 ({@link DuplicateAddressException})</li>
 *   <li>등록되지 않은 타입</li>
 *   <li>해석되지 않는 참조 ({@link UnresolvedReferenceException})</li>
 *   <li>핸들러 검증 (오류를 모아 하나의 {@link ValidationException})</li>
 *   <li>순환 의존성</li>
 * </ol>
 *
 * <p><strong>변경 순서:</strong></p>
 * <pre>
 * 1. desired 위상 정렬 순서로 CREATE / UPDATE / NO_OP
 * 2. State에만 있는 주소의 DELETE (State에 기록된 의존성의 역 위상 정렬)
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    private final ResourceTypeRegistry registry;
    private final EngineConfig config;
    private final AttributeComparator comparator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param registry 리소스 타입 레지스트리
     * @param config 엔진 설정
     * @param clock 메타데이터 시각용 Clock
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Planner(ResourceTypeRegistry registry, EngineConfig config, Clock clock) {
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
     * desired 집합으로 계획 생성.
     *
     * <p>{@code options.destroy()}가 true이면 desired를 무시하고 {@link #planDestroy}와 같습니다.</p>
     *
     * @param desired desired 리소스 (선언 순서)
     * @param state 비교 대상 State
     * @param options 계획 옵션
     * @return Plan
     */
    public Plan plan(List<Resource> desired, State state, PlanOptions options) {
        if (desired == null || state == null || options == null) {
            throw new IllegalArgumentException("desired, state and options cannot be null");
        }
        if (options.destroy()) {
            return planDestroy(state, options);
        }
        checkTarget(state);

        Map<Address, Resource> byAddress = indexByAddress(desired);
        Map<Address, Set<Address>> dependencies = resolveDependencies(byAddress, state);
        validateWithHandlers(byAddress, state);

        List<GraphNode> nodes = new ArrayList<>(byAddress.size());
        int index = 0;
        for (Resource resource : byAddress.values()) {
            nodes.add(new GraphNode(resource.address(), resource.priority(), index++,
                dependencies.get(resource.address())));
        }
        DependencyGraph graph = DependencyGraph.build(nodes, state.resources().keySet());

        List<ResourceChange> changes = new ArrayList<>();
        for (Address address : graph.topologicalOrder()) {
            Resource resource = byAddress.get(address);
            changes.add(diff(resource, dependencies.get(address), state.entry(address)));
        }

        Set<Address> removed = new TreeSet<>(state.resources().keySet());
        removed.removeAll(byAddress.keySet());
        changes.addAll(deletes(state, removed));

        Plan plan = new Plan(metadata(state, false, options.refresh(), byAddress.values()), changes);
        log.info("Planned {} changes for {} desired resources (summary: {})",
            changes.size(), byAddress.size(), plan.summary());
        return plan;
    }

    /**
     * State의 모든 리소스를 삭제하는 계획 생성.
     *
     * @param state 대상 State
     * @param options 계획 옵션 (refresh 플래그 기록용)
     * @return destroy Plan
     */
    public Plan planDestroy(State state, PlanOptions options) {
        if (state == null || options == null) {
            throw new IllegalArgumentException("state and options cannot be null");
        }
        checkTarget(state);
        List<ResourceChange> changes = deletes(state, state.resources().keySet());
        Plan plan = new Plan(metadata(state, true, options.refresh(), Collections.emptyList()), changes);
        log.info("Planned destroy of {} tracked resources", changes.size());
        return plan;
    }

    private void checkTarget(State state) {
        if (!config.targetKey().equals(state.targetKey())) {
            throw new StateProjectMismatchException(config.targetKey(), state.targetKey());
        }
    }

    private Map<Address, Resource> indexByAddress(List<Resource> desired) {
        Map<Address, Resource> byAddress = new LinkedHashMap<>();
        for (Resource resource : desired) {
            if (resource == null) {
                throw new IllegalArgumentException("desired resources cannot contain null");
            }
            if (byAddress.putIfAbsent(resource.address(), resource) != null) {
                throw new DuplicateAddressException(resource.address());
            }
            registry.get(resource.type());
        }
        return byAddress;
    }

    private Map<Address, Set<Address>> resolveDependencies(Map<Address, Resource> byAddress, State state) {
        Map<Address, Set<Address>> dependencies = new LinkedHashMap<>();
        for (Resource resource : byAddress.values()) {
            ResourceTypeRegistration registration = registry.get(resource.type());
            Set<Address> all = new TreeSet<>(resource.dependsOn());
            all.addAll(registration.references().extract(resource));
            for (Address reference : all) {
                if (!byAddress.containsKey(reference) && !state.contains(reference)) {
                    throw new UnresolvedReferenceException(resource.address(), reference);
                }
            }
            dependencies.put(resource.address(), Collections.unmodifiableSet(all));
        }
        return dependencies;
    }

    private void validateWithHandlers(Map<Address, Resource> byAddress, State state) {
        PlanContext context = new PlanContext(config.targetKey(), byAddress, state);
        List<String> errors = new ArrayList<>();
        for (Resource resource : byAddress.values()) {
            List<String> resourceErrors = registry.get(resource.type()).handler().validate(resource, context);
            if (resourceErrors == null) {
                continue;
            }
            for (String error : resourceErrors) {
                errors.add(resource.address() + ": " + error);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private ResourceChange diff(Resource resource, Set<Address> dependencies, Optional<StateEntry> current) {
        if (current.isEmpty()) {
            return ResourceChange.create(resource, dependencies);
        }
        Map<String, Object> before = current.get().attributes();
        List<FieldDiff> fieldDiffs = comparator.compareDeclared(resource.attributes(), before);
        if (fieldDiffs.isEmpty()) {
            return ResourceChange.noOp(resource, before, dependencies);
        }
        return ResourceChange.update(resource, before, fieldDiffs, dependencies);
    }

    private List<ResourceChange> deletes(State state, Set<Address> removed) {
        if (removed.isEmpty()) {
            return Collections.emptyList();
        }
        Set<Address> deleteSet = new HashSet<>(removed);
        List<GraphNode> nodes = new ArrayList<>(deleteSet.size());
        int index = 0;
        for (Address address : new TreeSet<>(removed)) {
            StateEntry entry = state.resources().get(address);
            // 삭제에 필요한 핸들러가 없으면 계획 단계에서 실패
            registry.get(address.getType());
            Set<Address> deps = new TreeSet<>(entry.dependencies());
            deps.retainAll(deleteSet);
            nodes.add(new GraphNode(address, entry.priority(), index++, deps));
        }
        List<ResourceChange> changes = new ArrayList<>(nodes.size());
        for (Address address : DependencyGraph.lenient(nodes).reverseTopologicalOrder()) {
            StateEntry entry = state.resources().get(address);
            changes.add(ResourceChange.delete(address, entry.attributes(), entry.dependencies(), entry.priority()));
        }
        return changes;
    }

    private PlanMetadata metadata(State state, boolean destroy, boolean refresh,
                                  Collection<Resource> desired) {
        return new PlanMetadata(
            config.targetKey(),
            clock.instant(),
            destroy,
            refresh,
            state.lineage(),
            state.serial(),
            state.digest(),
            CanonicalDigest.ofResources(desired),
            config.engineVersion()
        );
    }
}
