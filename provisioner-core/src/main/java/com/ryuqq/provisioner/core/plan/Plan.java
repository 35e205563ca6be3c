package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.Address;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 순서가 결정된 변경 목록과 메타데이터.
 *
 * <p>Plan은 생성 후 불변이며, 파일로 저장했다가 나중에 staleness 검증 후 적용할 수 있습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>주소마다 정확히 하나의 변경</li>
 *   <li>changes 순서는 의존성 그래프의 유효한 위상 정렬 (우선순위 클래스 단위로 그룹화)</li>
 *   <li>DELETE는 역순 정렬</li>
 * </ul>
 *
 * @param metadata 계획 메타데이터
 * @param changes 순서가 결정된 변경 목록
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Plan(
    PlanMetadata metadata,
    List<ResourceChange> changes
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 주소가 중복된 경우
     */
    public Plan {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        changes = List.copyOf(changes);
        Set<Address> seen = new HashSet<>();
        for (ResourceChange change : changes) {
            if (!seen.add(change.address())) {
                throw new IllegalArgumentException("Plan contains more than one change for " + change.address());
            }
        }
    }

    /**
     * 액션별 변경 개수 요약.
     *
     * @return 모든 Action을 키로 가지는 개수 맵
     */
    public Map<Action, Integer> summary() {
        return ApplyResult.countByAction(changes);
    }

    /**
     * NO_OP이 아닌 변경이 있는지 확인.
     *
     * @return 원격 변경이 필요하면 true
     */
    public boolean hasChanges() {
        return changes.stream().anyMatch(change -> change.action().isMutating());
    }

    /**
     * 주소에 해당하는 변경 조회.
     *
     * @param address 대상 주소
     * @return 변경 (없으면 empty)
     */
    public Optional<ResourceChange> changeFor(Address address) {
        return changes.stream().filter(change -> change.address().equals(address)).findFirst();
    }

    /**
     * 특정 액션의 변경만 조회.
     *
     * @param action 액션
     * @return 해당 액션의 변경 (plan 순서 유지)
     */
    public List<ResourceChange> changesOf(Action action) {
        return changes.stream().filter(change -> change.action() == action).toList();
    }

    static Map<Action, Integer> emptyCounts() {
        Map<Action, Integer> counts = new EnumMap<>(Action.class);
        for (Action action : Action.values()) {
            counts.put(action, 0);
        }
        return counts;
    }
}
