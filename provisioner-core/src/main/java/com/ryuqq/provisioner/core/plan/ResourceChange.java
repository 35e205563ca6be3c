package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Attributes;
import com.ryuqq.provisioner.core.model.Resource;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 단일 주소에 대한 계획된 변경.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>address:</strong> 대상 리소스 주소</li>
 *   <li><strong>action:</strong> CREATE, UPDATE, DELETE, NO_OP</li>
 *   <li><strong>before:</strong> 계획 시점의 State 스냅샷 (CREATE는 null)</li>
 *   <li><strong>after:</strong> 원하는 속성 스냅샷 (DELETE는 null)</li>
 *   <li><strong>diff:</strong> 필드 단위 차이 (UPDATE만 비어있지 않음, 필드명 정렬)</li>
 *   <li><strong>dependencies:</strong> 적용 성공 시 State에 기록할 의존 주소 (명시적 + 암시적)</li>
 *   <li><strong>priority:</strong> 적용 성공 시 State에 기록할 우선순위 클래스</li>
 * </ul>
 *
 * @param address 대상 주소
 * @param action 변경 액션
 * @param before 변경 전 속성 (null 가능)
 * @param after 변경 후 속성 (null 가능)
 * @param diff 필드 단위 차이
 * @param dependencies 의존 주소 집합
 * @param priority 우선순위 클래스
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceChange(
    Address address,
    Action action,
    Map<String, Object> before,
    Map<String, Object> after,
    List<FieldDiff> diff,
    Set<Address> dependencies,
    int priority
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 액션과 스냅샷이 맞지 않는 경우
     */
    public ResourceChange {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (action == Action.CREATE && before != null) {
            throw new IllegalArgumentException("CREATE change cannot carry a before snapshot: " + address);
        }
        if (action != Action.DELETE && after == null) {
            throw new IllegalArgumentException(action + " change requires an after snapshot: " + address);
        }
        if (action == Action.DELETE && after != null) {
            throw new IllegalArgumentException("DELETE change cannot carry an after snapshot: " + address);
        }
        before = before == null ? null : Attributes.copyOf(before);
        after = after == null ? null : Attributes.copyOf(after);
        diff = diff == null ? Collections.emptyList() : List.copyOf(diff);
        if (action != Action.UPDATE && !diff.isEmpty()) {
            throw new IllegalArgumentException("Only UPDATE changes carry a field diff: " + address);
        }
        dependencies = dependencies == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(dependencies));
    }

    /**
     * CREATE 변경 생성.
     *
     * @param resource 원하는 리소스
     * @param dependencies 명시적 + 암시적 의존 주소
     * @return ResourceChange
     */
    public static ResourceChange create(Resource resource, Set<Address> dependencies) {
        return new ResourceChange(resource.address(), Action.CREATE, null, resource.attributes(),
            null, dependencies, resource.priority());
    }

    /**
     * UPDATE 변경 생성.
     *
     * @param resource 원하는 리소스
     * @param before 현재 State 속성
     * @param diff 필드 단위 차이 (비어있으면 안 됨)
     * @param dependencies 명시적 + 암시적 의존 주소
     * @return ResourceChange
     */
    public static ResourceChange update(Resource resource, Map<String, Object> before, List<FieldDiff> diff,
                                        Set<Address> dependencies) {
        if (diff == null || diff.isEmpty()) {
            throw new IllegalArgumentException("UPDATE change requires a non-empty diff: " + resource.address());
        }
        return new ResourceChange(resource.address(), Action.UPDATE, before, resource.attributes(),
            diff, dependencies, resource.priority());
    }

    /**
     * NO_OP 변경 생성.
     *
     * @param resource 원하는 리소스
     * @param before 현재 State 속성
     * @param dependencies 명시적 + 암시적 의존 주소
     * @return ResourceChange
     */
    public static ResourceChange noOp(Resource resource, Map<String, Object> before, Set<Address> dependencies) {
        return new ResourceChange(resource.address(), Action.NO_OP, before, resource.attributes(),
            null, dependencies, resource.priority());
    }

    /**
     * DELETE 변경 생성.
     *
     * @param address 삭제할 주소
     * @param before 현재 State 속성
     * @param dependencies State에 기록된 의존 주소
     * @param priority State에 기록된 우선순위 클래스
     * @return ResourceChange
     */
    public static ResourceChange delete(Address address, Map<String, Object> before, Set<Address> dependencies,
                                        int priority) {
        return new ResourceChange(address, Action.DELETE, before, null, null, dependencies, priority);
    }
}
