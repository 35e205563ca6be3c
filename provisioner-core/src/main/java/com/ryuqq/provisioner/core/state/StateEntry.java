package com.ryuqq.provisioner.core.state;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Attributes;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * State에 기록된 단일 리소스 항목.
 *
 * <p>마지막으로 성공한 적용 결과(원격 시스템이 반환한 속성)와 그 시점의 의존성,
 * 우선순위 클래스를 보관합니다. 의존성은 desired에서 제거된 리소스의 DELETE 순서를
 * 계산할 때 사용됩니다.</p>
 *
 * @param attributes 마지막으로 관측된 속성
 * @param dependencies 적용 시점의 의존 주소 집합
 * @param priority 적용 시점의 우선순위 클래스
 * @param createdAt 최초 생성 시각
 * @param updatedAt 마지막 변경 시각
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record StateEntry(
    Map<String, Object> attributes,
    Set<Address> dependencies,
    int priority,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 시각 순서가 잘못된 경우
     */
    public StateEntry {
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(
                "updatedAt cannot be before createdAt (createdAt: " + createdAt + ", updatedAt: " + updatedAt + ")");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be non-negative (current: " + priority + ")");
        }
        attributes = Attributes.copyOf(attributes);
        dependencies = dependencies == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(dependencies));
    }

    /**
     * 새로 생성된 리소스 항목.
     *
     * @param attributes 원격 시스템이 반환한 속성
     * @param dependencies 의존 주소 집합
     * @param priority 우선순위 클래스
     * @param now 생성 시각
     * @return StateEntry
     */
    public static StateEntry created(Map<String, ?> attributes, Set<Address> dependencies, int priority, Instant now) {
        return new StateEntry(Attributes.copyOf(attributes), dependencies, priority, now, now);
    }

    /**
     * 속성과 의존성을 교체한 새 항목 (createdAt 유지).
     *
     * @param newAttributes 새 속성
     * @param newDependencies 새 의존 주소 집합
     * @param newPriority 새 우선순위 클래스
     * @param now 변경 시각
     * @return 새 StateEntry
     */
    public StateEntry updated(Map<String, ?> newAttributes, Set<Address> newDependencies, int newPriority,
                              Instant now) {
        Instant updated = now.isBefore(createdAt) ? createdAt : now;
        return new StateEntry(Attributes.copyOf(newAttributes), newDependencies, newPriority, createdAt, updated);
    }

    /**
     * 속성만 교체한 새 항목 (drift refresh용).
     *
     * @param newAttributes 원격 시스템에서 읽은 속성
     * @param now 변경 시각
     * @return 새 StateEntry
     */
    public StateEntry withAttributes(Map<String, ?> newAttributes, Instant now) {
        return updated(newAttributes, dependencies, priority, now);
    }
}
