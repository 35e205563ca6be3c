package com.ryuqq.provisioner.core.graph;

import com.ryuqq.provisioner.core.model.Address;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 의존성 그래프의 노드.
 *
 * @param address 노드 주소
 * @param priority 우선순위 클래스 (낮을수록 먼저)
 * @param index 선언 순서 (동일 우선순위 내 tie-break)
 * @param dependencies 의존 주소 집합 (명시적 + 암시적)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record GraphNode(
    Address address,
    int priority,
    int index,
    Set<Address> dependencies
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException address가 null이거나 index가 음수인 경우
     */
    public GraphNode {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        dependencies = dependencies == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(dependencies));
    }
}
