package com.ryuqq.provisioner.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 원하는 상태(desired)로 선언된 리소스.
 *
 * <p>Resource는 계획 사이클마다 스키마 레이어가 생성하는 일시적인 설명이며,
 * 엔진은 이를 읽기만 합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>address:</strong> {@code {type}.{name}} 고유 주소</li>
 *   <li><strong>attributes:</strong> 정규화된 속성 맵 ({@link Attributes#copyOf(Map)})</li>
 *   <li><strong>dependsOn:</strong> 명시적 의존 주소 집합</li>
 *   <li><strong>priority:</strong> 우선순위 클래스 (낮을수록 먼저 적용, 기본 100)</li>
 * </ul>
 *
 * <p>암시적 참조(inputs/outputs/zone 등)는 Resource가 직접 보유하지 않고,
 * 타입별 {@link ReferenceExtractor}가 속성으로부터 계산합니다.</p>
 *
 * @param address 고유 주소
 * @param attributes 속성 맵
 * @param dependsOn 명시적 의존 주소 집합
 * @param priority 우선순위 클래스
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Resource(
    Address address,
    Map<String, Object> attributes,
    Set<Address> dependsOn,
    int priority
) {

    /**
     * 기본 우선순위 클래스.
     */
    public static final int DEFAULT_PRIORITY = 100;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException address가 null이거나 priority가 음수인 경우
     */
    public Resource {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be non-negative (current: " + priority + ")");
        }
        attributes = Attributes.copyOf(attributes);
        dependsOn = dependsOn == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(dependsOn));
        if (dependsOn.contains(address)) {
            throw new IllegalArgumentException("Resource cannot depend on itself: " + address);
        }
    }

    /**
     * 의존성 없이 기본 우선순위로 Resource 생성.
     *
     * @param address 고유 주소
     * @param attributes 속성 맵
     * @return Resource 인스턴스
     */
    public static Resource of(Address address, Map<String, ?> attributes) {
        return new Resource(address, Attributes.copyOf(attributes), Collections.emptySet(), DEFAULT_PRIORITY);
    }

    /**
     * type/name으로 Resource 생성.
     *
     * @param type 타입 태그
     * @param name 리소스 이름
     * @param attributes 속성 맵
     * @return Resource 인스턴스
     */
    public static Resource of(String type, String name, Map<String, ?> attributes) {
        return of(Address.of(type, name), attributes);
    }

    /**
     * dependsOn만 변경한 새 인스턴스 생성.
     *
     * @param dependencies 새로운 명시적 의존 주소들
     * @return 새 Resource 인스턴스
     */
    public Resource withDependsOn(Collection<Address> dependencies) {
        return new Resource(address, attributes, dependencies == null ? null : new TreeSet<>(dependencies), priority);
    }

    /**
     * dependsOn만 변경한 새 인스턴스 생성.
     *
     * @param dependencies 새로운 명시적 의존 주소들
     * @return 새 Resource 인스턴스
     */
    public Resource withDependsOn(Address... dependencies) {
        return withDependsOn(Arrays.asList(dependencies));
    }

    /**
     * priority만 변경한 새 인스턴스 생성.
     *
     * @param priority 새로운 우선순위 클래스
     * @return 새 Resource 인스턴스
     */
    public Resource withPriority(int priority) {
        return new Resource(address, attributes, dependsOn, priority);
    }

    /**
     * 리소스 타입 태그 조회.
     *
     * @return 타입 태그
     */
    public String type() {
        return address.getType();
    }

    /**
     * 리소스 이름 조회.
     *
     * @return 이름
     */
    public String name() {
        return address.getName();
    }
}
