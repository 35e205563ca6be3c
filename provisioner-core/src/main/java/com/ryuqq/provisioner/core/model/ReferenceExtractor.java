package com.ryuqq.provisioner.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 리소스 속성으로부터 암시적 참조 주소를 추출하는 타입별 함수.
 *
 * <p>레시피의 inputs/outputs, zone, foreign source 필드처럼 다른 리소스를 가리키는
 * 속성을 주소 집합으로 변환합니다. 그래프 빌더는 명시적 의존성과 이 결과의 합집합만
 * 사용하므로 타입에 무관하게 동작합니다.</p>
 *
 * <p><strong>순수 함수:</strong> 같은 입력에 대해 항상 같은 결과를 반환해야 하며,
 * 원격 시스템을 호출해서는 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * // 속성 값이 완전한 주소인 경우
 * ReferenceExtractor refs = ReferenceExtractor.fields("inputs", "outputs");
 *
 * // 속성 값이 특정 타입 리소스의 이름인 경우
 * ReferenceExtractor zoneRef = ReferenceExtractor.namesOf("dss_zone", "zone");
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReferenceExtractor {

    /**
     * 리소스가 암시적으로 참조하는 주소 집합 계산.
     *
     * @param resource 대상 리소스
     * @return 참조 주소 집합 (빈 집합 가능, null 불가)
     */
    Set<Address> extract(Resource resource);

    /**
     * 참조가 없는 추출기.
     *
     * @return 항상 빈 집합을 반환하는 추출기
     */
    static ReferenceExtractor none() {
        return resource -> Collections.emptySet();
    }

    /**
     * 지정된 필드 값을 {@code {type}.{name}} 주소로 해석하는 추출기.
     *
     * <p>필드 값은 문자열 또는 문자열 리스트일 수 있으며, null은 무시됩니다.</p>
     *
     * @param fieldNames 참조 필드 이름들
     * @return 추출기
     */
    static ReferenceExtractor fields(String... fieldNames) {
        return resource -> {
            Set<Address> refs = new TreeSet<>();
            for (String field : fieldNames) {
                for (String value : stringValues(resource, field)) {
                    refs.add(Address.parse(value));
                }
            }
            return refs;
        };
    }

    /**
     * 지정된 필드 값을 targetType 리소스의 이름으로 해석하는 추출기.
     *
     * <p>값에 '.'이 포함된 경우 완전한 주소로 간주합니다.</p>
     *
     * @param targetType 참조 대상 타입 태그
     * @param fieldNames 참조 필드 이름들
     * @return 추출기
     */
    static ReferenceExtractor namesOf(String targetType, String... fieldNames) {
        return resource -> {
            Set<Address> refs = new TreeSet<>();
            for (String field : fieldNames) {
                for (String value : stringValues(resource, field)) {
                    refs.add(value.indexOf('.') > 0 ? Address.parse(value) : Address.of(targetType, value));
                }
            }
            return refs;
        };
    }

    /**
     * 두 추출기의 결과를 합친 추출기.
     *
     * @param other 함께 적용할 추출기
     * @return 합집합 추출기
     */
    default ReferenceExtractor and(ReferenceExtractor other) {
        return resource -> {
            Set<Address> refs = new TreeSet<>(extract(resource));
            refs.addAll(other.extract(resource));
            return refs;
        };
    }

    private static Collection<String> stringValues(Resource resource, String field) {
        Object value = resource.attributes().get(field);
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof String s) {
            return s.isBlank() ? Collections.emptyList() : Collections.singletonList(s);
        }
        if (value instanceof Collection<?> values) {
            Set<String> result = new TreeSet<>();
            for (Object element : values) {
                if (element instanceof String s && !s.isBlank()) {
                    result.add(s);
                } else if (element != null) {
                    throw new IllegalArgumentException(
                        "Reference field '" + field + "' of " + resource.address() + " must contain only strings");
                }
            }
            return result;
        }
        throw new IllegalArgumentException(
            "Reference field '" + field + "' of " + resource.address() + " must be a string or a list of strings");
    }
}
