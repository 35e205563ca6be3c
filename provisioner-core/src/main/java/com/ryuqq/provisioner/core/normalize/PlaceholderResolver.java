package com.ryuqq.provisioner.core.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@code ${name}} placeholder 치환기.
 *
 * <p>원격 시스템은 {@code ${projectKey}} 같은 변수를 해석된 값으로 돌려주는 경우가 있습니다.
 * 계획 시 desired와 State 양쪽을 같은 규칙으로 정규화해 불필요한 UPDATE를 막습니다.</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>문자열 안의 {@code ${name}}을 변수 값으로 치환 (알 수 없는 변수는 그대로 둠)</li>
 *   <li>리스트와 중첩 맵은 재귀적으로 치환</li>
 *   <li>그 외 값은 그대로 반환</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class PlaceholderResolver {

    private final Map<String, String> variables;

    /**
     * 변수 맵으로 치환기 생성.
     *
     * @param variables 변수 이름 → 값
     */
    public PlaceholderResolver(Map<String, String> variables) {
        this.variables = variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    /**
     * 치환하지 않는 치환기.
     *
     * @return 빈 변수 맵의 치환기
     */
    public static PlaceholderResolver none() {
        return new PlaceholderResolver(Collections.emptyMap());
    }

    /**
     * 속성 맵 전체 치환.
     *
     * @param attributes 원본 속성 (null 가능)
     * @return 치환된 새 맵 (null이면 null)
     */
    public Map<String, Object> resolveAll(Map<String, Object> attributes) {
        if (attributes == null) {
            return null;
        }
        return resolveMap(attributes);
    }

    /**
     * 단일 값 치환.
     *
     * @param value 원본 값
     * @return 치환된 값
     */
    public Object resolve(Object value) {
        if (value instanceof String s) {
            return resolveString(s);
        }
        if (value instanceof Map<?, ?> map) {
            return resolveMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object element : list) {
                resolved.add(resolve(element));
            }
            return resolved;
        }
        return value;
    }

    public Map<String, String> variables() {
        return variables;
    }

    private Map<String, Object> resolveMap(Map<?, ?> map) {
        Map<String, Object> resolved = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            resolved.put(String.valueOf(entry.getKey()), resolve(entry.getValue()));
        }
        return resolved;
    }

    private String resolveString(String value) {
        if (value.indexOf("${") < 0) {
            return value;
        }
        String result = value;
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            result = result.replace("${" + variable.getKey() + "}", variable.getValue());
        }
        return result;
    }
}
