package com.ryuqq.provisioner.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 리소스 속성 맵 정규화 유틸리티.
 *
 * <p>속성 값은 스칼라(String, Number, Boolean, null), 리스트, 중첩 맵만 허용됩니다.
 * 모든 복사본은 깊은 불변 복사이며, 비교와 해시가 결정적이도록 다음 규칙으로 정규화합니다:</p>
 * <ul>
 *   <li>맵: 키 기준 정렬 (TreeMap)</li>
 *   <li>정수 타입(Byte, Short, Integer, Long): Long</li>
 *   <li>실수 타입(Float, Double, BigDecimal): Double</li>
 *   <li>BigInteger: Long 범위 안이면 Long, 아니면 그대로</li>
 *   <li>Collection: List</li>
 *   <li>null 값 허용</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Attributes {

    // Utility class - prevent instantiation
    private Attributes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 빈 속성 맵.
     *
     * @return 불변 빈 맵
     */
    public static Map<String, Object> empty() {
        return Collections.unmodifiableMap(new TreeMap<>());
    }

    /**
     * 속성 맵의 정규화된 깊은 불변 복사본 생성.
     *
     * @param attributes 원본 속성 맵 (null이면 빈 맵)
     * @return 키 정렬된 불변 맵
     * @throws IllegalArgumentException null 키 또는 지원하지 않는 값 타입이 포함된 경우
     */
    public static Map<String, Object> copyOf(Map<String, ?> attributes) {
        if (attributes == null) {
            return empty();
        }
        TreeMap<String, Object> copy = new TreeMap<>();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Attribute key cannot be null");
            }
            copy.put(entry.getKey(), normalizeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 단일 속성 값 정규화.
     *
     * @param value 원본 값
     * @return 정규화된 불변 값
     * @throws IllegalArgumentException 지원하지 않는 값 타입인 경우
     */
    public static Object normalizeValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger integer) {
            // JSON 역직렬화 결과와 같은 타입이어야 digest가 유지됨
            return integer.bitLength() < Long.SIZE ? (Object) integer.longValue() : integer;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> copy = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() == null) {
                    throw new IllegalArgumentException("Nested attribute key cannot be null");
                }
                copy.put(entry.getKey().toString(), normalizeValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(normalizeValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
    }
}
