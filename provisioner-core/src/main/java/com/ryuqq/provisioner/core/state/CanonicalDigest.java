package com.ryuqq.provisioner.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.MapperFeature;
import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.model.Resource;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 정규 JSON(키 정렬) 기반 SHA-256 digest 유틸리티.
 *
 * <p>State digest와 Plan의 config digest를 계산합니다. 같은 내용이면 맵 구현이나
 * 삽입 순서와 무관하게 항상 같은 digest가 나옵니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class CanonicalDigest {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    // Utility class - prevent instantiation
    private CanonicalDigest() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * State digest 계산 (주소 → 속성).
     *
     * @param state 대상 State
     * @return 16진수 SHA-256
     */
    public static String ofState(State state) {
        Map<String, Object> canonical = new TreeMap<>();
        for (Map.Entry<Address, StateEntry> entry : state.resources().entrySet()) {
            canonical.put(entry.getKey().getValue(), entry.getValue().attributes());
        }
        return sha256(canonical);
    }

    /**
     * desired 집합의 config digest 계산 (주소 순 정렬).
     *
     * @param resources desired 리소스
     * @return 16진수 SHA-256
     */
    public static String ofResources(Collection<Resource> resources) {
        List<Resource> sorted = new ArrayList<>(resources);
        sorted.sort(Comparator.comparing(Resource::address));
        List<Map<String, Object>> canonical = new ArrayList<>(sorted.size());
        for (Resource resource : sorted) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("address", resource.address().getValue());
            item.put("attributes", resource.attributes());
            item.put("dependsOn", resource.dependsOn().stream().map(Address::getValue).toList());
            item.put("priority", resource.priority());
            canonical.add(item);
        }
        return sha256(canonical);
    }

    /**
     * 임의 값의 정규 JSON SHA-256 계산.
     *
     * @param value JSON 직렬화 가능한 값
     * @return 16진수 SHA-256
     */
    public static String sha256(Object value) {
        try {
            byte[] json = CANONICAL_MAPPER.writeValueAsBytes(value);
            return toHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to canonical JSON", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * 정규 JSON 문자열 (디버깅 및 테스트용).
     *
     * @param value JSON 직렬화 가능한 값
     * @return 키 정렬된 JSON
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialized to canonical JSON", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
