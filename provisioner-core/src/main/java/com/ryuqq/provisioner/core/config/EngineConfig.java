package com.ryuqq.provisioner.core.config;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>targetKey: State가 속한 원격 프로젝트 키 (필수)</li>
 *   <li>refresh: 계획 전 refresh 기본값 (기본 true)</li>
 *   <li>variables: {@code ${name}} placeholder 값 (projectKey는 targetKey로 자동 추가)</li>
 *   <li>engineVersion: Plan 메타데이터에 기록할 엔진 버전 (기본 {@value #DEFAULT_ENGINE_VERSION})</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param targetKey 원격 프로젝트 키
 * @param refresh 계획 전 refresh 기본값
 * @param variables placeholder 변수
 * @param engineVersion 엔진 버전
 */
public record EngineConfig(
    String targetKey,
    boolean refresh,
    Map<String, String> variables,
    String engineVersion
) {

    /**
     * 기본 엔진 버전.
     */
    public static final String DEFAULT_ENGINE_VERSION = "1.0.0";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: refresh=true, variables 없음, engineVersion={@value #DEFAULT_ENGINE_VERSION}</p>
     *
     * @param targetKey 원격 프로젝트 키
     */
    public EngineConfig(String targetKey) {
        this(targetKey, true, Collections.emptyMap(), DEFAULT_ENGINE_VERSION);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (targetKey == null || targetKey.isBlank()) {
            throw new IllegalArgumentException("targetKey cannot be null or blank");
        }
        if (engineVersion == null || engineVersion.isBlank()) {
            throw new IllegalArgumentException("engineVersion cannot be null or blank");
        }
        variables = variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    /**
     * refresh만 변경한 새 인스턴스 생성.
     *
     * @param refresh 새로운 refresh 기본값
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withRefresh(boolean refresh) {
        return new EngineConfig(targetKey, refresh, variables, engineVersion);
    }

    /**
     * variables만 변경한 새 인스턴스 생성.
     *
     * @param variables 새로운 placeholder 변수
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withVariables(Map<String, String> variables) {
        return new EngineConfig(targetKey, refresh, variables, engineVersion);
    }

    /**
     * engineVersion만 변경한 새 인스턴스 생성.
     *
     * @param engineVersion 새로운 엔진 버전
     * @return 새 EngineConfig 인스턴스
     */
    public EngineConfig withEngineVersion(String engineVersion) {
        return new EngineConfig(targetKey, refresh, variables, engineVersion);
    }

    /**
     * projectKey를 포함한 placeholder 변수 전체.
     *
     * <p>variables에 projectKey가 명시되어 있으면 그 값을 우선합니다.</p>
     *
     * @return 변수 맵
     */
    public Map<String, String> placeholderVariables() {
        Map<String, String> merged = new TreeMap<>();
        merged.put("projectKey", targetKey);
        merged.putAll(variables);
        return Collections.unmodifiableMap(merged);
    }
}
