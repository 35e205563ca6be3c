package com.ryuqq.provisioner.core.plan;

import java.time.Instant;

/**
 * Plan 메타데이터.
 *
 * <p>계획 시점의 State 무결성 정보(lineage, serial, digest)를 기록하여,
 * 저장된 Plan을 나중에 적용할 때 staleness 검증에 사용합니다.</p>
 *
 * @param targetKey 대상 프로젝트 키
 * @param createdAt 계획 생성 시각
 * @param destroy 전체 삭제(destroy) 계획 여부
 * @param refresh 계획 전 refresh 수행 여부
 * @param stateLineage 계획 시점 State lineage
 * @param stateSerial 계획 시점 State serial
 * @param stateDigest 계획 시점 State digest
 * @param configDigest desired 집합의 digest
 * @param engineVersion 계획을 생성한 엔진 버전
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record PlanMetadata(
    String targetKey,
    Instant createdAt,
    boolean destroy,
    boolean refresh,
    String stateLineage,
    long stateSerial,
    String stateDigest,
    String configDigest,
    String engineVersion
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 serial이 음수인 경우
     */
    public PlanMetadata {
        if (targetKey == null || targetKey.isBlank()) {
            throw new IllegalArgumentException("targetKey cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (stateLineage == null || stateLineage.isBlank()) {
            throw new IllegalArgumentException("stateLineage cannot be null or blank");
        }
        if (stateSerial < 0) {
            throw new IllegalArgumentException("stateSerial must be non-negative (current: " + stateSerial + ")");
        }
        if (stateDigest == null || stateDigest.isBlank()) {
            throw new IllegalArgumentException("stateDigest cannot be null or blank");
        }
        if (configDigest == null || configDigest.isBlank()) {
            throw new IllegalArgumentException("configDigest cannot be null or blank");
        }
        if (engineVersion == null || engineVersion.isBlank()) {
            throw new IllegalArgumentException("engineVersion cannot be null or blank");
        }
    }
}
