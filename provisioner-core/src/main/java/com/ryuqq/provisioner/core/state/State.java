package com.ryuqq.provisioner.core.state;

import com.ryuqq.provisioner.core.model.Address;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * 엔진이 마지막으로 적용한 결과의 영속 기록.
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>lineage:</strong> State 생성 시 고정되는 UUID (다른 State 파일과 구분)</li>
 *   <li><strong>serial:</strong> 영속화될 때마다 1씩 증가하는 일련번호</li>
 *   <li><strong>targetKey:</strong> State가 속한 원격 프로젝트 키</li>
 *   <li><strong>resources:</strong> 주소별 {@link StateEntry} (주소 정렬)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> State는 불변이며, 변경 메서드는 새 인스턴스를 반환합니다.
 * serial은 {@link com.ryuqq.provisioner.core.spi.StateStore#save(State)}만 증가시킵니다.</p>
 *
 * <p><strong>Digest:</strong> {@link #digest()}는 주소 → 속성 맵의 정규 JSON에 대한 SHA-256이며,
 * 저장 시 재계산되고 로드 시 검증됩니다.</p>
 *
 * @param lineage 계보 식별자
 * @param serial 일련번호
 * @param targetKey 대상 프로젝트 키
 * @param resources 주소별 State 항목
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record State(
    String lineage,
    long serial,
    String targetKey,
    Map<Address, StateEntry> resources
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 serial이 음수인 경우
     */
    public State {
        if (lineage == null || lineage.isBlank()) {
            throw new IllegalArgumentException("lineage cannot be null or blank");
        }
        if (serial < 0) {
            throw new IllegalArgumentException("serial must be non-negative (current: " + serial + ")");
        }
        if (targetKey == null || targetKey.isBlank()) {
            throw new IllegalArgumentException("targetKey cannot be null or blank");
        }
        resources = resources == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(resources));
    }

    /**
     * 새 lineage를 가진 빈 State 생성.
     *
     * @param targetKey 대상 프로젝트 키
     * @return serial 0의 빈 State
     */
    public static State empty(String targetKey) {
        return new State(UUID.randomUUID().toString(), 0L, targetKey, Collections.emptyMap());
    }

    /**
     * 주소에 해당하는 항목 조회.
     *
     * @param address 주소
     * @return 항목 (없으면 empty)
     */
    public Optional<StateEntry> entry(Address address) {
        return Optional.ofNullable(resources.get(address));
    }

    /**
     * 주소가 기록되어 있는지 확인.
     *
     * @param address 주소
     * @return 기록되어 있으면 true
     */
    public boolean contains(Address address) {
        return resources.containsKey(address);
    }

    /**
     * 항목을 추가하거나 교체한 새 State.
     *
     * @param address 주소
     * @param entry 항목
     * @return 새 State (serial 유지)
     */
    public State withEntry(Address address, StateEntry entry) {
        if (address == null || entry == null) {
            throw new IllegalArgumentException("address and entry cannot be null");
        }
        Map<Address, StateEntry> copy = new TreeMap<>(resources);
        copy.put(address, entry);
        return new State(lineage, serial, targetKey, copy);
    }

    /**
     * 항목을 제거한 새 State.
     *
     * @param address 주소
     * @return 새 State (serial 유지)
     */
    public State withoutEntry(Address address) {
        if (!resources.containsKey(address)) {
            return this;
        }
        Map<Address, StateEntry> copy = new TreeMap<>(resources);
        copy.remove(address);
        return new State(lineage, serial, targetKey, copy);
    }

    /**
     * serial만 변경한 새 State.
     *
     * @param newSerial 새 일련번호
     * @return 새 State
     */
    public State withSerial(long newSerial) {
        return new State(lineage, newSerial, targetKey, resources);
    }

    /**
     * 다음 serial을 가진 새 State (저장소 전용).
     *
     * @return serial + 1 State
     */
    public State nextSerial() {
        return withSerial(serial + 1);
    }

    /**
     * 주소 → 속성 맵의 SHA-256 digest 계산.
     *
     * @return 16진수 digest
     */
    public String digest() {
        return CanonicalDigest.ofState(this);
    }

    /**
     * 기록된 리소스가 없는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
