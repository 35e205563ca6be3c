package com.ryuqq.provisioner.core.normalize;

import com.ryuqq.provisioner.core.plan.FieldDiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 필드 단위 속성 비교기.
 *
 * <p>비교 전에 양쪽 값을 {@link PlaceholderResolver}로 정규화하며,
 * 결과는 필드 이름 순으로 정렬됩니다. 없는 키는 null과 같게 취급합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class AttributeComparator {

    private final PlaceholderResolver resolver;

    public AttributeComparator(PlaceholderResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.resolver = resolver;
    }

    /**
     * desired에 선언된 필드만 비교 (계획용).
     *
     * <p>원격 시스템이 추가로 돌려주는 필드(계산된 값 등)는 무시합니다.</p>
     *
     * @param desired 원하는 속성
     * @param current State에 기록된 속성
     * @return 필드 차이 (정렬됨, 차이가 없으면 빈 리스트)
     */
    public List<FieldDiff> compareDeclared(Map<String, Object> desired, Map<String, Object> current) {
        return compare(new TreeSet<>(desired.keySet()), desired, current);
    }

    /**
     * 양쪽 모든 필드 비교 (drift 감지용).
     *
     * @param recorded State에 기록된 속성
     * @param observed 원격 시스템에서 읽은 속성
     * @return 필드 차이 (before = recorded, after = observed)
     */
    public List<FieldDiff> compareAll(Map<String, Object> recorded, Map<String, Object> observed) {
        Set<String> fields = new TreeSet<>(recorded.keySet());
        fields.addAll(observed.keySet());
        List<FieldDiff> diffs = new ArrayList<>();
        for (String field : fields) {
            Object before = recorded.get(field);
            Object after = observed.get(field);
            if (!Objects.equals(resolver.resolve(before), resolver.resolve(after))) {
                diffs.add(new FieldDiff(field, before, after));
            }
        }
        return Collections.unmodifiableList(diffs);
    }

    private List<FieldDiff> compare(Set<String> fields, Map<String, Object> desired, Map<String, Object> current) {
        List<FieldDiff> diffs = new ArrayList<>();
        for (String field : fields) {
            Object after = desired.get(field);
            Object before = current.get(field);
            if (!Objects.equals(resolver.resolve(after), resolver.resolve(before))) {
                diffs.add(new FieldDiff(field, before, after));
            }
        }
        return Collections.unmodifiableList(diffs);
    }
}
