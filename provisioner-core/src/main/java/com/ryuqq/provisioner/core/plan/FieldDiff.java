package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.Attributes;

/**
 * UPDATE 변경의 필드 단위 차이.
 *
 * @param field 속성 이름
 * @param before 현재 State 값 (null 가능)
 * @param after 원하는 값 (null 가능)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record FieldDiff(
    String field,
    Object before,
    Object after
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field가 null이거나 빈 문자열인 경우
     */
    public FieldDiff {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        before = Attributes.normalizeValue(before);
        after = Attributes.normalizeValue(after);
    }
}
