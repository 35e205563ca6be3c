package com.ryuqq.provisioner.core.normalize;

import com.ryuqq.provisioner.core.model.Attributes;
import com.ryuqq.provisioner.core.plan.FieldDiff;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AttributeComparator 테스트.
 *
 * <ul>
 *   <li>compareDeclared: 선언된 필드만 비교 (서버 계산 필드 무시)</li>
 *   <li>compareAll: 기록과 관측의 모든 필드 비교</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class AttributeComparatorTest {

    private final AttributeComparator comparator =
        new AttributeComparator(new PlaceholderResolver(Map.of("projectKey", "PROJ")));

    @Test
    void compareDeclared_IgnoresUndeclaredFields() {
        // Given
        Map<String, Object> desired = Attributes.copyOf(Map.of("format", "csv"));
        Map<String, Object> current = Attributes.copyOf(Map.of("format", "csv", "id", "server-generated"));

        // When & Then
        assertTrue(comparator.compareDeclared(desired, current).isEmpty());
    }

    @Test
    void compareDeclared_ReportsChangedAndMissingFields() {
        // Given
        Map<String, Object> desired = Attributes.copyOf(Map.of("format", "parquet", "zone", "raw"));
        Map<String, Object> current = Attributes.copyOf(Map.of("format", "csv"));

        // When
        List<FieldDiff> diffs = comparator.compareDeclared(desired, current);

        // Then
        assertEquals(List.of(
            new FieldDiff("format", "csv", "parquet"),
            new FieldDiff("zone", null, "raw")), diffs);
    }

    @Test
    void compareDeclared_PlaceholderEqualsResolvedValue() {
        // Given
        Map<String, Object> desired = Attributes.copyOf(Map.of("path", "${projectKey}/orders"));
        Map<String, Object> current = Attributes.copyOf(Map.of("path", "PROJ/orders"));

        // When & Then
        assertTrue(comparator.compareDeclared(desired, current).isEmpty());
    }

    @Test
    void compareDeclared_IntegerAndLongAreEqualAfterNormalization() {
        // Given
        Map<String, Object> desired = Attributes.copyOf(Map.of("rows", 10));
        Map<String, Object> current = Attributes.copyOf(Map.of("rows", 10L));

        // When & Then
        assertTrue(comparator.compareDeclared(desired, current).isEmpty());
    }

    @Test
    void compareAll_ReportsAddedAndRemovedFields() {
        // Given
        Map<String, Object> recorded = Attributes.copyOf(Map.of("format", "csv", "owner", "alice"));
        Map<String, Object> observed = Attributes.copyOf(Map.of("format", "csv", "tags", List.of("x")));

        // When
        List<FieldDiff> diffs = comparator.compareAll(recorded, observed);

        // Then
        assertEquals(List.of(
            new FieldDiff("owner", "alice", null),
            new FieldDiff("tags", null, List.of("x"))), diffs);
    }

    @Test
    void compareAll_ListOrderMatters() {
        // Given
        Map<String, Object> recorded = Attributes.copyOf(Map.of("inputs", List.of("a", "b")));
        Map<String, Object> observed = Attributes.copyOf(Map.of("inputs", List.of("b", "a")));

        // When & Then
        assertEquals(1, comparator.compareAll(recorded, observed).size());
    }
}
