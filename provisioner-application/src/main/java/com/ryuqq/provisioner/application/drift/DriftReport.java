package com.ryuqq.provisioner.application.drift;

import com.ryuqq.provisioner.core.model.Address;
import com.ryuqq.provisioner.core.plan.Action;
import com.ryuqq.provisioner.core.plan.ResourceChange;
import com.ryuqq.provisioner.core.state.State;

import java.util.List;

/**
 * Drift 감지 결과.
 *
 * <p>changes는 State 기준으로 원격 시스템에서 바뀐 항목(UPDATE)과 사라진 항목(DELETE)이며,
 * newState는 관측 결과를 반영한 State입니다 (serial은 원본과 동일, 영속화되지 않음).</p>
 *
 * @param changes 감지된 변경 (주소 순)
 * @param newState 관측 결과를 반영한 State
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record DriftReport(
    List<ResourceChange> changes,
    State newState
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 CREATE/NO_OP이 포함된 경우
     */
    public DriftReport {
        if (changes == null) {
            throw new IllegalArgumentException("changes cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        for (ResourceChange change : changes) {
            if (change.action() != Action.UPDATE && change.action() != Action.DELETE) {
                throw new IllegalArgumentException(
                    "Drift can only report UPDATE or DELETE (current: " + change.action() + " " + change.address() + ")");
            }
        }
        changes = List.copyOf(changes);
    }

    /**
     * Drift 여부.
     *
     * @return 변경이 하나라도 있으면 true
     */
    public boolean hasDrift() {
        return !changes.isEmpty();
    }

    /**
     * 원격에서 사라진 주소.
     *
     * @return 주소 목록
     */
    public List<Address> deleted() {
        return addressesOf(Action.DELETE);
    }

    /**
     * 원격에서 바뀐 주소.
     *
     * @return 주소 목록
     */
    public List<Address> updated() {
        return addressesOf(Action.UPDATE);
    }

    private List<Address> addressesOf(Action action) {
        return changes.stream()
            .filter(change -> change.action() == action)
            .map(ResourceChange::address)
            .toList();
    }
}
