package com.ryuqq.provisioner.core.plan;

import com.ryuqq.provisioner.core.model.Address;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Apply 실행 결과.
 *
 * <p>완료된 변경 목록(순서 유지, NO_OP 제외), 실패한 변경(있다면), 오류 상세를 담습니다.
 * 실패나 취소가 발생해도 완료된 변경은 이미 State에 영속화되어 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ApplyResult result = exception.getResult();
 * result.completed();      // [Create dss_dataset.a]
 * result.failedAddress();  // dss_recipe.b
 * result.errorDetail();    // "connection refused"
 * </pre>
 *
 * @param completed 완료된 변경 목록
 * @param failed 실패한 변경 (null 가능)
 * @param errorDetail 오류 상세 (null 가능)
 * @param canceled 취소 여부
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ApplyResult(
    List<ResourceChange> completed,
    ResourceChange failed,
    String errorDetail,
    boolean canceled
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException completed가 null이거나 실패와 취소가 동시에 설정된 경우
     */
    public ApplyResult {
        if (completed == null) {
            throw new IllegalArgumentException("completed cannot be null");
        }
        if (failed != null && canceled) {
            throw new IllegalArgumentException("ApplyResult cannot be both failed and canceled");
        }
        completed = List.copyOf(completed);
    }

    /**
     * 모든 변경이 성공한 결과 생성.
     *
     * @param completed 완료된 변경 목록
     * @return ApplyResult
     */
    public static ApplyResult success(List<ResourceChange> completed) {
        return new ApplyResult(completed, null, null, false);
    }

    /**
     * 실패한 결과 생성.
     *
     * @param completed 실패 전까지 완료된 변경 목록
     * @param failed 실패한 변경
     * @param errorDetail 오류 상세
     * @return ApplyResult
     */
    public static ApplyResult failure(List<ResourceChange> completed, ResourceChange failed, String errorDetail) {
        if (failed == null) {
            throw new IllegalArgumentException("failed cannot be null");
        }
        return new ApplyResult(completed, failed, errorDetail, false);
    }

    /**
     * 취소된 결과 생성.
     *
     * @param completed 취소 전까지 완료된 변경 목록
     * @return ApplyResult
     */
    public static ApplyResult canceled(List<ResourceChange> completed) {
        return new ApplyResult(completed, null, "canceled", true);
    }

    /**
     * 빈 성공 결과.
     *
     * @return 완료된 변경이 없는 성공 결과
     */
    public static ApplyResult empty() {
        return success(Collections.emptyList());
    }

    /**
     * 실패 및 취소 없이 끝났는지 확인.
     *
     * @return 성공 여부
     */
    public boolean isSuccess() {
        return failed == null && !canceled;
    }

    /**
     * 실패한 주소 조회.
     *
     * @return 실패한 주소 (실패가 없으면 null)
     */
    public Address failedAddress() {
        return failed == null ? null : failed.address();
    }

    /**
     * 완료된 변경의 주소 목록 (순서 유지).
     *
     * @return 주소 목록
     */
    public List<Address> completedAddresses() {
        return completed.stream().map(ResourceChange::address).toList();
    }

    /**
     * 완료된 변경의 액션별 개수.
     *
     * @return 모든 Action을 키로 가지는 개수 맵
     */
    public Map<Action, Integer> summary() {
        return countByAction(completed);
    }

    static Map<Action, Integer> countByAction(List<ResourceChange> changes) {
        Map<Action, Integer> counts = Plan.emptyCounts();
        for (ResourceChange change : changes) {
            counts.merge(change.action(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
