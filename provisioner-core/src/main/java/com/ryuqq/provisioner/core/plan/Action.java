package com.ryuqq.provisioner.core.plan;

/**
 * 리소스 변경 액션.
 *
 * <p>하나의 Plan 안에서 주소마다 정확히 하나의 액션이 결정됩니다.</p>
 *
 * <ul>
 *   <li>CREATE: State에 없는 desired 리소스</li>
 *   <li>UPDATE: 필드 단위 차이가 있는 리소스</li>
 *   <li>DELETE: State에는 있으나 desired에 없는 리소스</li>
 *   <li>NO_OP: 변경 없음</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum Action {

    CREATE("create", "+"),
    UPDATE("update", "~"),
    DELETE("delete", "-"),
    NO_OP("no-op", " ");

    private final String value;
    private final String symbol;

    Action(String value, String symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    /**
     * 직렬화 값 조회 (예: "no-op").
     *
     * @return 직렬화 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 요약 출력용 기호 조회 (+, ~, -).
     *
     * @return 기호
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * 원격 시스템 변경을 일으키는 액션인지 확인.
     *
     * @return NO_OP이 아니면 true
     */
    public boolean isMutating() {
        return this != NO_OP;
    }

    /**
     * 직렬화 값으로 Action 조회.
     *
     * @param value 직렬화 값 (예: "create", "no-op")
     * @return Action
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static Action fromValue(String value) {
        for (Action action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + value);
    }
}
