package com.ryuqq.provisioner.core.model;

import java.util.regex.Pattern;

/**
 * 리소스의 전역 고유 주소.
 *
 * <p>Address는 {@code {type}.{name}} 형식으로 구성되며, 하나의 desired 집합과
 * 하나의 State 안에서 리소스를 유일하게 식별합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Address.of("dss_dataset", "customers") - 데이터셋</li>
 *   <li>Address.parse("dss_python_recipe.clean_customers") - 레시피</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>type: 소문자로 시작, 소문자/숫자/언더스코어만 허용</li>
 *   <li>name: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 *   <li>전체 길이: 1~255자</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Address implements Comparable<Address> {

    private static final Pattern TYPE_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String type;
    private final String name;

    private Address(String type, String name) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Address type cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Address name cannot be null or blank");
        }
        if (!TYPE_PATTERN.matcher(type).matches()) {
            throw new IllegalArgumentException("Address type must start with a lowercase letter and contain only lowercase letters, digits and underscores: " + type);
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Address name contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed: " + name);
        }
        if (type.length() + name.length() + 1 > 255) {
            throw new IllegalArgumentException("Address length cannot exceed 255 characters");
        }
        this.type = type;
        this.name = name;
    }

    /**
     * type과 name으로 Address 생성.
     *
     * @param type 리소스 타입 태그 (예: dss_dataset)
     * @param name 리소스 이름 (예: customers)
     * @return Address 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Address of(String type, String name) {
        return new Address(type, name);
    }

    /**
     * {@code {type}.{name}} 문자열을 파싱하여 Address 생성.
     *
     * <p>첫 번째 '.'을 기준으로 type과 name을 분리합니다.</p>
     *
     * @param value 주소 문자열
     * @return Address 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static Address parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address cannot be null or blank");
        }
        int dot = value.indexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Address must have the form {type}.{name}: " + value);
        }
        return new Address(value.substring(0, dot), value.substring(dot + 1));
    }

    /**
     * 리소스 타입 태그 조회.
     *
     * @return 타입 태그
     */
    public String getType() {
        return type;
    }

    /**
     * 리소스 이름 조회.
     *
     * @return 이름
     */
    public String getName() {
        return name;
    }

    /**
     * {@code {type}.{name}} 형식의 주소 값 조회.
     *
     * @return 주소 문자열
     */
    public String getValue() {
        return type + "." + name;
    }

    @Override
    public int compareTo(Address other) {
        return getValue().compareTo(other.getValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address address = (Address) o;
        return type.equals(address.type) && name.equals(address.name);
    }

    @Override
    public int hashCode() {
        return getValue().hashCode();
    }

    @Override
    public String toString() {
        return getValue();
    }
}
