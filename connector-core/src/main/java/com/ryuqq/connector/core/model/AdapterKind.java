package com.ryuqq.connector.core.model;

/**
 * 어댑터 구현 종류 (예: {@code D365CommerceAdapter}).
 *
 * <p>Factory 등록과 ConnectorConfig의 {@code adapter} 필드를 연결하는 타입 값입니다.
 * 문자열을 직접 사용하는 대신 생성 시점에 검증하여, 잘못된 이름은 첫 조회가 아닌
 * 등록/로딩 시점에 실패합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class AdapterKind {

    private final String value;

    private AdapterKind(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AdapterKind cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("AdapterKind length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9._\\-]+$")) {
            throw new IllegalArgumentException(
                "AdapterKind contains invalid characters (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * AdapterKind 생성.
     *
     * @param value 어댑터 종류 이름
     * @return AdapterKind 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AdapterKind of(String value) {
        return new AdapterKind(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AdapterKind that = (AdapterKind) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AdapterKind{" + value + '}';
    }
}
