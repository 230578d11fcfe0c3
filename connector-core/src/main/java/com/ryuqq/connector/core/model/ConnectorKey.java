package com.ryuqq.connector.core.model;

/**
 * 커넥터 식별 키 (tenantId, storeId, domain).
 *
 * <p>Registry 캐시의 키로 사용되며, {@link #cacheKey()}는
 * {@code tenantId:storeId:domain} 형식의 문자열을 반환합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>각 구성 요소는 null 또는 빈 문자열 불가</li>
 *   <li>구분자(':')를 포함할 수 없음 (캐시 키 충돌 방지)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class ConnectorKey {

    private static final char SEPARATOR = ':';

    private final String tenantId;
    private final String storeId;
    private final String domain;

    private ConnectorKey(String tenantId, String storeId, String domain) {
        this.tenantId = requireComponent("tenantId", tenantId);
        this.storeId = requireComponent("storeId", storeId);
        this.domain = requireComponent("domain", domain);
    }

    /**
     * ConnectorKey 생성.
     *
     * @param tenantId 테넌트 ID
     * @param storeId 스토어 ID
     * @param domain 도메인 (예: retail, wishlist)
     * @return ConnectorKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ConnectorKey of(String tenantId, String storeId, String domain) {
        return new ConnectorKey(tenantId, storeId, domain);
    }

    private static String requireComponent(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        if (value.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(name + " cannot contain '" + SEPARATOR + "' (current: " + value + ")");
        }
        return value;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getStoreId() {
        return storeId;
    }

    public String getDomain() {
        return domain;
    }

    /**
     * 캐시 키 문자열.
     *
     * @return {@code tenantId:storeId:domain}
     */
    public String cacheKey() {
        return tenantId + SEPARATOR + storeId + SEPARATOR + domain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectorKey that = (ConnectorKey) o;
        return tenantId.equals(that.tenantId)
            && storeId.equals(that.storeId)
            && domain.equals(that.domain);
    }

    @Override
    public int hashCode() {
        int result = tenantId.hashCode();
        result = 31 * result + storeId.hashCode();
        result = 31 * result + domain.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "ConnectorKey{" + cacheKey() + '}';
    }
}
