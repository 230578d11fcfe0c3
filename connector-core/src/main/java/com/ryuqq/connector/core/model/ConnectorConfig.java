package com.ryuqq.connector.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 커넥터 설정 (불변 record).
 *
 * <p>외부 설정 저장소에서 읽어온 하나의 커넥터 정의입니다.
 * 한 번 조회된 이후에는 변경되지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>storeId / tenantId / domain: 커넥터 식별 (ConnectorKey)</li>
 *   <li>url: 백엔드 기본 URL</li>
 *   <li>adapterKind: 생성에 사용할 Factory 종류</li>
 *   <li>version: 어댑터 버전 (메타데이터용)</li>
 *   <li>config: 어댑터별 설정 (예: apiKey, demoMode)</li>
 *   <li>enabled: 비활성화 시 Factory를 호출하지 않음</li>
 *   <li>timeout: 백엔드 호출 타임아웃 ({@link Duration#ZERO}이면 어댑터 기본값)</li>
 *   <li>priority: 우선순위 (메타데이터/정렬용)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param storeId 스토어 ID
 * @param tenantId 테넌트 ID
 * @param domain 도메인
 * @param url 백엔드 URL (null 허용)
 * @param adapterKind 어댑터 종류
 * @param version 어댑터 버전 (null 허용)
 * @param config 어댑터별 설정 맵
 * @param enabled 활성화 여부
 * @param timeout 호출 타임아웃 (음수 불가)
 * @param priority 우선순위
 */
public record ConnectorConfig(
    String storeId,
    String tenantId,
    String domain,
    String url,
    AdapterKind adapterKind,
    String version,
    Map<String, Object> config,
    boolean enabled,
    Duration timeout,
    int priority
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConnectorConfig {
        if (adapterKind == null) {
            throw new IllegalArgumentException("adapterKind cannot be null");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
        // tenantId/storeId/domain 검증은 ConnectorKey가 담당
        ConnectorKey.of(tenantId, storeId, domain);
        config = config == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * 이 설정의 ConnectorKey.
     *
     * @return ConnectorKey
     */
    public ConnectorKey key() {
        return ConnectorKey.of(tenantId, storeId, domain);
    }

    /**
     * 문자열 설정값 조회.
     *
     * @param name 설정 키
     * @return 값이 문자열이고 비어 있지 않으면 해당 값
     */
    public Optional<String> stringValue(String name) {
        Object value = config.get(name);
        if (value instanceof String && !((String) value).isBlank()) {
            return Optional.of((String) value);
        }
        return Optional.empty();
    }

    /**
     * boolean 설정값 조회.
     *
     * <p>Boolean 또는 "true"/"false" 문자열을 허용합니다.</p>
     *
     * @param name 설정 키
     * @param defaultValue 값이 없을 때 기본값
     * @return 설정값
     */
    public boolean booleanValue(String name, boolean defaultValue) {
        Object value = config.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public ConnectorConfig withEnabled(boolean enabled) {
        return new ConnectorConfig(storeId, tenantId, domain, url, adapterKind, version, config, enabled, timeout, priority);
    }

    /**
     * config 맵만 변경한 새 인스턴스 생성.
     */
    public ConnectorConfig withConfig(Map<String, Object> config) {
        return new ConnectorConfig(storeId, tenantId, domain, url, adapterKind, version, config, enabled, timeout, priority);
    }
}
