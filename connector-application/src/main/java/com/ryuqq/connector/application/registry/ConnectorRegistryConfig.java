package com.ryuqq.connector.application.registry;

import java.time.Duration;

/**
 * ConnectorRegistry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>cacheExpiration: 마지막 접근 이후 캐시 유지 기간 (기본 1시간)</li>
 *   <li>cleanupInterval: 만료 커넥터 정리 주기 (기본 15분)</li>
 *   <li>healthCheckOnCreate: 생성 직후 헬스체크 수행 여부 (기본 true)</li>
 * </ul>
 *
 * <p>헬스체크 실패는 경고 로그만 남기며 커넥터는 그대로 캐시됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param cacheExpiration 캐시 만료 기간 (양수여야 함)
 * @param cleanupInterval 정리 주기 (양수여야 함)
 * @param healthCheckOnCreate 생성 시 헬스체크 여부
 */
public record ConnectorRegistryConfig(
    Duration cacheExpiration,
    Duration cleanupInterval,
    boolean healthCheckOnCreate
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: cacheExpiration=1h, cleanupInterval=15m, healthCheckOnCreate=true</p>
     */
    public ConnectorRegistryConfig() {
        this(Duration.ofHours(1), Duration.ofMinutes(15), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConnectorRegistryConfig {
        if (cacheExpiration == null) {
            throw new IllegalArgumentException("cacheExpiration cannot be null");
        }
        if (cacheExpiration.isZero() || cacheExpiration.isNegative()) {
            throw new IllegalArgumentException(
                "cacheExpiration must be positive (current: " + cacheExpiration + ")"
            );
        }
        if (cleanupInterval == null) {
            throw new IllegalArgumentException("cleanupInterval cannot be null");
        }
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            throw new IllegalArgumentException(
                "cleanupInterval must be positive (current: " + cleanupInterval + ")"
            );
        }
    }

    public ConnectorRegistryConfig withCacheExpiration(Duration cacheExpiration) {
        return new ConnectorRegistryConfig(cacheExpiration, cleanupInterval, healthCheckOnCreate);
    }

    public ConnectorRegistryConfig withCleanupInterval(Duration cleanupInterval) {
        return new ConnectorRegistryConfig(cacheExpiration, cleanupInterval, healthCheckOnCreate);
    }

    public ConnectorRegistryConfig withHealthCheckOnCreate(boolean healthCheckOnCreate) {
        return new ConnectorRegistryConfig(cacheExpiration, cleanupInterval, healthCheckOnCreate);
    }
}
