package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.ConnectorConfig;

import java.util.List;
import java.util.Optional;

/**
 * 커넥터 설정 저장소 SPI (읽기 전용).
 *
 * <p>실제 저장소(문서 DB 등)는 외부 협력자이며, 이 인터페이스는 그 경계만 정의합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface ConnectorConfigStore {

    /**
     * (tenantId, storeId, domain)으로 설정 조회.
     *
     * @param tenantId 테넌트 ID
     * @param storeId 스토어 ID
     * @param domain 도메인
     * @return 일치하는 설정 (없으면 empty)
     * @throws com.ryuqq.connector.core.exception.ConnectorConfigStoreException 저장소 조회 실패 시
     */
    Optional<ConnectorConfig> findOne(String tenantId, String storeId, String domain);

    /**
     * (tenantId, storeId)의 모든 도메인 설정 조회.
     *
     * @param tenantId 테넌트 ID
     * @param storeId 스토어 ID
     * @return 설정 목록 (없으면 빈 목록)
     * @throws com.ryuqq.connector.core.exception.ConnectorConfigStoreException 저장소 조회 실패 시
     */
    List<ConnectorConfig> findAll(String tenantId, String storeId);
}
