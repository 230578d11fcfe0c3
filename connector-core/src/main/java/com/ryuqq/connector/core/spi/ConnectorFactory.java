package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.ConnectorConfig;

/**
 * 어댑터 종류별 Connector 생성자.
 *
 * <p>프로세스 시작 시 어댑터 종류마다 한 번 Registry에 등록됩니다.
 * 생성만 담당하며, {@code initialize()}와 헬스체크는 Registry가 호출합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectorFactory {

    /**
     * Connector 인스턴스 생성.
     *
     * @param config 커넥터 설정
     * @return 생성된 Connector (초기화 전)
     * @throws com.ryuqq.connector.core.exception.ConnectorException 생성 실패 시
     */
    Connector create(ConnectorConfig config);
}
