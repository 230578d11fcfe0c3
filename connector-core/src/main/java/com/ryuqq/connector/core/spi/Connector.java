package com.ryuqq.connector.core.spi;

import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;

import java.util.Map;

/**
 * 모든 백엔드 어댑터가 구현해야 하는 기본 계약.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * ConnectorFactory.create(config)
 *   → initialize(config)
 *   → healthCheck()  (실패해도 캐시됨)
 *   → ... 도메인 호출 ...
 *   → close()        (캐시 제거/만료/Registry 종료 시 정확히 한 번)
 * </pre>
 *
 * <p>도메인별 기능(retail, wishlist 등)은 이 인터페이스를 확장한
 * capability 인터페이스로 제공되며, 호출 측에서
 * {@link com.ryuqq.connector.core.capability.Capabilities#as(Connector, Class)}로 확인합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface Connector extends AutoCloseable {

    /**
     * 이 커넥터가 처리하는 도메인 (예: retail, wishlist).
     *
     * @return 도메인 이름
     */
    String getDomain();

    /**
     * 어댑터 구현 종류.
     *
     * @return AdapterKind
     */
    AdapterKind getAdapterKind();

    /**
     * 설정으로 커넥터 초기화.
     *
     * @param config 커넥터 설정
     * @throws com.ryuqq.connector.core.exception.ConnectorException 초기화 실패 시
     */
    void initialize(ConnectorConfig config);

    /**
     * 백엔드와 통신 가능한지 확인.
     *
     * @throws com.ryuqq.connector.core.exception.ConnectorException 헬스체크 실패 시
     */
    void healthCheck();

    /**
     * 커넥터가 보유한 리소스를 해제합니다.
     */
    @Override
    void close();

    /**
     * 모니터링용 통계.
     *
     * @return 통계 맵 (기본: 빈 맵)
     */
    default Map<String, Long> stats() {
        return Map.of();
    }
}
