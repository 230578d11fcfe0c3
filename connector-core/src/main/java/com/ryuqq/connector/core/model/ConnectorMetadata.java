package com.ryuqq.connector.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * 커넥터 런타임 메타데이터.
 *
 * <p>운영 도구에서 사용하는 읽기 전용 정보입니다. 캐시되지 않은 커넥터는
 * {@code healthy=false}, {@code cached=false}, {@code lastChecked=null}로 보고되며
 * 메타데이터 조회 자체는 커넥터를 생성하지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param domain 도메인
 * @param adapterKind 어댑터 종류 이름
 * @param version 어댑터 버전
 * @param url 백엔드 URL
 * @param enabled 활성화 여부
 * @param healthy 마지막 헬스체크 성공 여부
 * @param cached 현재 캐시에 인스턴스가 존재하는지 여부
 * @param lastChecked 마지막 접근 시각 (캐시되지 않은 경우 null)
 * @param stats 커넥터 통계 (예: 요청 수, 실패 수)
 */
public record ConnectorMetadata(
    String domain,
    String adapterKind,
    String version,
    String url,
    boolean enabled,
    boolean healthy,
    boolean cached,
    Instant lastChecked,
    Map<String, Long> stats
) {

    public ConnectorMetadata {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    /**
     * 캐시되지 않은 커넥터의 메타데이터.
     *
     * @param config 커넥터 설정
     * @return 메타데이터 (healthy=false, cached=false)
     */
    public static ConnectorMetadata uncached(ConnectorConfig config) {
        return new ConnectorMetadata(
            config.domain(),
            config.adapterKind().getValue(),
            config.version(),
            config.url(),
            config.enabled(),
            false,
            false,
            null,
            Map.of()
        );
    }
}
