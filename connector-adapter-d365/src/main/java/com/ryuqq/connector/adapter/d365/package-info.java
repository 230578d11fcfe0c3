/**
 * Dynamics 365 Commerce 리테일 커넥터 패키지.
 *
 * <p>{@link com.ryuqq.connector.adapter.d365.D365CommerceAdapter}는
 * {@link com.ryuqq.connector.core.capability.RetailConnector}를 구현하며,
 * 모든 백엔드 호출을 Circuit Breaker + 재시도로 감쌉니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.connector.adapter.d365.D365Config}: 설정 (커넥터 설정 문서 또는 환경 변수)</li>
 *   <li>{@link com.ryuqq.connector.adapter.d365.D365Client}: 인증/OData 헤더를 붙이는 HTTP 클라이언트</li>
 *   <li>{@link com.ryuqq.connector.adapter.d365.D365CommerceConnectorFactory}: Registry 등록용 Factory</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.d365;
