/**
 * Connector SPI (Service Provider Interface) 패키지.
 *
 * <p>Registry가 의존하는 확장점을 정의합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.spi.Connector}: 어댑터 기본 계약</li>
 *   <li>{@link com.ryuqq.connector.core.spi.ConnectorFactory}: 어댑터 종류별 생성자</li>
 *   <li>{@link com.ryuqq.connector.core.spi.ConnectorConfigStore}: 외부 설정 저장소 경계</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.spi;
