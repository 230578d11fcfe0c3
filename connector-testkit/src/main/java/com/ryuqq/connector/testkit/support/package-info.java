/**
 * 테스트 지원 도구 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.connector.testkit.support.MutableClock}: 직접 제어 가능한 Clock</li>
 *   <li>{@link com.ryuqq.connector.testkit.support.RecordingConnector}: 생명주기 호출 기록</li>
 *   <li>{@link com.ryuqq.connector.testkit.support.RecordingConnectorFactory}: 생성 횟수 기록, 지연/실패 주입</li>
 *   <li>{@link com.ryuqq.connector.testkit.support.ConnectorConfigFixtures}: 설정 픽스처</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.testkit.support;
