/**
 * Contract Test 기반 클래스 패키지.
 *
 * <p>SPI 구현체가 공통으로 지켜야 하는 계약을 검증하는 추상 테스트를 제공합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.testkit.contract;
