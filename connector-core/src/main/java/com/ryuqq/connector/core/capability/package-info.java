/**
 * 도메인별 Connector capability 패키지.
 *
 * <p>기본 {@link com.ryuqq.connector.core.spi.Connector} 계약에 도메인 연산을 추가하는
 * 명시적 확장 인터페이스입니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.core.capability.RetailConnector}: 상품/주문</li>
 *   <li>{@link com.ryuqq.connector.core.capability.WishlistConnector}: 위시리스트</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.capability;
