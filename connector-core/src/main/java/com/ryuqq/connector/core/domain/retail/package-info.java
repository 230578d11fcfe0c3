/**
 * Retail 도메인 모델 패키지.
 *
 * <p>상품, 가격, 재고, 주문 등 모든 retail 어댑터가 공유하는 표준 모델입니다.
 * 백엔드 고유 형식(예: OData)은 어댑터 내부에서 이 모델로 변환됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.domain.retail;
