package com.ryuqq.connector.core.domain.retail;

/**
 * 결제 수단 (민감 정보 제외).
 *
 * @param type 결제 종류 (credit_card, paypal 등)
 * @param last4 카드 번호 끝 4자리
 * @param brand 카드 브랜드
 * @param expiryMonth 만료 월 (null 허용)
 * @param expiryYear 만료 연도 (null 허용)
 */
public record PaymentMethod(String type, String last4, String brand, Integer expiryMonth, Integer expiryYear) {
}
