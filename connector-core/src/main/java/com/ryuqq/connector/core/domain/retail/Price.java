package com.ryuqq.connector.core.domain.retail;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 통화를 포함한 가격.
 *
 * @param amount 금액
 * @param currency 통화 코드 (예: USD)
 * @param compareAtPrice 할인 전 가격 (null 허용)
 */
public record Price(BigDecimal amount, String currency, BigDecimal compareAtPrice) {

    public Price {
        if (amount == null) {
            throw new IllegalArgumentException("amount cannot be null");
        }
    }

    public static Price of(BigDecimal amount, String currency) {
        return new Price(amount, currency, null);
    }

    public static Price of(String amount, String currency) {
        return new Price(new BigDecimal(amount), currency, null);
    }

    /**
     * 소수점 둘째 자리로 반올림한 가격.
     */
    public Price rounded() {
        return new Price(amount.setScale(2, RoundingMode.HALF_UP), currency, compareAtPrice);
    }
}
