package com.ryuqq.connector.core.domain.retail;

/**
 * 주문 생명주기 상태.
 *
 * <pre>
 * PENDING → PROCESSING → PAID → SHIPPED → DELIVERED
 *    │                     │
 *    └──► CANCELLED        └──► REFUNDED
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public enum OrderStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    PAID("paid"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled"),
    REFUNDED("refunded");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    /**
     * 외부 표현 값 (소문자).
     */
    public String getValue() {
        return value;
    }

    /**
     * 외부 표현 값으로 상태 조회.
     *
     * @param value 상태 값 (대소문자 무시)
     * @return OrderStatus
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static OrderStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("order status cannot be null");
        }
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown order status: " + value);
    }
}
