package com.ryuqq.connector.core.domain.retail;

/**
 * 주문 상품 한 줄.
 */
public record OrderLineItem(
    String id,
    String productId,
    String variantId,
    String sku,
    String name,
    int quantity,
    Price unitPrice,
    Price totalPrice,
    String imageUrl
) {

    public OrderLineItem {
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity cannot be negative (current: " + quantity + ")");
        }
    }
}
