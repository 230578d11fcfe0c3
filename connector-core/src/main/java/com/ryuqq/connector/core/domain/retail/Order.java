package com.ryuqq.connector.core.domain.retail;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 백엔드 공통 주문 모델.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record Order(
    String id,
    String orderNumber,
    String customerId,
    String storeId,
    OrderStatus status,
    List<OrderLineItem> lineItems,
    Price subtotal,
    Price tax,
    Price shipping,
    Price total,
    Address billingAddress,
    Address shippingAddress,
    PaymentMethod paymentMethod,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {

    public Order {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
