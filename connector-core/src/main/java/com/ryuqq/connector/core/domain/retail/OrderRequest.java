package com.ryuqq.connector.core.domain.retail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 생성 요청.
 */
public record OrderRequest(
    String storeId,
    List<OrderLineItem> lineItems,
    Address billingAddress,
    Address shippingAddress,
    PaymentMethod paymentMethod,
    Map<String, Object> metadata
) {

    public OrderRequest {
        if (lineItems == null || lineItems.isEmpty()) {
            throw new IllegalArgumentException("lineItems cannot be null or empty");
        }
        lineItems = List.copyOf(lineItems);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
