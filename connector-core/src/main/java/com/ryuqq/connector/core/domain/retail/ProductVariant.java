package com.ryuqq.connector.core.domain.retail;

import java.util.Map;

/**
 * 상품 옵션 (사이즈, 색상 등).
 *
 * @param id 옵션 ID
 * @param sku 옵션 SKU
 * @param name 옵션 이름
 * @param price 옵션 가격
 * @param attributes 옵션 속성 (예: color=beige)
 * @param inventory 재고 (null 허용)
 */
public record ProductVariant(
    String id,
    String sku,
    String name,
    Price price,
    Map<String, String> attributes,
    InventoryInfo inventory
) {

    public ProductVariant {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
