package com.ryuqq.connector.core.domain.retail;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 백엔드 공통 상품 모델.
 *
 * <p>모든 retail 어댑터는 백엔드 고유 형식을 이 모델로 변환합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record Product(
    String id,
    String sku,
    String name,
    String description,
    String category,
    Price price,
    List<ProductImage> images,
    List<ProductVariant> variants,
    InventoryInfo inventory,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {

    public Product {
        images = images == null ? List.of() : List.copyOf(images);
        variants = variants == null ? List.of() : List.copyOf(variants);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 구매 가능한 재고가 있는지 여부.
     */
    public boolean isInStock() {
        return inventory != null && inventory.available();
    }
}
