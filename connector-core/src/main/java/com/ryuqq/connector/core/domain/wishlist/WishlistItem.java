package com.ryuqq.connector.core.domain.wishlist;

import com.ryuqq.connector.core.domain.retail.Price;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 위시리스트 항목.
 */
public record WishlistItem(
    String id,
    String productId,
    String variantId,
    String sku,
    String name,
    Price price,
    String imageUrl,
    String notes,
    int quantity,
    Instant addedAt,
    Map<String, Object> metadata
) {

    public WishlistItem {
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive (current: " + quantity + ")");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
