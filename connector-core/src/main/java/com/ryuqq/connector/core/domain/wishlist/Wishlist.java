package com.ryuqq.connector.core.domain.wishlist;

import java.time.Instant;
import java.util.List;

/**
 * 고객의 위시리스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public record Wishlist(
    String id,
    String customerId,
    String tenantId,
    String storeId,
    String name,
    List<WishlistItem> items,
    boolean isPublic,
    Instant createdAt,
    Instant updatedAt
) {

    public Wishlist {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
