package com.ryuqq.connector.core.domain.wishlist;

/**
 * 위시리스트 항목 추가 요청.
 */
public record AddWishlistItemRequest(String productId, String variantId, int quantity, String notes) {

    public AddWishlistItemRequest {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be null or blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive (current: " + quantity + ")");
        }
    }
}
