package com.ryuqq.connector.core.domain.wishlist;

import java.util.List;

/**
 * 페이지 단위 위시리스트 목록.
 */
public record WishlistList(List<Wishlist> wishlists, int total, int limit, int offset, boolean hasMore) {

    public WishlistList {
        wishlists = wishlists == null ? List.of() : List.copyOf(wishlists);
    }
}
