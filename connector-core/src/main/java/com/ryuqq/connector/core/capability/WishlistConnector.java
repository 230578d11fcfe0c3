package com.ryuqq.connector.core.capability;

import com.ryuqq.connector.core.domain.wishlist.AddWishlistItemRequest;
import com.ryuqq.connector.core.domain.wishlist.Wishlist;
import com.ryuqq.connector.core.domain.wishlist.WishlistItem;
import com.ryuqq.connector.core.domain.wishlist.WishlistList;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.spi.Connector;

/**
 * Wishlist 백엔드 기능.
 *
 * <p>토큰을 받는 형태는 호출 전에 취소 여부만 확인하고 위임합니다. 원격 백엔드를 쓰는 구현은
 * 진행 중인 호출까지 토큰에 묶도록 재정의합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface WishlistConnector extends Connector {

    /** wishlist capability의 도메인 이름. */
    String DOMAIN = "wishlist";

    WishlistList getWishlists(String customerId);

    Wishlist getWishlist(String wishlistId);

    Wishlist createWishlist(String customerId, String name, boolean isPublic);

    WishlistItem addItem(String wishlistId, AddWishlistItemRequest request);

    void removeItem(String wishlistId, String itemId);

    WishlistItem updateItem(String wishlistId, String itemId, int quantity, String notes);

    void deleteWishlist(String wishlistId);

    default WishlistList getWishlists(String customerId, CancellationToken token) {
        token.throwIfCancelled();
        return getWishlists(customerId);
    }

    default Wishlist getWishlist(String wishlistId, CancellationToken token) {
        token.throwIfCancelled();
        return getWishlist(wishlistId);
    }

    default Wishlist createWishlist(String customerId, String name, boolean isPublic, CancellationToken token) {
        token.throwIfCancelled();
        return createWishlist(customerId, name, isPublic);
    }

    default WishlistItem addItem(String wishlistId, AddWishlistItemRequest request, CancellationToken token) {
        token.throwIfCancelled();
        return addItem(wishlistId, request);
    }

    default void removeItem(String wishlistId, String itemId, CancellationToken token) {
        token.throwIfCancelled();
        removeItem(wishlistId, itemId);
    }

    default WishlistItem updateItem(String wishlistId, String itemId, int quantity, String notes,
                                    CancellationToken token) {
        token.throwIfCancelled();
        return updateItem(wishlistId, itemId, quantity, notes);
    }

    default void deleteWishlist(String wishlistId, CancellationToken token) {
        token.throwIfCancelled();
        deleteWishlist(wishlistId);
    }
}
