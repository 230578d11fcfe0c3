package com.ryuqq.connector.core.domain.retail;

/**
 * 재고 정보.
 *
 * @param available 구매 가능 여부
 * @param quantity 재고 수량
 * @param storeId 재고 위치 스토어 (null 허용)
 * @param reservedQuantity 예약 수량
 */
public record InventoryInfo(boolean available, int quantity, String storeId, int reservedQuantity) {

    public static InventoryInfo of(boolean available, int quantity) {
        return new InventoryInfo(available, quantity, null, 0);
    }
}
