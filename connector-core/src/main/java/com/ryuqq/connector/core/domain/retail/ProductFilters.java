package com.ryuqq.connector.core.domain.retail;

import java.math.BigDecimal;
import java.util.List;

/**
 * 상품 검색/필터 조건.
 *
 * <p>null 필드는 조건 없음으로 취급합니다. limit이 0이면 어댑터 기본값을 사용합니다.</p>
 *
 * @param category 카테고리
 * @param minPrice 최소 가격
 * @param maxPrice 최대 가격
 * @param inStock true면 재고 있는 상품만
 * @param searchTerm 이름/설명 검색어
 * @param skus SKU 목록
 * @param limit 최대 결과 수 (0 이상)
 * @param offset 시작 위치 (0 이상)
 */
public record ProductFilters(
    String category,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    Boolean inStock,
    String searchTerm,
    List<String> skus,
    int limit,
    int offset
) {

    public ProductFilters {
        if (limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative (current: " + limit + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative (current: " + offset + ")");
        }
        skus = skus == null ? List.of() : List.copyOf(skus);
    }

    /**
     * 조건 없는 필터.
     */
    public static ProductFilters all() {
        return new ProductFilters(null, null, null, null, null, List.of(), 0, 0);
    }

    public ProductFilters withCategory(String category) {
        return new ProductFilters(category, minPrice, maxPrice, inStock, searchTerm, skus, limit, offset);
    }

    public ProductFilters withPriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
        return new ProductFilters(category, minPrice, maxPrice, inStock, searchTerm, skus, limit, offset);
    }

    public ProductFilters withInStock(Boolean inStock) {
        return new ProductFilters(category, minPrice, maxPrice, inStock, searchTerm, skus, limit, offset);
    }

    public ProductFilters withSearchTerm(String searchTerm) {
        return new ProductFilters(category, minPrice, maxPrice, inStock, searchTerm, skus, limit, offset);
    }

    public ProductFilters withPage(int limit, int offset) {
        return new ProductFilters(category, minPrice, maxPrice, inStock, searchTerm, skus, limit, offset);
    }
}
