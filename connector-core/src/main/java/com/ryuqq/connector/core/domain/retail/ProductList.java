package com.ryuqq.connector.core.domain.retail;

import java.util.List;

/**
 * 페이지 단위 상품 목록.
 */
public record ProductList(List<Product> products, int total, int limit, int offset, boolean hasMore) {

    public ProductList {
        products = products == null ? List.of() : List.copyOf(products);
    }
}
