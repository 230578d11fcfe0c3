package com.ryuqq.connector.core.domain.retail;

import java.util.List;

/**
 * 페이지 단위 주문 목록.
 */
public record OrderList(List<Order> orders, int total, int limit, int offset, boolean hasMore) {

    public OrderList {
        orders = orders == null ? List.of() : List.copyOf(orders);
    }
}
