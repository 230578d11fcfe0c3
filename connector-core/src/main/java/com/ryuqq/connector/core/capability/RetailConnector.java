package com.ryuqq.connector.core.capability;

import com.ryuqq.connector.core.domain.retail.Order;
import com.ryuqq.connector.core.domain.retail.OrderList;
import com.ryuqq.connector.core.domain.retail.OrderRequest;
import com.ryuqq.connector.core.domain.retail.OrderStatus;
import com.ryuqq.connector.core.domain.retail.Product;
import com.ryuqq.connector.core.domain.retail.ProductFilters;
import com.ryuqq.connector.core.domain.retail.ProductList;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.spi.Connector;

/**
 * Retail(커머스) 백엔드 기능.
 *
 * <p>모든 연산은 실패 시 {@link com.ryuqq.connector.core.exception.ConnectorException}을 던집니다.
 * 백엔드 호출은 어댑터 내부에서 Circuit Breaker와 Retry로 보호됩니다.</p>
 *
 * <p>각 연산은 {@link CancellationToken}을 받는 형태가 기본이며, 토큰이 취소되거나 마감 시간이 지나면
 * 진행 중인 백엔드 호출을 기다리지 않고
 * {@link com.ryuqq.connector.core.exception.RetryCancelledException}을 던집니다.
 * 토큰 없는 형태는 {@link CancellationToken#none()}으로 위임합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface RetailConnector extends Connector {

    /** retail capability의 도메인 이름. */
    String DOMAIN = "retail";

    ProductList getProducts(ProductFilters filters, CancellationToken token);

    default ProductList getProducts(ProductFilters filters) {
        return getProducts(filters, CancellationToken.none());
    }

    Product getProduct(String productId, CancellationToken token);

    default Product getProduct(String productId) {
        return getProduct(productId, CancellationToken.none());
    }

    Product getProductBySku(String sku, CancellationToken token);

    default Product getProductBySku(String sku) {
        return getProductBySku(sku, CancellationToken.none());
    }

    Order createOrder(OrderRequest request, CancellationToken token);

    default Order createOrder(OrderRequest request) {
        return createOrder(request, CancellationToken.none());
    }

    Order getOrder(String orderId, CancellationToken token);

    default Order getOrder(String orderId) {
        return getOrder(orderId, CancellationToken.none());
    }

    /**
     * 고객 주문 목록 조회 (최신순).
     *
     * @param customerId 고객 ID
     * @param limit 최대 결과 수
     * @param offset 시작 위치
     * @param token 취소 신호
     * @return 주문 목록
     */
    OrderList getOrders(String customerId, int limit, int offset, CancellationToken token);

    default OrderList getOrders(String customerId, int limit, int offset) {
        return getOrders(customerId, limit, offset, CancellationToken.none());
    }

    void updateOrderStatus(String orderId, OrderStatus status, CancellationToken token);

    default void updateOrderStatus(String orderId, OrderStatus status) {
        updateOrderStatus(orderId, status, CancellationToken.none());
    }
}
