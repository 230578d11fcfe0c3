package com.ryuqq.connector.adapter.d365;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.adapter.d365.odata.D365Order;
import com.ryuqq.connector.adapter.d365.odata.D365OrderListResponse;
import com.ryuqq.connector.adapter.d365.odata.D365Product;
import com.ryuqq.connector.adapter.d365.odata.D365ProductListResponse;
import com.ryuqq.connector.adapter.resilience.DefaultCircuitBreaker;
import com.ryuqq.connector.adapter.resilience.ResilientCallExecutor;
import com.ryuqq.connector.adapter.resilience.RetryExecutor;
import com.ryuqq.connector.core.capability.RetailConnector;
import com.ryuqq.connector.core.domain.retail.Order;
import com.ryuqq.connector.core.domain.retail.OrderList;
import com.ryuqq.connector.core.domain.retail.OrderRequest;
import com.ryuqq.connector.core.domain.retail.OrderStatus;
import com.ryuqq.connector.core.domain.retail.Product;
import com.ryuqq.connector.core.domain.retail.ProductFilters;
import com.ryuqq.connector.core.domain.retail.ProductList;
import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.ConnectorException;
import com.ryuqq.connector.core.exception.ErrorCategory;
import com.ryuqq.connector.core.exception.HealthCheckException;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.protection.CircuitBreakerConfig;
import com.ryuqq.connector.core.protection.CircuitBreakerCounts;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.retry.RetryPolicy;
import com.ryuqq.connector.core.retry.RetryableErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dynamics 365 Commerce 리테일 커넥터.
 *
 * <p><strong>호출 구성:</strong></p>
 * <pre>
 * D365CommerceAdapter
 *   └─ ResilientCallExecutor
 *        └─ DefaultCircuitBreaker("d365-commerce-&lt;storeId&gt;")
 *             └─ RetryExecutor(transientErrors)
 *                  └─ D365Client (Bearer 토큰 / Api-Key, OData 헤더)
 * </pre>
 *
 * <p><strong>데모 모드:</strong> config의 {@code demoMode=true}이면 백엔드를 호출하지 않고
 * {@link D365DemoCatalog}의 고정 데이터를 반환합니다. 헬스체크는 항상 성공합니다.</p>
 *
 * <p><strong>엔드포인트:</strong> {@code <csuBaseUrl>/api/commerce/v1/Products}, {@code .../Orders}</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class D365CommerceAdapter implements RetailConnector {

    private static final Logger log = LoggerFactory.getLogger(D365CommerceAdapter.class);

    public static final AdapterKind KIND = AdapterKind.of("D365CommerceAdapter");

    static final String API_PATH = "/api/commerce/v1";
    static final String HEALTH_PATH = "/api/health";

    private final ConnectorConfig connectorConfig;
    private final D365Config config;
    private final D365Client client;
    private final ResilientCallExecutor executor;
    private final D365DemoCatalog demoCatalog;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 커넥터 설정으로 생성.
     *
     * <p>Circuit Breaker 이름은 {@code d365-commerce-<storeId>}이며,
     * 재시도는 일시적 오류({@link RetryableErrors#transientErrors()})에만 적용됩니다.</p>
     *
     * @param connectorConfig 커넥터 설정
     */
    public D365CommerceAdapter(ConnectorConfig connectorConfig) {
        this(connectorConfig, D365Config.fromConnectorConfig(connectorConfig));
    }

    private D365CommerceAdapter(ConnectorConfig connectorConfig, D365Config config) {
        this(
            connectorConfig,
            config,
            D365Client.create(config),
            defaultExecutor(connectorConfig.storeId()),
            new ObjectMapper(),
            Clock.systemUTC()
        );
    }

    /**
     * 협력 객체를 지정하여 생성 (테스트용).
     */
    D365CommerceAdapter(ConnectorConfig connectorConfig, D365Config config, D365Client client,
                        ResilientCallExecutor executor, ObjectMapper objectMapper, Clock clock) {
        if (connectorConfig == null) {
            throw new IllegalArgumentException("connectorConfig cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.connectorConfig = connectorConfig;
        this.config = config;
        this.client = client;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.demoCatalog = new D365DemoCatalog(clock);
    }

    static ResilientCallExecutor defaultExecutor(String storeId) {
        CircuitBreakerConfig breakerConfig = new CircuitBreakerConfig(circuitBreakerName(storeId))
            .withOnStateChange((name, from, to) ->
                log.warn("D365 Commerce circuit breaker state changed: circuitBreaker={}, from={}, to={}",
                    name, from, to));
        RetryPolicy retryPolicy = new RetryPolicy().withRetryableErrors(RetryableErrors.transientErrors());
        return new ResilientCallExecutor(new DefaultCircuitBreaker(breakerConfig), new RetryExecutor(retryPolicy));
    }

    static String circuitBreakerName(String storeId) {
        return "d365-commerce-" + storeId;
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public String getDomain() {
        return DOMAIN;
    }

    @Override
    public AdapterKind getAdapterKind() {
        return KIND;
    }

    @Override
    public void initialize(ConnectorConfig initConfig) {
        log.info("Initializing D365 Commerce adapter: storeId={}, url={}, demoMode={}",
            initConfig.storeId(), initConfig.url(), config.demoMode());

        if (!config.demoMode() && !config.hasApiKey() && !config.hasOAuth2Credentials()) {
            throw new IllegalStateException("apiKey is required for D365 Commerce adapter (non-demo mode)");
        }
    }

    /**
     * {@code GET <base>/api/health}로 연결 확인 (5xx만 실패).
     *
     * @throws HealthCheckException 백엔드가 비정상인 경우
     */
    @Override
    public void healthCheck() {
        if (config.demoMode()) {
            return;
        }

        try {
            executor.execute(() -> {
                HttpResponse<String> response = client.get(HEALTH_PATH);
                if (response.statusCode() >= 500) {
                    throw BackendCallException.ofStatus("healthCheck", response.statusCode(), response.body());
                }
                return response.statusCode();
            });
        } catch (ConnectorException e) {
            throw new HealthCheckException("D365 Commerce health check failed: " + e.getMessage(), e);
        }
    }

    /**
     * CSU 루트 엔드포인트 연결 확인 (OAuth2 인증 포함).
     */
    public void ping() {
        client.ping();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing D365 Commerce adapter: storeId={}", connectorConfig.storeId());
        client.close();
    }

    @Override
    public Map<String, Long> stats() {
        CircuitBreakerCounts counts = executor.getCircuitBreaker().getCounts();
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("requests", counts.requests());
        stats.put("totalSuccesses", counts.totalSuccesses());
        stats.put("totalFailures", counts.totalFailures());
        stats.put("consecutiveFailures", counts.consecutiveFailures());
        return stats;
    }

    // ============================================================
    // Products
    // ============================================================

    @Override
    public ProductList getProducts(ProductFilters filters, CancellationToken token) {
        requireToken(token);
        ProductFilters effective = filters == null ? ProductFilters.all() : filters;
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.products(effective);
        }

        String path = API_PATH + "/Products?" + ODataQuery.forProducts(effective).encode();
        return executor.execute(() -> {
            String body = expectStatus("getProducts", client.get(path), 200);
            return D365Transformers.toProductList(
                decode("getProducts", body, D365ProductListResponse.class), effective);
        }, token);
    }

    @Override
    public Product getProduct(String productId, CancellationToken token) {
        requireToken(token);
        requireText(productId, "productId");
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.product(productId);
        }

        String path = API_PATH + "/Products" + ODataQuery.keySegment(productId) + "?$expand=Variants,Images";
        return executor.execute(() -> {
            HttpResponse<String> response = client.get(path);
            if (response.statusCode() == 404) {
                throw notFound("product not found: " + productId, 404);
            }
            String body = expectStatus("getProduct", response, 200);
            return D365Transformers.toProduct(decode("getProduct", body, D365Product.class));
        }, token);
    }

    @Override
    public Product getProductBySku(String sku, CancellationToken token) {
        requireToken(token);
        requireText(sku, "sku");
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.productBySku(sku);
        }

        String query = new ODataQuery()
            .set("$filter", "ItemId eq '" + ODataQuery.escapeLiteral(sku) + "'")
            .set("$expand", "Variants,Images")
            .encode();
        String path = API_PATH + "/Products?" + query;
        return executor.execute(() -> {
            String body = expectStatus("getProductBySku", client.get(path), 200);
            List<D365Product> matches = decode("getProductBySku", body, D365ProductListResponse.class).value();
            if (matches.isEmpty()) {
                throw notFound("product not found with SKU: " + sku, BackendCallException.NO_STATUS);
            }
            return D365Transformers.toProduct(matches.get(0));
        }, token);
    }

    // ============================================================
    // Orders
    // ============================================================

    @Override
    public Order createOrder(OrderRequest request, CancellationToken token) {
        requireToken(token);
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.createOrder(request);
        }

        String payload = encode("createOrder", D365Transformers.toOrderPayload(request));
        return executor.execute(() -> {
            String body = expectStatus("createOrder", client.post(API_PATH + "/Orders", payload), 201, 200);
            return D365Transformers.toOrder(decode("createOrder", body, D365Order.class), connectorConfig.storeId());
        }, token);
    }

    @Override
    public Order getOrder(String orderId, CancellationToken token) {
        requireToken(token);
        requireText(orderId, "orderId");
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.order(orderId);
        }

        String path = API_PATH + "/Orders" + ODataQuery.keySegment(orderId) + "?$expand=Lines";
        return executor.execute(() -> {
            HttpResponse<String> response = client.get(path);
            if (response.statusCode() == 404) {
                throw notFound("order not found: " + orderId, 404);
            }
            String body = expectStatus("getOrder", response, 200);
            return D365Transformers.toOrder(decode("getOrder", body, D365Order.class), connectorConfig.storeId());
        }, token);
    }

    @Override
    public OrderList getOrders(String customerId, int limit, int offset, CancellationToken token) {
        requireToken(token);
        requireText(customerId, "customerId");
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException(
                "limit and offset cannot be negative (limit: " + limit + ", offset: " + offset + ")");
        }
        if (config.demoMode()) {
            token.throwIfCancelled();
            return demoCatalog.orders(customerId, limit, offset);
        }

        String path = API_PATH + "/Orders?" + ODataQuery.forCustomerOrders(customerId, limit, offset).encode();
        return executor.execute(() -> {
            String body = expectStatus("getOrders", client.get(path), 200);
            return D365Transformers.toOrderList(
                decode("getOrders", body, D365OrderListResponse.class), connectorConfig.storeId(), limit, offset);
        }, token);
    }

    @Override
    public void updateOrderStatus(String orderId, OrderStatus status, CancellationToken token) {
        requireToken(token);
        requireText(orderId, "orderId");
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (config.demoMode()) {
            token.throwIfCancelled();
            log.info("Demo: order status updated: orderId={}, status={}", orderId, status.getValue());
            return;
        }

        String payload = encode("updateOrderStatus", Map.of("Status", D365Transformers.toD365Status(status)));
        String path = API_PATH + "/Orders" + ODataQuery.keySegment(orderId);
        executor.execute(() -> {
            expectStatus("updateOrderStatus", client.patch(path, payload), 200, 204);
            return null;
        }, token);
    }

    // ============================================================
    // Helpers
    // ============================================================

    public D365Config getConfig() {
        return config;
    }

    private static void requireToken(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
    }

    private static String expectStatus(String operation, HttpResponse<String> response, int... accepted) {
        int status = response.statusCode();
        for (int code : accepted) {
            if (status == code) {
                return response.body();
            }
        }
        throw BackendCallException.ofStatus(operation, status, response.body());
    }

    private <T> T decode(String operation, String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BackendCallException(
                operation + " failed: cannot decode D365 response: " + e.getOriginalMessage(),
                BackendCallException.NO_STATUS, ErrorCategory.UNAVAILABLE, false, e);
        }
    }

    private String encode(String operation, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackendCallException(
                operation + " failed: cannot encode D365 request: " + e.getOriginalMessage(),
                BackendCallException.NO_STATUS, ErrorCategory.UNAVAILABLE, false, e);
        }
    }

    private static BackendCallException notFound(String message, int status) {
        return new BackendCallException(message, status, ErrorCategory.NOT_FOUND, false, null);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
