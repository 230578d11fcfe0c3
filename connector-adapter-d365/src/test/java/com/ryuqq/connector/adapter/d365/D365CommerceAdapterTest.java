package com.ryuqq.connector.adapter.d365;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.adapter.resilience.DefaultCircuitBreaker;
import com.ryuqq.connector.adapter.resilience.ResilientCallExecutor;
import com.ryuqq.connector.adapter.resilience.RetryExecutor;
import com.ryuqq.connector.core.domain.retail.Order;
import com.ryuqq.connector.core.domain.retail.OrderLineItem;
import com.ryuqq.connector.core.domain.retail.OrderList;
import com.ryuqq.connector.core.domain.retail.OrderRequest;
import com.ryuqq.connector.core.domain.retail.OrderStatus;
import com.ryuqq.connector.core.domain.retail.Price;
import com.ryuqq.connector.core.domain.retail.Product;
import com.ryuqq.connector.core.domain.retail.ProductFilters;
import com.ryuqq.connector.core.domain.retail.ProductList;
import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.ErrorCategory;
import com.ryuqq.connector.core.exception.HealthCheckException;
import com.ryuqq.connector.core.exception.RetryCancelledException;
import com.ryuqq.connector.core.exception.RetryExhaustedException;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.protection.CircuitBreakerConfig;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.retry.RetryPolicy;
import com.ryuqq.connector.core.retry.RetryableErrors;
import com.ryuqq.connector.testkit.support.ConnectorConfigFixtures;
import com.ryuqq.connector.testkit.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * D365CommerceAdapter 유닛 테스트.
 *
 * <p>D365Client를 Mock으로 대체하여 경로 구성, 상태 코드 해석, 재시도 여부를 검증합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class D365CommerceAdapterTest {

    private static final String PRODUCTS = "/api/commerce/v1/Products";
    private static final String ORDERS = "/api/commerce/v1/Orders";

    @Mock
    private D365Client client;

    @Mock
    private HttpResponse<String> response;

    private ConnectorConfig connectorConfig;
    private ResilientCallExecutor executor;
    private D365CommerceAdapter adapter;

    @BeforeEach
    void setUp() {
        connectorConfig = ConnectorConfigFixtures.config(ConnectorConfigFixtures.TENANT, ConnectorConfigFixtures.STORE,
            "retail", D365CommerceAdapter.KIND);
        RetryPolicy fastRetry = new RetryPolicy()
            .withInitialDelay(Duration.ofMillis(1))
            .withMaxDelay(Duration.ofMillis(5))
            .withRetryableErrors(RetryableErrors.transientErrors());
        executor = new ResilientCallExecutor(
            new DefaultCircuitBreaker(new CircuitBreakerConfig("d365-test")),
            new RetryExecutor(fastRetry));
        adapter = adapterWith(liveConfig("api-key"));
    }

    private static D365Config liveConfig(String apiKey) {
        return new D365Config("https://csu.example.com", null, null, null, null, null, apiKey,
            false, Duration.ofSeconds(5));
    }

    private D365CommerceAdapter adapterWith(D365Config config) {
        return new D365CommerceAdapter(connectorConfig, config, client, executor, new ObjectMapper(),
            MutableClock.startingAt(Instant.parse("2024-06-01T12:00:00Z")));
    }

    private void respond(int status, String body) {
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
    }

    private static OrderRequest orderRequest() {
        OrderLineItem line = new OrderLineItem(null, "1001", null, "BILLY-WHITE-001", "BILLY", 2,
            Price.of("79.99", "USD"), Price.of("159.98", "USD"), null);
        return new OrderRequest(ConnectorConfigFixtures.STORE, List.of(line), null, null, null, null);
    }

    // ============================================================
    // 1. 라이프사이클
    // ============================================================

    @Test
    void 식별자는_retail_도메인과_D365_어댑터_종류() {
        assertThat(adapter.getDomain()).isEqualTo("retail");
        assertThat(adapter.getAdapterKind().getValue()).isEqualTo("D365CommerceAdapter");
    }

    @Test
    void initialize_데모_모드가_아니고_인증_정보가_없으면_실패() {
        // given
        D365CommerceAdapter unauthenticated = adapterWith(liveConfig(null));

        // when & then
        assertThatThrownBy(() -> unauthenticated.initialize(connectorConfig))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("apiKey is required for D365 Commerce adapter (non-demo mode)");
    }

    @Test
    void initialize_apiKey가_있으면_성공() {
        assertThatCode(() -> adapter.initialize(connectorConfig)).doesNotThrowAnyException();
    }

    @Test
    void healthCheck_5xx면_HealthCheckException() throws Exception {
        // given
        respond(503, "down");
        when(client.get(D365CommerceAdapter.HEALTH_PATH)).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.healthCheck())
            .isInstanceOf(HealthCheckException.class)
            .hasMessageContaining("D365 Commerce health check failed");
    }

    @Test
    void healthCheck_4xx는_정상으로_간주() throws Exception {
        // given
        when(response.statusCode()).thenReturn(404);
        when(client.get(D365CommerceAdapter.HEALTH_PATH)).thenReturn(response);

        // when & then
        assertThatCode(() -> adapter.healthCheck()).doesNotThrowAnyException();
    }

    @Test
    void close_여러_번_호출해도_클라이언트는_한_번만_닫힘() {
        // when
        adapter.close();
        adapter.close();

        // then
        verify(client, times(1)).close();
    }

    // ============================================================
    // 2. 상품
    // ============================================================

    @Test
    void getProducts_OData_쿼리로_조회하고_변환() throws Exception {
        // given
        respond(200, D365TransformersTest.fixture("product-list.json"));
        String expectedPath = PRODUCTS + "?%24expand=Variants%2CImages&%24filter=Category+eq+%27furniture%27&%24top=10";
        when(client.get(expectedPath)).thenReturn(response);

        // when
        ProductList list = adapter.getProducts(ProductFilters.all().withCategory("furniture").withPage(10, 0));

        // then
        assertThat(list.products()).extracting(Product::sku).containsExactly("POANG-001");
        assertThat(list.total()).isEqualTo(42);
        assertThat(adapter.stats()).containsEntry("requests", 1L).containsEntry("totalSuccesses", 1L);
    }

    @Test
    void getProduct_404면_재시도_없이_NOT_FOUND() throws Exception {
        // given
        when(response.statusCode()).thenReturn(404);
        when(client.get(PRODUCTS + "('9999')?$expand=Variants,Images")).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.getProduct("9999"))
            .isInstanceOfSatisfying(BackendCallException.class, e -> {
                assertThat(e.getCategory()).isEqualTo(ErrorCategory.NOT_FOUND);
                assertThat(e.getMessage()).isEqualTo("product not found: 9999");
            });
        verify(client, times(1)).get(anyString());
    }

    @Test
    void getProductBySku_결과가_없으면_NOT_FOUND() throws Exception {
        // given
        respond(200, "{\"@odata.count\":0,\"value\":[]}");
        when(client.get(anyString())).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.getProductBySku("NOPE-1"))
            .isInstanceOfSatisfying(BackendCallException.class, e ->
                assertThat(e.getCategory()).isEqualTo(ErrorCategory.NOT_FOUND))
            .hasMessage("product not found with SKU: NOPE-1");
    }

    @Test
    void getProduct_5xx는_최대_시도_횟수까지_재시도() throws Exception {
        // given
        respond(503, "unavailable");
        when(client.get(anyString())).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.getProduct("1001"))
            .isInstanceOfSatisfying(RetryExhaustedException.class, e ->
                assertThat(e.getAttempts()).isEqualTo(3));
        verify(client, times(3)).get(anyString());
        assertThat(adapter.stats()).containsEntry("requests", 1L).containsEntry("totalFailures", 1L);
    }

    @Test
    void 응답_JSON이_깨지면_재시도하지_않음() throws Exception {
        // given
        respond(200, "<html>gateway</html>");
        when(client.get(anyString())).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.getProduct("1001"))
            .isInstanceOfSatisfying(BackendCallException.class, e -> {
                assertThat(e.isRetryable()).isFalse();
                assertThat(e.getMessage()).startsWith("getProduct failed: cannot decode D365 response");
            });
        verify(client, times(1)).get(anyString());
    }

    // ============================================================
    // 3. 주문
    // ============================================================

    @Test
    void createOrder_201_응답을_주문으로_변환() throws Exception {
        // given
        respond(201, D365TransformersTest.fixture("order.json"));
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        when(client.post(eq(ORDERS), payload.capture())).thenReturn(response);

        // when
        Order order = adapter.createOrder(orderRequest());

        // then
        assertThat(order.orderNumber()).isEqualTo("SO-000077");
        assertThat(order.storeId()).isEqualTo(ConnectorConfigFixtures.STORE);
        assertThat(payload.getValue())
            .contains("\"CustomerAccount\":\"\"")
            .contains("\"ItemId\":\"BILLY-WHITE-001\"")
            .contains("\"Quantity\":2");
    }

    @Test
    void createOrder_400은_재시도하지_않음() throws Exception {
        // given
        respond(400, "invalid line");
        when(client.post(eq(ORDERS), anyString())).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.createOrder(orderRequest()))
            .isInstanceOf(BackendCallException.class)
            .hasMessage("createOrder failed: status=400, body=invalid line");
        verify(client, times(1)).post(eq(ORDERS), anyString());
    }

    @Test
    void getOrder_404면_NOT_FOUND() throws Exception {
        // given
        when(response.statusCode()).thenReturn(404);
        when(client.get(ORDERS + "('SO-1')?$expand=Lines")).thenReturn(response);

        // when & then
        assertThatThrownBy(() -> adapter.getOrder("SO-1"))
            .isInstanceOf(BackendCallException.class)
            .hasMessage("order not found: SO-1");
    }

    @Test
    void getOrders_고객_주문_목록() throws Exception {
        // given
        respond(200, "{\"@odata.count\":7,\"value\":[" + D365TransformersTest.fixture("order.json") + "]}");
        when(client.get(ORDERS + "?" + ODataQuery.forCustomerOrders("C-1", 1, 0).encode())).thenReturn(response);

        // when
        OrderList orders = adapter.getOrders("C-1", 1, 0);

        // then
        assertThat(orders.orders()).hasSize(1);
        assertThat(orders.total()).isEqualTo(7);
        assertThat(orders.limit()).isEqualTo(1);
    }

    @Test
    void updateOrderStatus_D365_상태로_PATCH() throws Exception {
        // given
        when(response.statusCode()).thenReturn(204);
        when(client.patch(ORDERS + "('SO-1')", "{\"Status\":\"Shipped\"}")).thenReturn(response);

        // when & then
        assertThatCode(() -> adapter.updateOrderStatus("SO-1", OrderStatus.SHIPPED)).doesNotThrowAnyException();
    }

    @Test
    void 입력값_검증() {
        assertThatThrownBy(() -> adapter.getProduct(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> adapter.getOrders("C-1", -1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> adapter.updateOrderStatus("SO-1", null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(client);
    }

    // ============================================================
    // 4. 데모 모드
    // ============================================================

    @Test
    void 데모_모드는_백엔드를_호출하지_않음() {
        // given
        D365CommerceAdapter demo = adapterWith(new D365Config(null, null, null, null, null, null, null,
            true, Duration.ofSeconds(5)));

        // when
        demo.initialize(connectorConfig);
        demo.healthCheck();
        ProductList products = demo.getProducts(null);
        Order order = demo.getOrder("1001");
        demo.updateOrderStatus("1001", OrderStatus.SHIPPED);

        // then
        assertThat(products.total()).isEqualTo(5);
        assertThat(order.status()).isEqualTo(OrderStatus.PAID);
        verifyNoInteractions(client);
    }

    @Test
    void Factory는_설정으로_어댑터를_생성() {
        // when
        D365CommerceAdapter created = (D365CommerceAdapter) new D365CommerceConnectorFactory().create(connectorConfig);

        // then
        assertThat(created.getConfig().demoMode()).isTrue();
        assertThat(created.getConfig().csuBaseUrl()).isEqualTo("https://ikea-seattle.example.com");
        assertThat(created.getProduct("1002").sku()).isEqualTo("KALLAX-001");
        created.close();
    }

    // ============================================================
    // 취소
    // ============================================================

    @Test
    void getProducts_토큰_타임아웃이면_응답을_기다리지_않고_RetryCancelledException() throws Exception {
        // given
        when(client.get(anyString())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return response;
        });
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(200));
        long started = System.nanoTime();

        // when
        Throwable thrown = catchThrowable(() -> adapter.getProducts(ProductFilters.all(), token));

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
        assertThat(((RetryCancelledException) thrown).getCategory()).isEqualTo(ErrorCategory.CANCELLED);
        assertThat(elapsedMs).isLessThan(1500);
        verify(client, times(1)).get(anyString());
    }

    @Test
    void 취소된_토큰은_데모_모드에서도_거부됨() {
        // given
        D365CommerceAdapter demo = adapterWith(new D365Config(null, null, null, null, null, null, null,
            true, Duration.ofSeconds(5)));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // when & then
        assertThatThrownBy(() -> demo.getOrder("1001", token))
            .isInstanceOf(RetryCancelledException.class);
        assertThatThrownBy(() -> demo.getProducts(ProductFilters.all(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("token cannot be null");
        verifyNoInteractions(client);
    }
}
