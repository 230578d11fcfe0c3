package com.ryuqq.connector.application.registry;

import com.ryuqq.connector.adapter.d365.D365CommerceConnectorFactory;
import com.ryuqq.connector.adapter.inmemory.store.InMemoryConnectorConfigStore;
import com.ryuqq.connector.adapter.inmemory.wishlist.InMemoryWishlistConnectorFactory;
import com.ryuqq.connector.core.capability.RetailConnector;
import com.ryuqq.connector.core.capability.WishlistConnector;
import com.ryuqq.connector.core.domain.retail.ProductFilters;
import com.ryuqq.connector.core.domain.retail.ProductList;
import com.ryuqq.connector.core.domain.wishlist.Wishlist;
import com.ryuqq.connector.core.model.ConnectorMetadata;
import com.ryuqq.connector.testkit.support.ConnectorConfigFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 실제 어댑터(D365 데모 모드, 인메모리 위시리스트)와 함께 동작하는 Registry 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class ConnectorRegistryIntegrationTest {

    private static final String TENANT = ConnectorConfigFixtures.TENANT;
    private static final String STORE = ConnectorConfigFixtures.STORE;

    private ConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        InMemoryConnectorConfigStore store = new InMemoryConnectorConfigStore(List.of(
            ConnectorConfigFixtures.config(TENANT, STORE, RetailConnector.DOMAIN, D365CommerceConnectorFactory.KIND),
            ConnectorConfigFixtures.config(TENANT, STORE, WishlistConnector.DOMAIN, InMemoryWishlistConnectorFactory.KIND)
        ));
        registry = new ConnectorRegistry(store);
        registry.registerFactory(D365CommerceConnectorFactory.KIND, new D365CommerceConnectorFactory());
        registry.registerFactory(InMemoryWishlistConnectorFactory.KIND, new InMemoryWishlistConnectorFactory());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void retail_커넥터를_capability로_조회하여_데모_카탈로그_사용() {
        // when
        RetailConnector retail = registry.getConnector(TENANT, STORE, RetailConnector.DOMAIN, RetailConnector.class);
        ProductList products = retail.getProducts(ProductFilters.all());

        // then
        assertThat(products.products()).isNotEmpty();
        assertThat(retail.getProduct("1001").id()).isEqualTo("1001");
        assertThat(registry.getConnector(TENANT, STORE, RetailConnector.DOMAIN)).isSameAs(retail);
    }

    @Test
    void wishlist_커넥터는_캐시된_동안_상태를_유지() {
        // given
        WishlistConnector wishlists = registry.getConnector(TENANT, STORE, WishlistConnector.DOMAIN, WishlistConnector.class);
        Wishlist created = wishlists.createWishlist("customer-1", "Living room", false);

        // when
        WishlistConnector again = registry.getConnector(TENANT, STORE, WishlistConnector.DOMAIN, WishlistConnector.class);

        // then
        assertThat(again.getWishlist(created.id()).name()).isEqualTo("Living room");
        assertThat(created.tenantId()).isEqualTo(TENANT);
        assertThat(created.storeId()).isEqualTo(STORE);
    }

    @Test
    void 지원하지_않는_capability_요청은_UnsupportedOperationException() {
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, WishlistConnector.DOMAIN, RetailConnector.class))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("does not support RetailConnector");
    }

    @Test
    void listConnectors_캐시된_어댑터의_통계_포함() {
        // given
        registry.getConnector(TENANT, STORE, RetailConnector.DOMAIN);

        // when
        List<ConnectorMetadata> connectors = registry.listConnectors(TENANT, STORE);

        // then
        assertThat(connectors).extracting(ConnectorMetadata::adapterKind)
            .containsExactlyInAnyOrder("D365CommerceAdapter", "InMemoryWishlistAdapter");
        ConnectorMetadata retail = connectors.stream()
            .filter(ConnectorMetadata::cached)
            .findFirst()
            .orElseThrow();
        assertThat(retail.domain()).isEqualTo(RetailConnector.DOMAIN);
        assertThat(retail.healthy()).isTrue();
        assertThat(retail.stats()).containsKeys("requests", "totalFailures");
    }
}
