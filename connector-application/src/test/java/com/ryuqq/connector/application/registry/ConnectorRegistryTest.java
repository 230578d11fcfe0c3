package com.ryuqq.connector.application.registry;

import com.ryuqq.connector.adapter.inmemory.store.InMemoryConnectorConfigStore;
import com.ryuqq.connector.core.exception.ConnectorConfigStoreException;
import com.ryuqq.connector.core.exception.ConnectorDisabledException;
import com.ryuqq.connector.core.exception.ConnectorInitializationException;
import com.ryuqq.connector.core.exception.ConnectorNotFoundException;
import com.ryuqq.connector.core.exception.ErrorCategory;
import com.ryuqq.connector.core.exception.UnknownAdapterKindException;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorMetadata;
import com.ryuqq.connector.core.spi.Connector;
import com.ryuqq.connector.core.spi.ConnectorConfigStore;
import com.ryuqq.connector.testkit.support.ConnectorConfigFixtures;
import com.ryuqq.connector.testkit.support.MutableClock;
import com.ryuqq.connector.testkit.support.RecordingConnector;
import com.ryuqq.connector.testkit.support.RecordingConnectorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * ConnectorRegistry 유닛 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConnectorRegistryTest {

    private static final String TENANT = ConnectorConfigFixtures.TENANT;
    private static final String STORE = ConnectorConfigFixtures.STORE;

    @Mock
    private ConnectorConfigStore failingStore;

    private MutableClock clock;
    private InMemoryConnectorConfigStore store;
    private RecordingConnectorFactory factory;
    private ConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
        store = new InMemoryConnectorConfigStore();
        factory = new RecordingConnectorFactory();
        registry = newRegistry(new ConnectorRegistryConfig().withCleanupInterval(Duration.ofHours(1)));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private ConnectorRegistry newRegistry(ConnectorRegistryConfig config) {
        ConnectorRegistry created = new ConnectorRegistry(store, config, clock);
        created.registerFactory(ConnectorConfigFixtures.RECORDING, factory);
        return created;
    }

    // ========================================
    // getConnector
    // ========================================

    @Test
    void getConnector_캐시_hit_시_같은_인스턴스_반환() {
        // given
        store.save(ConnectorConfigFixtures.retail());

        // when
        Connector first = registry.getConnector(TENANT, STORE, "retail");
        Connector second = registry.getConnector(TENANT, STORE, "retail");

        // then
        assertThat(second).isSameAs(first);
        assertThat(factory.createCount()).isEqualTo(1);
        RecordingConnector connector = factory.lastCreated();
        assertThat(connector.initializeCount()).isEqualTo(1);
        assertThat(connector.healthCheckCount()).isEqualTo(1);
        assertThat(connector.initializedWith()).isEqualTo(ConnectorConfigFixtures.retail());
        assertThat(registry.isCached(TENANT, STORE, "retail")).isTrue();
    }

    @Test
    void getConnector_설정이_없으면_NotFound() {
        // when & then
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(ConnectorNotFoundException.class)
            .hasMessage("connector not found for tenantId=ikea, storeId=ikea-seattle, domain=retail")
            .satisfies(e -> assertThat(((ConnectorNotFoundException) e).getCategory())
                .isEqualTo(ErrorCategory.NOT_FOUND));
        assertThat(factory.createCount()).isZero();
    }

    @Test
    void getConnector_비활성_설정은_factory를_호출하지_않음() {
        // given
        store.save(ConnectorConfigFixtures.disabled("retail"));

        // when & then
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(ConnectorDisabledException.class)
            .hasMessageContaining("connector is disabled");
        assertThat(factory.createCount()).isZero();
        assertThat(registry.cachedCount()).isZero();
    }

    @Test
    void getConnector_factory가_없으면_UnknownAdapterKind() {
        // given
        store.save(ConnectorConfigFixtures.config(TENANT, STORE, "retail", AdapterKind.of("MissingAdapter")));

        // when & then
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(UnknownAdapterKindException.class)
            .hasMessage("no factory registered for adapter type: MissingAdapter");
    }

    @Test
    void getConnector_factory_실패는_캐시되지_않고_다음_호출에서_재시도() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        factory.failWith(new IllegalStateException("backend misconfigured"));

        // when & then
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(ConnectorInitializationException.class)
            .hasMessageContaining("factory failed: backend misconfigured")
            .satisfies(e -> assertThat(((ConnectorInitializationException) e).getCategory())
                .isEqualTo(ErrorCategory.UNAVAILABLE));
        assertThat(registry.cachedCount()).isZero();

        factory.failWith(null);
        Connector connector = registry.getConnector(TENANT, STORE, "retail");
        assertThat(connector).isNotNull();
        assertThat(factory.createCount()).isEqualTo(2);
    }

    @Test
    void getConnector_initialize_실패_시_생성된_인스턴스를_닫음() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        factory.customize(c -> c.failInitializeWith(new IllegalArgumentException("apiKey is required")));

        // when & then
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(ConnectorInitializationException.class)
            .hasMessageContaining("initialize failed: apiKey is required")
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(factory.lastCreated().closeCount()).isEqualTo(1);
        assertThat(registry.cachedCount()).isZero();
    }

    @Test
    void getConnector_헬스체크_실패해도_캐시됨() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        factory.customize(c -> c.setHealthy(false));

        // when
        Connector connector = registry.getConnector(TENANT, STORE, "retail");

        // then
        assertThat(registry.getConnector(TENANT, STORE, "retail")).isSameAs(connector);
        assertThat(factory.lastCreated().healthCheckCount()).isEqualTo(1);
        assertThat(factory.createCount()).isEqualTo(1);
    }

    @Test
    void getConnector_healthCheckOnCreate가_false면_헬스체크_생략() {
        // given
        registry.close();
        registry = newRegistry(new ConnectorRegistryConfig()
            .withCleanupInterval(Duration.ofHours(1))
            .withHealthCheckOnCreate(false));
        store.save(ConnectorConfigFixtures.retail());

        // when
        registry.getConnector(TENANT, STORE, "retail");

        // then
        assertThat(factory.lastCreated().healthCheckCount()).isZero();
    }

    @Test
    void getConnector_저장소_장애는_ConnectorConfigStoreException으로_변환() {
        // given
        when(failingStore.findOne(anyString(), anyString(), anyString()))
            .thenThrow(new IllegalStateException("connection refused"));
        ConnectorRegistry failing = new ConnectorRegistry(failingStore, new ConnectorRegistryConfig(), clock);

        try {
            // when & then
            assertThatThrownBy(() -> failing.getConnector(TENANT, STORE, "retail"))
                .isInstanceOf(ConnectorConfigStoreException.class)
                .hasMessage("failed to load connector configuration for ikea:ikea-seattle:retail")
                .hasCauseInstanceOf(IllegalStateException.class);
        } finally {
            failing.close();
        }
    }

    @Test
    void getConnector_잘못된_키는_IllegalArgumentException() {
        assertThatThrownBy(() -> registry.getConnector(TENANT, " ", "retail"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("storeId cannot be null or blank");
    }

    // ========================================
    // registerFactory
    // ========================================

    @Test
    void registerFactory_다른_factory로_교체() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        RecordingConnectorFactory replacement = new RecordingConnectorFactory();

        // when
        registry.registerFactory(ConnectorConfigFixtures.RECORDING.getValue(), replacement);
        registry.registerFactory(ConnectorConfigFixtures.RECORDING, replacement);
        registry.getConnector(TENANT, STORE, "retail");

        // then
        assertThat(factory.createCount()).isZero();
        assertThat(replacement.createCount()).isEqualTo(1);
        assertThat(registry.registeredAdapterKinds()).containsExactly(ConnectorConfigFixtures.RECORDING);
    }

    @Test
    void registerFactory_null_거부() {
        assertThatThrownBy(() -> registry.registerFactory(ConnectorConfigFixtures.RECORDING, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("factory cannot be null");
        assertThatThrownBy(() -> registry.registerFactory((AdapterKind) null, factory))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("adapterKind cannot be null");
    }

    // ========================================
    // 무효화 / 만료
    // ========================================

    @Test
    void invalidateCache_커넥터를_닫고_다음_호출에서_새로_생성() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        Connector first = registry.getConnector(TENANT, STORE, "retail");

        // when
        boolean invalidated = registry.invalidateCache(TENANT, STORE, "retail");
        Connector second = registry.getConnector(TENANT, STORE, "retail");

        // then
        assertThat(invalidated).isTrue();
        assertThat(((RecordingConnector) first).closeCount()).isEqualTo(1);
        assertThat(second).isNotSameAs(first);
        assertThat(registry.invalidateCache(TENANT, STORE, "wishlist")).isFalse();
    }

    @Test
    void evictExpired_만료된_항목만_닫고_제거() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        store.save(ConnectorConfigFixtures.wishlist());
        RecordingConnector retail = (RecordingConnector) registry.getConnector(TENANT, STORE, "retail");
        clock.advance(Duration.ofMinutes(40));
        RecordingConnector wishlist = (RecordingConnector) registry.getConnector(TENANT, STORE, "wishlist");
        clock.advance(Duration.ofMinutes(30));

        // when
        int evicted = registry.evictExpired();

        // then
        assertThat(evicted).isEqualTo(1);
        assertThat(retail.closeCount()).isEqualTo(1);
        assertThat(wishlist.closeCount()).isZero();
        assertThat(registry.isCached(TENANT, STORE, "retail")).isFalse();
        assertThat(registry.isCached(TENANT, STORE, "wishlist")).isTrue();
    }

    @Test
    void evictExpired_캐시_hit은_lastAccess를_갱신() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        Connector connector = registry.getConnector(TENANT, STORE, "retail");
        clock.advance(Duration.ofMinutes(50));
        registry.getConnector(TENANT, STORE, "retail");
        clock.advance(Duration.ofMinutes(50));

        // when
        int evicted = registry.evictExpired();

        // then
        assertThat(evicted).isZero();
        assertThat(registry.getConnector(TENANT, STORE, "retail")).isSameAs(connector);
    }

    @Test
    void evictExpired_close_실패해도_나머지를_계속_정리() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        store.save(ConnectorConfigFixtures.wishlist());
        factory.customize(c -> c.failCloseWith(new IllegalStateException("socket already closed")));
        registry.getConnector(TENANT, STORE, "retail");
        registry.getConnector(TENANT, STORE, "wishlist");
        clock.advance(Duration.ofHours(2));

        // when
        int evicted = registry.evictExpired();

        // then
        assertThat(evicted).isEqualTo(2);
        assertThat(registry.cachedCount()).isZero();
        assertThat(factory.created()).allSatisfy(c -> assertThat(c.closeCount()).isEqualTo(1));
    }

    // ========================================
    // 메타데이터
    // ========================================

    @Test
    void getConnectorMetadata_캐시되지_않은_커넥터는_생성하지_않음() {
        // given
        store.save(ConnectorConfigFixtures.retail());

        // when
        ConnectorMetadata metadata = registry.getConnectorMetadata(TENANT, STORE, "retail");

        // then
        assertThat(factory.createCount()).isZero();
        assertThat(metadata.domain()).isEqualTo("retail");
        assertThat(metadata.adapterKind()).isEqualTo("RecordingAdapter");
        assertThat(metadata.url()).isEqualTo("https://ikea-seattle.example.com");
        assertThat(metadata.enabled()).isTrue();
        assertThat(metadata.cached()).isFalse();
        assertThat(metadata.healthy()).isFalse();
        assertThat(metadata.lastChecked()).isNull();
    }

    @Test
    void getConnectorMetadata_캐시된_커넥터는_헬스체크와_마지막_접근_시각_포함() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        registry.getConnector(TENANT, STORE, "retail");
        clock.advance(Duration.ofMinutes(5));
        registry.getConnector(TENANT, STORE, "retail");
        Instant lastAccess = clock.instant();
        clock.advance(Duration.ofMinutes(5));

        // when
        ConnectorMetadata metadata = registry.getConnectorMetadata(TENANT, STORE, "retail");

        // then
        assertThat(metadata.cached()).isTrue();
        assertThat(metadata.healthy()).isTrue();
        assertThat(metadata.lastChecked()).isEqualTo(lastAccess);
        assertThat(metadata.stats()).containsKey("healthChecks");
        assertThat(factory.lastCreated().healthCheckCount()).isEqualTo(2);
    }

    @Test
    void getConnectorMetadata_헬스체크_실패는_healthy_false() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        RecordingConnector connector = (RecordingConnector) registry.getConnector(TENANT, STORE, "retail");
        connector.setHealthy(false);

        // when
        ConnectorMetadata metadata = registry.getConnectorMetadata(TENANT, STORE, "retail");

        // then
        assertThat(metadata.cached()).isTrue();
        assertThat(metadata.healthy()).isFalse();
    }

    @Test
    void getConnectorMetadata_설정이_없으면_NotFound() {
        assertThatThrownBy(() -> registry.getConnectorMetadata(TENANT, STORE, "retail"))
            .isInstanceOf(ConnectorNotFoundException.class);
    }

    @Test
    void listConnectors_캐시_여부와_관계없이_모든_설정을_보고() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        store.save(ConnectorConfigFixtures.disabled("wishlist"));
        store.save(ConnectorConfigFixtures.config(TENANT, "other-store", "retail", ConnectorConfigFixtures.RECORDING));
        registry.getConnector(TENANT, STORE, "retail");

        // when
        List<ConnectorMetadata> connectors = registry.listConnectors(TENANT, STORE);

        // then
        assertThat(connectors).hasSize(2);
        assertThat(connectors).filteredOn(ConnectorMetadata::cached)
            .extracting(ConnectorMetadata::domain)
            .containsExactly("retail");
        assertThat(connectors).filteredOn(m -> !m.enabled())
            .extracting(ConnectorMetadata::domain)
            .containsExactly("wishlist");
        assertThat(factory.createCount()).isEqualTo(1);
    }

    @Test
    void listConnectors_설정이_없으면_빈_목록() {
        assertThat(registry.listConnectors(TENANT, "unknown-store")).isEmpty();
    }

    // ========================================
    // close
    // ========================================

    @Test
    void close_모든_커넥터를_닫고_이후_호출을_거부() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        store.save(ConnectorConfigFixtures.wishlist());
        registry.getConnector(TENANT, STORE, "retail");
        registry.getConnector(TENANT, STORE, "wishlist");

        // when
        registry.close();
        registry.close();

        // then
        assertThat(registry.isClosed()).isTrue();
        assertThat(registry.cachedCount()).isZero();
        assertThat(factory.created()).hasSize(2)
            .allSatisfy(c -> assertThat(c.closeCount()).isEqualTo(1));
        assertThatThrownBy(() -> registry.getConnector(TENANT, STORE, "retail"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("connector registry is closed");
    }

    @Test
    void close_일부_커넥터_close_실패해도_나머지를_닫음() {
        // given
        store.save(ConnectorConfigFixtures.retail());
        store.save(ConnectorConfigFixtures.wishlist());
        RecordingConnector retail = (RecordingConnector) registry.getConnector(TENANT, STORE, "retail");
        retail.failCloseWith(new IllegalStateException("close failed"));
        RecordingConnector wishlist = (RecordingConnector) registry.getConnector(TENANT, STORE, "wishlist");

        // when
        registry.close();

        // then
        assertThat(retail.closeCount()).isEqualTo(1);
        assertThat(wishlist.closeCount()).isEqualTo(1);
    }
}
