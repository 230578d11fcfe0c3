package com.ryuqq.connector.application.registry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConnectorRegistryConfig 유닛 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class ConnectorRegistryConfigTest {

    @Test
    void 기본값() {
        ConnectorRegistryConfig config = new ConnectorRegistryConfig();

        assertThat(config.cacheExpiration()).isEqualTo(Duration.ofHours(1));
        assertThat(config.cleanupInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.healthCheckOnCreate()).isTrue();
    }

    @Test
    void withX_나머지_값은_유지() {
        ConnectorRegistryConfig config = new ConnectorRegistryConfig()
            .withCacheExpiration(Duration.ofMinutes(10))
            .withHealthCheckOnCreate(false);

        assertThat(config.cacheExpiration()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.cleanupInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.healthCheckOnCreate()).isFalse();
    }

    @Test
    void 유효성_검증() {
        assertThatThrownBy(() -> new ConnectorRegistryConfig(null, Duration.ofMinutes(1), true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("cacheExpiration cannot be null");
        assertThatThrownBy(() -> new ConnectorRegistryConfig().withCacheExpiration(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("cacheExpiration must be positive (current: PT-1S)");
        assertThatThrownBy(() -> new ConnectorRegistryConfig().withCleanupInterval(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("cleanupInterval must be positive (current: PT0S)");
    }
}
