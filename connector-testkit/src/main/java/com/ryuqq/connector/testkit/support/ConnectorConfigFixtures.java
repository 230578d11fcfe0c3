package com.ryuqq.connector.testkit.support;

import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;

import java.time.Duration;
import java.util.Map;

/**
 * 테스트용 ConnectorConfig 생성 헬퍼.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class ConnectorConfigFixtures {

    public static final String TENANT = "ikea";
    public static final String STORE = "ikea-seattle";
    public static final AdapterKind RECORDING = AdapterKind.of("RecordingAdapter");

    private ConnectorConfigFixtures() {
    }

    public static ConnectorConfig config(String tenantId, String storeId, String domain, AdapterKind kind) {
        return new ConnectorConfig(
            storeId,
            tenantId,
            domain,
            "https://" + storeId + ".example.com",
            kind,
            "1.0.0",
            Map.of("demoMode", true),
            true,
            Duration.ofSeconds(30),
            1
        );
    }

    public static ConnectorConfig retail() {
        return config(TENANT, STORE, "retail", RECORDING);
    }

    public static ConnectorConfig wishlist() {
        return config(TENANT, STORE, "wishlist", RECORDING);
    }

    public static ConnectorConfig disabled(String domain) {
        return config(TENANT, STORE, domain, RECORDING).withEnabled(false);
    }
}
