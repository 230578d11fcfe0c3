package com.ryuqq.connector.adapter.inmemory.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;

import java.time.Duration;
import java.util.Map;

/**
 * 커넥터 설정 JSON 문서.
 *
 * <p>{@code timeout}은 밀리초 단위이며, {@code enabled}가 없으면 활성화로 간주합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ConnectorConfigDocument(
    @JsonProperty("storeId") String storeId,
    @JsonProperty("tenantId") String tenantId,
    @JsonProperty("domain") String domain,
    @JsonProperty("url") String url,
    @JsonProperty("adapter") String adapter,
    @JsonProperty("version") String version,
    @JsonProperty("config") Map<String, Object> config,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("timeout") long timeout,
    @JsonProperty("priority") int priority
) {

    ConnectorConfig toConnectorConfig() {
        return new ConnectorConfig(
            storeId,
            tenantId,
            domain,
            url,
            AdapterKind.of(adapter),
            version,
            config,
            enabled == null || enabled,
            Duration.ofMillis(timeout),
            priority
        );
    }
}
