package com.ryuqq.connector.adapter.inmemory.store;

import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.model.ConnectorKey;
import com.ryuqq.connector.core.spi.ConnectorConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ConnectorConfigStore} SPI for testing and reference purposes.
 *
 * <p>설정은 {@link ConnectorKey}로 색인된 {@link ConcurrentHashMap}에 저장되며,
 * 같은 키로 다시 저장하면 이전 설정을 대체합니다.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>findOne:</strong> O(1) - 키 조회</li>
 *   <li><strong>findAll:</strong> O(N) - 전체 스캔 후 priority, domain 순 정렬</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;ConnectorConfig&gt; configs = new JsonConnectorConfigLoader().loadResource("connectors.json");
 * ConnectorConfigStore store = new InMemoryConnectorConfigStore(configs);
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemoryConnectorConfigStore implements ConnectorConfigStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectorConfigStore.class);

    private static final Comparator<ConnectorConfig> LISTING_ORDER =
        Comparator.comparingInt(ConnectorConfig::priority).thenComparing(ConnectorConfig::domain);

    private final ConcurrentHashMap<ConnectorKey, ConnectorConfig> configs = new ConcurrentHashMap<>();

    /**
     * Creates a new store with empty storage.
     */
    public InMemoryConnectorConfigStore() {
    }

    /**
     * 주어진 설정으로 채운 저장소 생성.
     *
     * @param initial 초기 설정 목록
     */
    public InMemoryConnectorConfigStore(Collection<ConnectorConfig> initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        initial.forEach(this::save);
    }

    /**
     * 설정 저장 (같은 키가 있으면 대체).
     *
     * @param config 커넥터 설정
     */
    public void save(ConnectorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ConnectorConfig previous = configs.put(config.key(), config);
        if (previous != null) {
            log.debug("Replaced connector configuration: key={}", config.key().cacheKey());
        }
    }

    /**
     * 설정 삭제.
     *
     * @param key 커넥터 키
     * @return 삭제되었으면 true
     */
    public boolean remove(ConnectorKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return configs.remove(key) != null;
    }

    public int size() {
        return configs.size();
    }

    @Override
    public Optional<ConnectorConfig> findOne(String tenantId, String storeId, String domain) {
        return Optional.ofNullable(configs.get(ConnectorKey.of(tenantId, storeId, domain)));
    }

    @Override
    public List<ConnectorConfig> findAll(String tenantId, String storeId) {
        if (tenantId == null || storeId == null) {
            throw new IllegalArgumentException("tenantId and storeId cannot be null");
        }
        return configs.values().stream()
            .filter(config -> tenantId.equals(config.tenantId()) && storeId.equals(config.storeId()))
            .sorted(LISTING_ORDER)
            .collect(Collectors.toList());
    }
}
