package com.ryuqq.connector.application.registry;

import com.ryuqq.connector.core.capability.Capabilities;
import com.ryuqq.connector.core.exception.ConnectorConfigStoreException;
import com.ryuqq.connector.core.exception.ConnectorDisabledException;
import com.ryuqq.connector.core.exception.ConnectorException;
import com.ryuqq.connector.core.exception.ConnectorInitializationException;
import com.ryuqq.connector.core.exception.ConnectorNotFoundException;
import com.ryuqq.connector.core.exception.UnknownAdapterKindException;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.model.ConnectorKey;
import com.ryuqq.connector.core.model.ConnectorMetadata;
import com.ryuqq.connector.core.spi.Connector;
import com.ryuqq.connector.core.spi.ConnectorConfigStore;
import com.ryuqq.connector.core.spi.ConnectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Connector Registry.
 *
 * <p>(tenantId, storeId, domain) 단위로 커넥터를 해석하고, 생성된 인스턴스를 캐시합니다.</p>
 *
 * <p><strong>해석 흐름:</strong></p>
 * <pre>
 * 1. 캐시 조회 (read lock) → hit 이면 lastAccess 갱신 후 반환
 * 2. miss 이면 key 단위 single-flight 등록
 *    - 이미 생성 중인 요청이 있으면 그 결과를 대기
 * 3. ConnectorConfigStore.findOne() → 없으면 ConnectorNotFoundException
 * 4. enabled=false → ConnectorDisabledException (factory 호출 안 함)
 * 5. adapterKind의 factory 조회 → 없으면 UnknownAdapterKindException
 * 6. factory.create() → initialize() → (옵션) healthCheck()
 * 7. 캐시 등록 (write lock)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>캐시 hit 은 공유 read lock 만 사용</li>
 *   <li>같은 key 의 동시 miss 는 factory 를 정확히 한 번 호출</li>
 *   <li>서로 다른 key 의 생성은 서로를 기다리지 않음</li>
 *   <li>생성 실패는 캐시되지 않으며 대기 중인 모든 호출자가 같은 예외를 받음</li>
 * </ul>
 *
 * <p>만료된 커넥터는 {@link ExpiredConnectorSweeper}가 주기적으로 정리합니다.
 * {@link #close()} 는 정리 작업을 멈추고 캐시된 모든 커넥터를 닫습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class ConnectorRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final ConnectorConfigStore store;
    private final ConnectorRegistryConfig config;
    private final Clock clock;

    private final ConcurrentMap<AdapterKind, ConnectorFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, CacheEntry> cache = new HashMap<>();
    private final ReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ConcurrentMap<String, CompletableFuture<Connector>> inFlight = new ConcurrentHashMap<>();

    private final ExpiredConnectorSweeper sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 기본 설정으로 생성.
     *
     * @param store 커넥터 설정 저장소
     */
    public ConnectorRegistry(ConnectorConfigStore store) {
        this(store, new ConnectorRegistryConfig());
    }

    public ConnectorRegistry(ConnectorConfigStore store, ConnectorRegistryConfig config) {
        this(store, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * <p>생성과 동시에 만료 커넥터 정리 작업을 시작합니다.</p>
     *
     * @param store 커넥터 설정 저장소
     * @param config 레지스트리 설정
     * @param clock 마지막 접근 시각 기록용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConnectorRegistry(ConnectorConfigStore store, ConnectorRegistryConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.sweeper = new ExpiredConnectorSweeper(this::evictExpired, config.cleanupInterval());
        this.sweeper.start();
    }

    // ========================================
    // Factory 등록
    // ========================================

    /**
     * 어댑터 종류에 대한 factory 등록.
     *
     * <p>같은 factory 를 다시 등록하면 아무 일도 일어나지 않습니다.
     * 다른 factory 로 등록하면 기존 factory 를 교체하고 경고를 남깁니다.</p>
     *
     * @param adapterKind 어댑터 종류
     * @param factory 커넥터 factory
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public void registerFactory(AdapterKind adapterKind, ConnectorFactory factory) {
        if (adapterKind == null) {
            throw new IllegalArgumentException("adapterKind cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        ConnectorFactory previous = factories.put(adapterKind, factory);
        if (previous == null) {
            log.info("Registered connector factory: adapter={}", adapterKind.getValue());
        } else if (previous != factory) {
            log.warn("Replaced connector factory: adapter={}", adapterKind.getValue());
        }
    }

    public void registerFactory(String adapterKind, ConnectorFactory factory) {
        registerFactory(AdapterKind.of(adapterKind), factory);
    }

    public Set<AdapterKind> registeredAdapterKinds() {
        return Set.copyOf(factories.keySet());
    }

    // ========================================
    // 커넥터 해석
    // ========================================

    /**
     * 커넥터 조회 (없으면 생성 후 캐시).
     *
     * @param tenantId 테넌트 ID
     * @param storeId 스토어 ID
     * @param domain 도메인
     * @return 초기화된 커넥터
     * @throws ConnectorNotFoundException 설정이 없는 경우
     * @throws ConnectorDisabledException 설정이 비활성화된 경우
     * @throws UnknownAdapterKindException factory 가 등록되지 않은 경우
     * @throws ConnectorInitializationException 생성 또는 초기화 실패 시
     * @throws ConnectorConfigStoreException 설정 저장소 조회 실패 시
     * @throws IllegalStateException 레지스트리가 닫힌 경우
     */
    public Connector getConnector(String tenantId, String storeId, String domain) {
        ensureOpen();
        ConnectorKey key = ConnectorKey.of(tenantId, storeId, domain);
        String cacheKey = key.cacheKey();

        Connector cached = lookup(cacheKey);
        if (cached != null) {
            log.debug("Connector cache hit: {}", cacheKey);
            return cached;
        }
        log.debug("Connector cache miss: {}", cacheKey);

        CompletableFuture<Connector> pending = new CompletableFuture<>();
        CompletableFuture<Connector> existing = inFlight.putIfAbsent(cacheKey, pending);
        if (existing != null) {
            return await(key, existing);
        }

        try {
            // 앞선 생성이 방금 끝났을 수 있으므로 다시 확인
            Connector connector = lookup(cacheKey);
            if (connector == null) {
                connector = construct(key);
            }
            pending.complete(connector);
            return connector;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(cacheKey, pending);
        }
    }

    /**
     * 커넥터를 조회하고 capability 로 변환.
     *
     * @param capability 필요한 capability 타입 (예: RetailConnector.class)
     * @return capability 로 변환된 커넥터
     * @throws UnsupportedOperationException 커넥터가 capability 를 지원하지 않는 경우
     */
    public <T extends Connector> T getConnector(String tenantId, String storeId, String domain, Class<T> capability) {
        return Capabilities.require(getConnector(tenantId, storeId, domain), capability);
    }

    private Connector await(ConnectorKey key, CompletableFuture<Connector> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorInitializationException(key, "interrupted while waiting for connector construction", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ConnectorInitializationException(key, String.valueOf(cause), cause);
        }
    }

    private Connector construct(ConnectorKey key) {
        ConnectorConfig connectorConfig = loadConfig(key);
        if (!connectorConfig.enabled()) {
            throw new ConnectorDisabledException(key);
        }
        AdapterKind adapterKind = connectorConfig.adapterKind();
        ConnectorFactory factory = factories.get(adapterKind);
        if (factory == null) {
            throw new UnknownAdapterKindException(adapterKind);
        }

        Connector connector = createAndInitialize(key, factory, connectorConfig);
        if (config.healthCheckOnCreate()) {
            checkHealthOnCreate(key, connector);
        }

        String cacheKey = key.cacheKey();
        boolean rejected;
        cacheLock.writeLock().lock();
        try {
            rejected = closed.get();
            if (!rejected) {
                cache.put(cacheKey, new CacheEntry(connector, clock.instant()));
            }
        } finally {
            cacheLock.writeLock().unlock();
        }
        if (rejected) {
            closeConnector(cacheKey, connector);
            throw new IllegalStateException("connector registry is closed");
        }

        log.info("Connector initialized and cached: {} (adapter={}, version={})",
            cacheKey, adapterKind.getValue(), connectorConfig.version());
        return connector;
    }

    private Connector createAndInitialize(ConnectorKey key, ConnectorFactory factory, ConnectorConfig connectorConfig) {
        Connector connector;
        try {
            connector = factory.create(connectorConfig);
        } catch (ConnectorInitializationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectorInitializationException(key, "factory failed: " + e.getMessage(), e);
        }
        if (connector == null) {
            throw new ConnectorInitializationException(key, "factory returned null", null);
        }

        try {
            connector.initialize(connectorConfig);
        } catch (RuntimeException e) {
            closeConnector(key.cacheKey(), connector);
            throw new ConnectorInitializationException(key, "initialize failed: " + e.getMessage(), e);
        }
        return connector;
    }

    private void checkHealthOnCreate(ConnectorKey key, Connector connector) {
        try {
            connector.healthCheck();
        } catch (RuntimeException e) {
            log.warn("Health check failed on connector creation (caching anyway): {} - {}",
                key.cacheKey(), e.getMessage());
        }
    }

    private ConnectorConfig loadConfig(ConnectorKey key) {
        try {
            return store.findOne(key.getTenantId(), key.getStoreId(), key.getDomain())
                .orElseThrow(() -> new ConnectorNotFoundException(key));
        } catch (ConnectorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectorConfigStoreException(
                "failed to load connector configuration for " + key.cacheKey(), e
            );
        }
    }

    private List<ConnectorConfig> loadConfigs(String tenantId, String storeId) {
        try {
            return store.findAll(tenantId, storeId);
        } catch (ConnectorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectorConfigStoreException(
                "failed to list connector configurations for tenantId=" + tenantId + ", storeId=" + storeId, e
            );
        }
    }

    // ========================================
    // 조회 (메타데이터)
    // ========================================

    /**
     * 커넥터 메타데이터 조회 (생성하지 않음).
     *
     * <p>캐시된 커넥터는 헬스체크를 수행하여 healthy 를 채우고,
     * lastChecked 에 마지막 접근 시각을 기록합니다.</p>
     *
     * @throws ConnectorNotFoundException 설정이 없는 경우
     */
    public ConnectorMetadata getConnectorMetadata(String tenantId, String storeId, String domain) {
        ConnectorKey key = ConnectorKey.of(tenantId, storeId, domain);
        return metadataFor(loadConfig(key));
    }

    /**
     * (tenantId, storeId)의 모든 커넥터 메타데이터.
     *
     * <p>캐시되지 않은 커넥터는 생성하지 않습니다. 개별 항목 처리에 실패하면
     * 경고를 남기고 해당 항목만 건너뜁니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param storeId 스토어 ID
     * @return 메타데이터 목록
     */
    public List<ConnectorMetadata> listConnectors(String tenantId, String storeId) {
        List<ConnectorConfig> configs = loadConfigs(tenantId, storeId);
        List<ConnectorMetadata> result = new ArrayList<>(configs.size());
        for (ConnectorConfig connectorConfig : configs) {
            try {
                result.add(metadataFor(connectorConfig));
            } catch (RuntimeException e) {
                log.warn("Failed to describe connector {}:{}:{} - {}",
                    tenantId, storeId, connectorConfig.domain(), e.getMessage());
            }
        }
        return result;
    }

    private ConnectorMetadata metadataFor(ConnectorConfig connectorConfig) {
        String cacheKey = connectorConfig.key().cacheKey();
        CacheEntry entry = peek(cacheKey);
        if (entry == null) {
            return ConnectorMetadata.uncached(connectorConfig);
        }
        boolean healthy = isHealthy(cacheKey, entry.connector);
        return new ConnectorMetadata(
            connectorConfig.domain(),
            connectorConfig.adapterKind().getValue(),
            connectorConfig.version(),
            connectorConfig.url(),
            connectorConfig.enabled(),
            healthy,
            true,
            entry.lastAccess,
            entry.connector.stats()
        );
    }

    private boolean isHealthy(String cacheKey, Connector connector) {
        try {
            connector.healthCheck();
            return true;
        } catch (RuntimeException e) {
            log.warn("Health check failed for cached connector {}: {}", cacheKey, e.getMessage());
            return false;
        }
    }

    public boolean isCached(String tenantId, String storeId, String domain) {
        return peek(ConnectorKey.of(tenantId, storeId, domain).cacheKey()) != null;
    }

    public int cachedCount() {
        cacheLock.readLock().lock();
        try {
            return cache.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    // ========================================
    // 캐시 무효화 / 만료 정리
    // ========================================

    /**
     * 캐시된 커넥터 하나를 제거하고 닫습니다.
     *
     * @return 제거된 항목이 있었으면 true
     */
    public boolean invalidateCache(String tenantId, String storeId, String domain) {
        String cacheKey = ConnectorKey.of(tenantId, storeId, domain).cacheKey();
        CacheEntry removed;
        cacheLock.writeLock().lock();
        try {
            removed = cache.remove(cacheKey);
        } finally {
            cacheLock.writeLock().unlock();
        }
        if (removed == null) {
            return false;
        }
        closeConnector(cacheKey, removed.connector);
        log.info("Invalidated connector cache: {}", cacheKey);
        return true;
    }

    /**
     * 마지막 접근 이후 cacheExpiration 이 지난 커넥터를 제거하고 닫습니다.
     *
     * <p>{@link ExpiredConnectorSweeper}가 주기적으로 호출합니다.</p>
     *
     * @return 제거된 커넥터 수
     */
    public int evictExpired() {
        Instant threshold = clock.instant().minus(config.cacheExpiration());
        Map<String, CacheEntry> expired = new HashMap<>();
        cacheLock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> iterator = cache.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, CacheEntry> entry = iterator.next();
                if (entry.getValue().lastAccess.isBefore(threshold)) {
                    expired.put(entry.getKey(), entry.getValue());
                    iterator.remove();
                }
            }
        } finally {
            cacheLock.writeLock().unlock();
        }

        for (Map.Entry<String, CacheEntry> entry : expired.entrySet()) {
            closeConnector(entry.getKey(), entry.getValue().connector);
            log.info("Evicted expired connector: {} (lastAccess={})", entry.getKey(), entry.getValue().lastAccess);
        }
        return expired.size();
    }

    // ========================================
    // 종료
    // ========================================

    /**
     * 정리 작업을 멈추고 캐시된 모든 커넥터를 닫습니다.
     *
     * <p>여러 번 호출해도 한 번만 수행됩니다.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweeper.stop();

        Map<String, CacheEntry> snapshot;
        cacheLock.writeLock().lock();
        try {
            snapshot = new HashMap<>(cache);
            cache.clear();
        } finally {
            cacheLock.writeLock().unlock();
        }

        for (Map.Entry<String, CacheEntry> entry : snapshot.entrySet()) {
            closeConnector(entry.getKey(), entry.getValue().connector);
        }
        log.info("Connector registry closed: {} connectors released", snapshot.size());
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ========================================
    // 내부 헬퍼
    // ========================================

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("connector registry is closed");
        }
    }

    /**
     * 캐시 조회 + lastAccess 갱신.
     */
    private Connector lookup(String cacheKey) {
        cacheLock.readLock().lock();
        try {
            CacheEntry entry = cache.get(cacheKey);
            if (entry == null) {
                return null;
            }
            entry.lastAccess = clock.instant();
            return entry.connector;
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    private CacheEntry peek(String cacheKey) {
        cacheLock.readLock().lock();
        try {
            return cache.get(cacheKey);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    private void closeConnector(String cacheKey, Connector connector) {
        try {
            connector.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close connector {}", cacheKey, e);
        }
    }

    /**
     * 캐시 항목. lastAccess 는 read lock 아래에서 갱신되므로 volatile.
     */
    private static final class CacheEntry {

        private final Connector connector;
        private volatile Instant lastAccess;

        private CacheEntry(Connector connector, Instant lastAccess) {
            this.connector = connector;
            this.lastAccess = lastAccess;
        }
    }
}
