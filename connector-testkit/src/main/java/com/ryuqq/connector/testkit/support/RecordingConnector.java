package com.ryuqq.connector.testkit.support;

import com.ryuqq.connector.core.exception.HealthCheckException;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.spi.Connector;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 생명주기 호출 횟수를 기록하는 테스트용 Connector.
 *
 * <p>initialize/healthCheck/close 호출 횟수를 세고,
 * 실패를 주입할 수 있습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RecordingConnector implements Connector {

    private final String domain;
    private final AdapterKind adapterKind;

    private final AtomicInteger initializeCount = new AtomicInteger();
    private final AtomicInteger healthCheckCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicReference<ConnectorConfig> initializedWith = new AtomicReference<>();

    private volatile RuntimeException initializeFailure;
    private volatile RuntimeException closeFailure;
    private volatile boolean healthy = true;

    public RecordingConnector(String domain, AdapterKind adapterKind) {
        this.domain = domain;
        this.adapterKind = adapterKind;
    }

    @Override
    public String getDomain() {
        return domain;
    }

    @Override
    public AdapterKind getAdapterKind() {
        return adapterKind;
    }

    @Override
    public void initialize(ConnectorConfig config) {
        initializeCount.incrementAndGet();
        initializedWith.set(config);
        RuntimeException failure = initializeFailure;
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void healthCheck() {
        healthCheckCount.incrementAndGet();
        if (!healthy) {
            throw new HealthCheckException("recording connector marked unhealthy");
        }
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        RuntimeException failure = closeFailure;
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public Map<String, Long> stats() {
        return Map.of(
            "healthChecks", (long) healthCheckCount.get(),
            "closes", (long) closeCount.get()
        );
    }

    public RecordingConnector failInitializeWith(RuntimeException failure) {
        this.initializeFailure = failure;
        return this;
    }

    public RecordingConnector failCloseWith(RuntimeException failure) {
        this.closeFailure = failure;
        return this;
    }

    public RecordingConnector setHealthy(boolean healthy) {
        this.healthy = healthy;
        return this;
    }

    public int initializeCount() {
        return initializeCount.get();
    }

    public int healthCheckCount() {
        return healthCheckCount.get();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public ConnectorConfig initializedWith() {
        return initializedWith.get();
    }
}
