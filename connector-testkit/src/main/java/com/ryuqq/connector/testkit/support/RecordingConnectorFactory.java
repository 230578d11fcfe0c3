package com.ryuqq.connector.testkit.support;

import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.spi.ConnectorFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 생성 횟수와 생성된 인스턴스를 기록하는 테스트용 Factory.
 *
 * <p>{@link #blockUntil(CountDownLatch)}로 생성을 지연시켜
 * 동시 생성(single-flight) 시나리오를 재현할 수 있습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RecordingConnectorFactory implements ConnectorFactory {

    private final AtomicInteger createCount = new AtomicInteger();
    private final List<RecordingConnector> created = new CopyOnWriteArrayList<>();

    private volatile CountDownLatch gate;
    private volatile RuntimeException failure;
    private volatile Consumer<RecordingConnector> customizer = connector -> { };

    @Override
    public RecordingConnector create(ConnectorConfig config) {
        createCount.incrementAndGet();
        awaitGate();
        RuntimeException currentFailure = failure;
        if (currentFailure != null) {
            throw currentFailure;
        }
        RecordingConnector connector = new RecordingConnector(config.domain(), config.adapterKind());
        customizer.accept(connector);
        created.add(connector);
        return connector;
    }

    private void awaitGate() {
        CountDownLatch currentGate = gate;
        if (currentGate == null) {
            return;
        }
        try {
            if (!currentGate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("factory gate was not released within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for factory gate", e);
        }
    }

    /**
     * gate가 열릴 때까지 생성을 지연.
     */
    public RecordingConnectorFactory blockUntil(CountDownLatch gate) {
        this.gate = gate;
        return this;
    }

    public RecordingConnectorFactory failWith(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    /**
     * 생성된 Connector에 적용할 설정 (예: 헬스체크 실패 주입).
     */
    public RecordingConnectorFactory customize(Consumer<RecordingConnector> customizer) {
        this.customizer = customizer == null ? connector -> { } : customizer;
        return this;
    }

    public int createCount() {
        return createCount.get();
    }

    public List<RecordingConnector> created() {
        return List.copyOf(created);
    }

    public RecordingConnector lastCreated() {
        if (created.isEmpty()) {
            throw new IllegalStateException("no connector created yet");
        }
        return created.get(created.size() - 1);
    }
}
