package com.ryuqq.connector.application.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;

/**
 * 만료 커넥터 정리 작업.
 *
 * <p>고정 주기로 evict 작업을 실행합니다. 한 번의 정리가 실패해도
 * 예외를 로깅하고 다음 주기에 다시 시도합니다.</p>
 *
 * <p>스케줄러 스레드는 daemon 스레드이므로 JVM 종료를 막지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class ExpiredConnectorSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredConnectorSweeper.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final IntSupplier evictTask;
    private final Duration interval;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param evictTask 만료 항목을 정리하고 정리 건수를 반환하는 작업
     * @param interval 실행 주기
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public ExpiredConnectorSweeper(IntSupplier evictTask, Duration interval) {
        if (evictTask == null) {
            throw new IllegalArgumentException("evictTask cannot be null");
        }
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        this.evictTask = evictTask;
        this.interval = interval;
    }

    /**
     * 주기 실행 시작. 두 번째 호출부터는 무시됩니다.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "connector-registry-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        executor.scheduleWithFixedDelay(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        this.scheduler = executor;
        log.debug("Expired connector sweeper started: interval={}", interval);
    }

    /**
     * 정리 1회 실행.
     *
     * @return 정리된 커넥터 수 (실패 시 0)
     */
    public int sweep() {
        try {
            int evicted = evictTask.getAsInt();
            if (evicted > 0) {
                log.info("Expired connector sweep completed: {} evicted", evicted);
            }
            return evicted;
        } catch (RuntimeException e) {
            log.error("Expired connector sweep failed", e);
            return 0;
        }
    }

    /**
     * 주기 실행 중지.
     *
     * <p>실행 중인 정리 작업이 끝날 때까지 잠시 기다린 후 강제 종료합니다.</p>
     */
    public void stop() {
        ScheduledExecutorService executor = scheduler;
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Expired connector sweeper stopped");
    }

    public boolean isRunning() {
        ScheduledExecutorService executor = scheduler;
        return executor != null && !executor.isShutdown();
    }
}
