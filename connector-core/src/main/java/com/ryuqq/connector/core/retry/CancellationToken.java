package com.ryuqq.connector.core.retry;

import com.ryuqq.connector.core.exception.RetryCancelledException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 호출자가 전달하는 취소/타임아웃 신호.
 *
 * <p>재시도 대기 등 블로킹 구간은 이 토큰을 확인하여, 취소되면 즉시 대기를 중단하고
 * 타입이 있는 예외로 변환합니다.</p>
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(2));
 * retryExecutor.execute(call, token);   // 2초가 지나면 RetryCancelledException
 *
 * CancellationToken manual = CancellationToken.create();
 * // 다른 스레드에서
 * manual.cancel();
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false, 0L, false);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final boolean cancellable;

    private CancellationToken(boolean hasDeadline, long deadlineNanos, boolean cancellable) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
        this.cancellable = cancellable;
    }

    /**
     * 절대 취소되지 않는 토큰.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * {@link #cancel()}로만 취소되는 토큰.
     */
    public static CancellationToken create() {
        return new CancellationToken(false, 0L, true);
    }

    /**
     * 지정 시간 경과 또는 {@link #cancel()} 시 취소되는 토큰.
     *
     * @param timeout 타임아웃 (양수)
     * @return CancellationToken
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        return new CancellationToken(true, System.nanoTime() + timeout.toNanos(), true);
    }

    /**
     * 토큰 취소. 대기 중인 모든 스레드가 즉시 깨어납니다.
     *
     * @throws IllegalStateException {@link #none()} 토큰인 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("CancellationToken.none() cannot be cancelled");
        }
        cancelled.countDown();
        for (Runnable callback : cancelCallbacks) {
            runOnce(callback);
        }
    }

    /**
     * {@link #cancel()} 시 실행할 콜백 등록. 이미 취소된 경우 즉시 실행합니다.
     *
     * <p>타임아웃 경과는 콜백을 실행하지 않으므로, 대기하는 쪽은 {@link #remaining()}으로
     * 대기 시간을 제한해야 합니다.</p>
     *
     * @param callback 취소 시 실행할 작업
     * @return 등록 해제 작업 (호출 완료 후 반드시 실행)
     */
    public Runnable onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (!cancellable) {
            return () -> { };
        }
        cancelCallbacks.add(callback);
        if (cancelled.getCount() == 0) {
            runOnce(callback);
        }
        return () -> cancelCallbacks.remove(callback);
    }

    private void runOnce(Runnable callback) {
        if (cancelCallbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * 취소될 수 있는 토큰인지 여부 ({@link #none()}만 false).
     */
    public boolean isCancellable() {
        return cancellable;
    }

    /**
     * 타임아웃까지 남은 시간.
     *
     * @return 남은 시간 (경과 시 0, 타임아웃이 없으면 empty)
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(deadlineNanos - System.nanoTime(), 0L)));
    }

    /**
     * 취소 여부 (명시적 취소 또는 타임아웃 경과).
     */
    public boolean isCancelled() {
        return cancelled.getCount() == 0 || deadlinePassed();
    }

    /**
     * 취소되었으면 시도 전 취소로 {@link RetryCancelledException}을 던집니다.
     *
     * @throws RetryCancelledException 이미 취소된 경우
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RetryCancelledException(0, null);
        }
    }

    /**
     * 최대 {@code maxWait} 동안 취소를 기다립니다.
     *
     * @param maxWait 최대 대기 시간
     * @return 대기 중 (또는 이미) 취소되었으면 true, 시간이 다 되었으면 false
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean awaitCancellation(Duration maxWait) throws InterruptedException {
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative (current: " + maxWait + ")");
        }
        if (isCancelled()) {
            return true;
        }
        long waitNanos = maxWait.toNanos();
        if (hasDeadline) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= waitNanos) {
                cancelled.await(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
                return true;
            }
        }
        return cancelled.await(waitNanos, TimeUnit.NANOSECONDS);
    }

    private boolean deadlinePassed() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    @Override
    public String toString() {
        if (this == NONE) {
            return "CancellationToken{none}";
        }
        return "CancellationToken{cancelled=" + isCancelled() + ", deadline=" + hasDeadline + '}';
    }
}
