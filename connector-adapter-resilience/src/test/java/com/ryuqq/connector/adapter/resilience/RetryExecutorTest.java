package com.ryuqq.connector.adapter.resilience;

import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.RetryCancelledException;
import com.ryuqq.connector.core.exception.RetryExhaustedException;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.retry.RetryPolicy;
import com.ryuqq.connector.core.retry.RetryableErrors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * RetryExecutor 유닛 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class RetryExecutorTest {

    private final AtomicInteger attempts = new AtomicInteger();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryPolicy fastPolicy() {
        return new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(50), 2.0, RetryableErrors.all());
    }

    // ============================================================
    // 1. 성공 / 재시도
    // ============================================================

    @Test
    void execute_첫_시도에_성공하면_재시도하지_않음() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());

        // when
        String result = executor.execute(() -> {
            attempts.incrementAndGet();
            return "ok";
        });

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_일시적_실패_후_성공하면_결과_반환() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());

        // when
        String result = executor.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "recovered";
        });

        // then
        assertThat(result).isEqualTo("recovered");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void execute_기본_정책은_두_번_실패_후_300ms_이상_대기하고_성공() {
        // given
        RetryExecutor executor = new RetryExecutor(new RetryPolicy());
        long started = System.nanoTime();

        // when
        String result = executor.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            return "recovered";
        });

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(result).isEqualTo("recovered");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
    }

    @Test
    void execute_기본_정책은_100ms_200ms_대기_후_소진됨() {
        // given
        RetryExecutor executor = new RetryExecutor(new RetryPolicy());
        long started = System.nanoTime();

        // when
        Throwable thrown = catchThrowable(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("service unavailable");
        }));

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(thrown)
            .isInstanceOf(RetryExhaustedException.class)
            .hasMessageContaining("max retry attempts (3) exceeded")
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(((RetryExhaustedException) thrown).getAttempts()).isEqualTo(3);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(300);
    }

    // ============================================================
    // 2. 재시도 불가 예외
    // ============================================================

    @Test
    void execute_재시도_불가_예외는_한_번만_시도하고_그대로_전파() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy().withRetryableErrors(RetryableErrors.none()));
        IllegalArgumentException failure = new IllegalArgumentException("bad request");

        // when & then
        assertThatThrownBy(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw failure;
        })).isSameAs(failure);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_재시도_불가_checked_예외는_BackendCallException으로_감쌈() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy().withRetryableErrors(RetryableErrors.none()));

        // when & then
        assertThatThrownBy(() -> executor.execute(() -> {
            throw new IOException("disk full");
        }))
            .isInstanceOf(BackendCallException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void execute_transientErrors_정책은_404를_재시도하지_않음() {
        // given
        RetryExecutor executor = new RetryExecutor(
            fastPolicy().withRetryableErrors(RetryableErrors.transientErrors()));

        // when & then
        assertThatThrownBy(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw BackendCallException.ofStatus("getProduct", 404, "not found");
        })).isInstanceOf(BackendCallException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    // ============================================================
    // 3. 취소 / 인터럽트
    // ============================================================

    @Test
    void execute_이미_취소된_토큰이면_호출하지_않음() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());
        CancellationToken token = CancellationToken.create();
        token.cancel();

        // when & then
        assertThatThrownBy(() -> executor.execute(() -> attempts.incrementAndGet(), token))
            .isInstanceOf(RetryCancelledException.class);
        assertThat(attempts.get()).isZero();
    }

    @Test
    void execute_대기_중_타임아웃되면_즉시_RetryCancelledException() {
        // given
        RetryExecutor executor = new RetryExecutor(
            new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(5), 2.0, RetryableErrors.all()));
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(100));
        long started = System.nanoTime();

        // when
        Throwable thrown = catchThrowable(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new IOException("timeout");
        }, token));

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(thrown)
            .isInstanceOf(RetryCancelledException.class)
            .hasCauseInstanceOf(IOException.class);
        assertThat(((RetryCancelledException) thrown).getAttempts()).isEqualTo(1);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(elapsedMs).isLessThan(1500);
    }

    @Test
    void execute_인터럽트되면_플래그를_복원하고_RetryCancelledException() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());
        Thread.currentThread().interrupt();

        // when
        Throwable thrown = catchThrowable(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new IOException("connection reset");
        }));

        // then
        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_호출이_InterruptedException을_던지면_재시도하지_않음() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());

        // when & then
        assertThatThrownBy(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            throw new InterruptedException("shutdown");
        })).isInstanceOf(RetryCancelledException.class);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void execute_진행_중인_호출도_타임아웃되면_즉시_RetryCancelledException() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(200));
        AtomicBoolean callInterrupted = new AtomicBoolean();
        CountDownLatch callFinished = new CountDownLatch(1);
        long started = System.nanoTime();

        // when
        Throwable thrown = catchThrowable(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(1500);
                return "late";
            } catch (InterruptedException e) {
                callInterrupted.set(true);
                throw e;
            } finally {
                callFinished.countDown();
            }
        }, token));

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
        assertThat(((RetryCancelledException) thrown).getAttempts()).isEqualTo(1);
        assertThat(elapsedMs).isLessThan(1000);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
        assertThat(awaitQuietly(callFinished)).isTrue();
        assertThat(callInterrupted.get()).isTrue();
    }

    @Test
    void execute_다른_스레드에서_cancel하면_진행_중인_호출을_중단() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());
        CancellationToken token = CancellationToken.create();
        CountDownLatch callStarted = new CountDownLatch(1);
        Thread canceller = new Thread(() -> {
            if (awaitQuietly(callStarted)) {
                token.cancel();
            }
        });
        canceller.start();
        long started = System.nanoTime();

        // when
        Throwable thrown = catchThrowable(() -> executor.execute(() -> {
            attempts.incrementAndGet();
            callStarted.countDown();
            Thread.sleep(5000);
            return "late";
        }, token));

        // then
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        assertThat(thrown).isInstanceOf(RetryCancelledException.class);
        assertThat(elapsedMs).isLessThan(3000);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_취소_가능한_토큰에서도_예외와_재시도는_동일하게_동작() {
        // given
        RetryExecutor executor = new RetryExecutor(fastPolicy());
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(10));

        // when
        String result = executor.execute(() -> {
            if (attempts.incrementAndGet() < 2) {
                throw new IOException("connection reset");
            }
            return "recovered";
        }, token);

        // then
        assertThat(result).isEqualTo("recovered");
        assertThat(attempts.get()).isEqualTo(2);
        assertThatThrownBy(() -> new RetryExecutor(fastPolicy().withRetryableErrors(RetryableErrors.none()))
            .execute(() -> {
                throw new IllegalArgumentException("bad request");
            }, token))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bad request");
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
