package com.ryuqq.connector.application.registry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExpiredConnectorSweeper 유닛 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class ExpiredConnectorSweeperTest {

    @Test
    void sweep_정리_건수_반환() {
        ExpiredConnectorSweeper sweeper = new ExpiredConnectorSweeper(() -> 3, Duration.ofMinutes(15));

        assertThat(sweeper.sweep()).isEqualTo(3);
    }

    @Test
    void sweep_예외가_발생해도_전파하지_않음() {
        // given
        ExpiredConnectorSweeper sweeper = new ExpiredConnectorSweeper(() -> {
            throw new IllegalStateException("close failed");
        }, Duration.ofMinutes(15));

        // when & then
        assertThat(sweeper.sweep()).isZero();
    }

    @Test
    void start_주기적으로_실행하고_stop으로_중지() throws InterruptedException {
        // given
        CountDownLatch ran = new CountDownLatch(3);
        AtomicInteger failures = new AtomicInteger();
        ExpiredConnectorSweeper sweeper = new ExpiredConnectorSweeper(() -> {
            ran.countDown();
            if (failures.incrementAndGet() == 1) {
                throw new IllegalStateException("first sweep fails");
            }
            return 0;
        }, Duration.ofMillis(10));

        // when
        sweeper.start();
        sweeper.start();

        // then
        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sweeper.isRunning()).isTrue();
        sweeper.stop();
        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void stop_시작하지_않은_경우_무시() {
        ExpiredConnectorSweeper sweeper = new ExpiredConnectorSweeper(() -> 0, Duration.ofMinutes(15));

        sweeper.stop();

        assertThat(sweeper.isRunning()).isFalse();
    }

    @Test
    void 생성자_유효성_검증() {
        assertThatThrownBy(() -> new ExpiredConnectorSweeper(null, Duration.ofMinutes(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("evictTask cannot be null");
        assertThatThrownBy(() -> new ExpiredConnectorSweeper(() -> 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("interval must be positive (current: PT0S)");
    }
}
