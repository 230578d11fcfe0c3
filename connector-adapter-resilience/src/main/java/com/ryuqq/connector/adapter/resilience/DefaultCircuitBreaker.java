package com.ryuqq.connector.adapter.resilience;

import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.CircuitOpenException;
import com.ryuqq.connector.core.exception.TooManyRequestsException;
import com.ryuqq.connector.core.executor.BackendCall;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.protection.CircuitBreakerConfig;
import com.ryuqq.connector.core.protection.CircuitBreakerCounts;
import com.ryuqq.connector.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 세대(generation) 기반 Circuit Breaker 구현체.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──readyToTrip──▶ OPEN ──timeout 경과──▶ HALF_OPEN
 *   ▲                                              │
 *   └──────── 연속 성공 ≥ threshold ───────────────┤
 *                       OPEN ◀──── 실패 ───────────┘
 * </pre>
 *
 * <p><strong>세대:</strong></p>
 * <ul>
 *   <li>상태 전이 또는 CLOSED 집계 주기(interval) 만료 시 새 세대가 시작되고 통계가 초기화됩니다.</li>
 *   <li>이전 세대에 시작된 호출의 결과는 집계에 반영하지 않습니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 상태와 통계는 하나의 lock으로 보호되며,
 * 실제 호출은 lock 밖에서 실행됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final MutableCounts counts = new MutableCounts();
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long generation;
    private Instant expiry;

    public DefaultCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Clock을 지정하여 생성 (테스트용).
     *
     * @param config Circuit Breaker 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public DefaultCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        toNewGeneration(clock.instant());
    }

    @Override
    public <T> T execute(BackendCall<T> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }

        long startedGeneration = beforeRequest();
        boolean success = false;
        try {
            T result = call.call();
            success = true;
            return result;
        } catch (Exception e) {
            throw BackendCallException.wrap(config.name(), e);
        } finally {
            afterRequest(startedGeneration, success);
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return currentState(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerCounts getCounts() {
        lock.lock();
        try {
            currentState(clock.instant());
            return counts.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return config.name();
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitBreakerState.CLOSED) {
                toNewGeneration(now);
            } else {
                setState(CircuitBreakerState.CLOSED, now);
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private long beforeRequest() {
        lock.lock();
        try {
            CircuitBreakerState current = currentState(clock.instant());

            if (current == CircuitBreakerState.OPEN) {
                throw new CircuitOpenException(config.name());
            }
            if (current == CircuitBreakerState.HALF_OPEN && counts.requests >= config.maxRequests()) {
                throw new TooManyRequestsException(config.name());
            }

            counts.onRequest();
            return generation;
        } finally {
            lock.unlock();
        }
    }

    private void afterRequest(long startedGeneration, boolean success) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CircuitBreakerState current = currentState(now);
            if (generation != startedGeneration) {
                return;
            }

            if (success) {
                onSuccess(current, now);
            } else {
                onFailure(current, now);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(CircuitBreakerState current, Instant now) {
        counts.onSuccess();
        if (current == CircuitBreakerState.HALF_OPEN
            && counts.consecutiveSuccesses >= config.halfOpenSuccessThreshold()) {
            setState(CircuitBreakerState.CLOSED, now);
        }
    }

    private void onFailure(CircuitBreakerState current, Instant now) {
        if (current == CircuitBreakerState.CLOSED) {
            counts.onFailure();
            if (config.readyToTrip().test(counts.snapshot())) {
                setState(CircuitBreakerState.OPEN, now);
            }
        } else if (current == CircuitBreakerState.HALF_OPEN) {
            setState(CircuitBreakerState.OPEN, now);
        }
    }

    private CircuitBreakerState currentState(Instant now) {
        if (state == CircuitBreakerState.CLOSED) {
            if (expiry != null && !expiry.isAfter(now)) {
                toNewGeneration(now);
            }
        } else if (state == CircuitBreakerState.OPEN) {
            if (!expiry.isAfter(now)) {
                setState(CircuitBreakerState.HALF_OPEN, now);
            }
        }
        return state;
    }

    private void setState(CircuitBreakerState newState, Instant now) {
        if (state == newState) {
            return;
        }

        CircuitBreakerState previous = state;
        state = newState;
        toNewGeneration(now);

        log.warn("Circuit breaker '{}' state changed: {} -> {}", config.name(), previous, newState);
        try {
            config.onStateChange().onStateChange(config.name(), previous, newState);
        } catch (RuntimeException e) {
            log.error("State change listener failed for circuit breaker '{}': {}",
                config.name(), e.getMessage(), e);
        }
    }

    private void toNewGeneration(Instant now) {
        generation++;
        counts.clear();

        switch (state) {
            case CLOSED:
                expiry = config.interval().isZero() ? null : now.plus(config.interval());
                break;
            case OPEN:
                expiry = now.plus(config.timeout());
                break;
            default:
                expiry = null;
                break;
        }
    }

    /**
     * lock 안에서만 접근되는 가변 통계.
     */
    private static final class MutableCounts {

        private long requests;
        private long totalSuccesses;
        private long totalFailures;
        private long consecutiveSuccesses;
        private long consecutiveFailures;

        void onRequest() {
            requests++;
        }

        void onSuccess() {
            totalSuccesses++;
            consecutiveSuccesses++;
            consecutiveFailures = 0;
        }

        void onFailure() {
            totalFailures++;
            consecutiveFailures++;
            consecutiveSuccesses = 0;
        }

        void clear() {
            requests = 0;
            totalSuccesses = 0;
            totalFailures = 0;
            consecutiveSuccesses = 0;
            consecutiveFailures = 0;
        }

        CircuitBreakerCounts snapshot() {
            return new CircuitBreakerCounts(
                requests, totalSuccesses, totalFailures, consecutiveSuccesses, consecutiveFailures);
        }
    }
}
