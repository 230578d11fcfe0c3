package com.ryuqq.connector.core.protection;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 의존성 이름 (예: d365-commerce-ikea-seattle)</li>
 *   <li>maxRequests: HALF_OPEN 상태에서 허용할 시험 요청 수 (기본 3)</li>
 *   <li>interval: CLOSED 상태 집계 초기화 주기 (기본 10초, 0이면 초기화 안 함)</li>
 *   <li>timeout: OPEN → HALF_OPEN 전이 대기 시간 (기본 30초)</li>
 *   <li>halfOpenSuccessThreshold: HALF_OPEN → CLOSED에 필요한 연속 성공 수 (기본 1)</li>
 *   <li>readyToTrip: CLOSED 상태 실패 시 OPEN 전이 여부 판단 (기본: 요청 5회 이상 &amp;&amp; 실패율 50% 이상)</li>
 *   <li>onStateChange: 상태 전이 리스너</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param name 의존성 이름
 * @param maxRequests HALF_OPEN 시험 요청 수 (양수)
 * @param interval 집계 초기화 주기 (음수 불가)
 * @param timeout OPEN 유지 시간 (양수)
 * @param halfOpenSuccessThreshold CLOSED 전이에 필요한 연속 성공 수 (1 ~ maxRequests)
 * @param readyToTrip OPEN 전이 조건
 * @param onStateChange 상태 전이 리스너
 */
public record CircuitBreakerConfig(
    String name,
    int maxRequests,
    Duration interval,
    Duration timeout,
    int halfOpenSuccessThreshold,
    Predicate<CircuitBreakerCounts> readyToTrip,
    StateChangeListener onStateChange
) {

    /** 기본 OPEN 전이 최소 요청 수. */
    public static final long DEFAULT_MINIMUM_REQUESTS = 5;

    /** 기본 OPEN 전이 실패율. */
    public static final double DEFAULT_FAILURE_RATIO = 0.5;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRequests=3, interval=10s, timeout=30s, halfOpenSuccessThreshold=1,
     * readyToTrip=요청 5회 이상 &amp;&amp; 실패율 0.5 이상</p>
     *
     * @param name 의존성 이름
     */
    public CircuitBreakerConfig(String name) {
        this(name, 3, Duration.ofSeconds(10), Duration.ofSeconds(30), 1,
            defaultReadyToTrip(), StateChangeListener.noop());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException(
                "maxRequests must be positive (current: " + maxRequests + ")"
            );
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval cannot be null or negative (current: " + interval + ")");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (halfOpenSuccessThreshold <= 0 || halfOpenSuccessThreshold > maxRequests) {
            throw new IllegalArgumentException(
                "halfOpenSuccessThreshold must be between 1 and maxRequests (current: "
                    + halfOpenSuccessThreshold + ", maxRequests: " + maxRequests + ")"
            );
        }
        if (readyToTrip == null) {
            throw new IllegalArgumentException("readyToTrip cannot be null");
        }
        if (onStateChange == null) {
            throw new IllegalArgumentException("onStateChange cannot be null");
        }
    }

    /**
     * 기본 OPEN 전이 조건: requests &gt;= 5 &amp;&amp; failureRatio &gt;= 0.5.
     */
    public static Predicate<CircuitBreakerCounts> defaultReadyToTrip() {
        return counts -> counts.requests() >= DEFAULT_MINIMUM_REQUESTS
            && counts.failureRatio() >= DEFAULT_FAILURE_RATIO;
    }

    public CircuitBreakerConfig withMaxRequests(int maxRequests) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout,
            Math.min(halfOpenSuccessThreshold, maxRequests), readyToTrip, onStateChange);
    }

    public CircuitBreakerConfig withInterval(Duration interval) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout, halfOpenSuccessThreshold, readyToTrip, onStateChange);
    }

    public CircuitBreakerConfig withTimeout(Duration timeout) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout, halfOpenSuccessThreshold, readyToTrip, onStateChange);
    }

    public CircuitBreakerConfig withHalfOpenSuccessThreshold(int halfOpenSuccessThreshold) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout, halfOpenSuccessThreshold, readyToTrip, onStateChange);
    }

    public CircuitBreakerConfig withReadyToTrip(Predicate<CircuitBreakerCounts> readyToTrip) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout, halfOpenSuccessThreshold, readyToTrip, onStateChange);
    }

    public CircuitBreakerConfig withOnStateChange(StateChangeListener onStateChange) {
        return new CircuitBreakerConfig(name, maxRequests, interval, timeout, halfOpenSuccessThreshold, readyToTrip, onStateChange);
    }
}
