package com.ryuqq.connector.core.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 재시도 정책 (불변 record).
 *
 * <p>가변 상태가 없는 순수 설정이며, 시도 횟수는 호출마다 별도로 관리됩니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수 (기본 3, 첫 시도 포함)</li>
 *   <li>initialDelay: 첫 재시도 전 대기 시간 (기본 100ms)</li>
 *   <li>maxDelay: 최대 대기 시간 (기본 5초)</li>
 *   <li>backoffFactor: 지수 증가 배수 (기본 2.0)</li>
 *   <li>retryableErrors: 재시도 여부 판단 (기본: 모든 예외)</li>
 * </ul>
 *
 * <p><strong>대기 시간:</strong> i번째(0부터) 실패 후 {@code min(maxDelay, initialDelay × backoffFactor^i)}</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (양수)
 * @param initialDelay 첫 대기 시간 (음수 불가)
 * @param maxDelay 최대 대기 시간 (initialDelay 이상)
 * @param backoffFactor 증가 배수 (1.0 이상)
 * @param retryableErrors 재시도 가능 예외 판단
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    double backoffFactor,
    Predicate<Throwable> retryableErrors
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, initialDelay=100ms, maxDelay=5s, backoffFactor=2.0,
     * retryableErrors=모든 예외</p>
     */
    public RetryPolicy() {
        this(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, RetryableErrors.all());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay cannot be null or negative (current: " + initialDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (retryableErrors == null) {
            throw new IllegalArgumentException("retryableErrors cannot be null");
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffFactor, retryableErrors);
    }

    /**
     * initialDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withInitialDelay(Duration initialDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffFactor, retryableErrors);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffFactor, retryableErrors);
    }

    /**
     * backoffFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBackoffFactor(double backoffFactor) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffFactor, retryableErrors);
    }

    /**
     * retryableErrors만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRetryableErrors(Predicate<Throwable> retryableErrors) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffFactor, retryableErrors);
    }
}
