package com.ryuqq.connector.adapter.resilience;

import com.ryuqq.connector.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되 최대 대기 시간으로 제한합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(initialDelay * factor^(failedAttempt-1), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=100ms, factor=2.0):</strong></p>
 * <ul>
 *   <li>failedAttempt=1: 100ms</li>
 *   <li>failedAttempt=2: 200ms</li>
 *   <li>failedAttempt=3: 400ms</li>
 *   <li>failedAttempt=10: 51200ms (capped at maxDelay=5000ms)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double backoffFactor;

    /**
     * RetryPolicy 설정으로 생성.
     *
     * @param policy 재시도 정책
     */
    public BackoffCalculator(RetryPolicy policy) {
        this(policy.initialDelay().toMillis(), policy.maxDelay().toMillis(), policy.backoffFactor());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param initialDelayMs 첫 대기 시간 (밀리초, 음수 불가)
     * @param maxDelayMs 최대 대기 시간 (밀리초, initialDelayMs 이상이어야 함)
     * @param backoffFactor 증가 배수 (1.0 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long initialDelayMs, long maxDelayMs, double backoffFactor) {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }

        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.backoffFactor = backoffFactor;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public Duration calculate(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }

        // double 연산 후 maxDelay로 제한 (overflow 방지)
        double raw = initialDelayMs * Math.pow(backoffFactor, failedAttempt - 1);
        return Duration.ofMillis(raw >= maxDelayMs ? maxDelayMs : (long) raw);
    }
}
