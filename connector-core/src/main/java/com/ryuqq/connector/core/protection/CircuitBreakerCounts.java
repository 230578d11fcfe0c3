package com.ryuqq.connector.core.protection;

/**
 * Circuit Breaker의 현재 집계 구간 통계 (불변 스냅샷).
 *
 * <p>집계는 CLOSED 상태의 interval 경계와 모든 상태 전이 시 초기화되며,
 * 음수가 되지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param requests 허용된 요청 수
 * @param totalSuccesses 성공 수
 * @param totalFailures 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param consecutiveFailures 연속 실패 수
 */
public record CircuitBreakerCounts(
    long requests,
    long totalSuccesses,
    long totalFailures,
    long consecutiveSuccesses,
    long consecutiveFailures
) {

    private static final CircuitBreakerCounts EMPTY = new CircuitBreakerCounts(0, 0, 0, 0, 0);

    public CircuitBreakerCounts {
        if (requests < 0 || totalSuccesses < 0 || totalFailures < 0
            || consecutiveSuccesses < 0 || consecutiveFailures < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
    }

    public static CircuitBreakerCounts empty() {
        return EMPTY;
    }

    /**
     * 실패율 (totalFailures / requests).
     *
     * @return 0.0 ~ 1.0 (요청이 없으면 0.0)
     */
    public double failureRatio() {
        if (requests == 0) {
            return 0.0;
        }
        return (double) totalFailures / requests;
    }
}
