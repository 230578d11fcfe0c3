package com.ryuqq.connector.core.protection;

import com.ryuqq.connector.core.executor.BackendCall;

/**
 * Circuit Breaker SPI.
 *
 * <p>하나의 논리적 의존성(예: 스토어별 커머스 백엔드)에 대한 실패율을 추적하고,
 * 임계값 초과 시 호출 없이 빠르게 실패(Fail-Fast)합니다.
 * 인스턴스는 소유 어댑터의 생명주기 동안 유지됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * Product product = cb.execute(() -> client.getProduct(productId));
 * // OPEN 상태: CircuitOpenException (호출하지 않음)
 * // HALF_OPEN 한도 초과: TooManyRequestsException (호출하지 않음)
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker로 보호하여 호출 실행.
     *
     * <ul>
     *   <li>CLOSED: 호출 후 결과 집계</li>
     *   <li>OPEN: {@link com.ryuqq.connector.core.exception.CircuitOpenException} (호출 안 함)</li>
     *   <li>HALF_OPEN: 시험 요청 한도 내에서만 호출, 초과 시
     *       {@link com.ryuqq.connector.core.exception.TooManyRequestsException}</li>
     * </ul>
     *
     * <p>호출이 던진 RuntimeException은 그대로 전파되며,
     * checked 예외는 {@link com.ryuqq.connector.core.exception.BackendCallException}으로 감싸집니다.</p>
     *
     * @param call 보호할 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    <T> T execute(BackendCall<T> call);

    /**
     * 현재 상태 조회 (만료된 OPEN은 HALF_OPEN으로 보고).
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 집계 구간 통계 조회.
     *
     * @return 통계 스냅샷
     */
    CircuitBreakerCounts getCounts();

    /**
     * 의존성 이름.
     *
     * @return Circuit Breaker 이름
     */
    String getName();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
