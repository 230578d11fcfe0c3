package com.ryuqq.connector.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (interval 내 요청 수/실패율 임계값 초과)
 * OPEN (차단)
 *   │
 *   ▼ (timeout 경과)
 * HALF_OPEN (반개방, 최대 maxRequests개 시험 요청)
 *   │
 *   ├─► 연속 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 실패율 추적).
     */
    CLOSED,

    /**
     * 차단 상태 (호출 없이 즉시 실패).
     */
    OPEN,

    /**
     * 반개방 상태 (제한된 수의 시험 요청만 통과).
     */
    HALF_OPEN
}
