package com.ryuqq.connector.core.protection.noop;

import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.executor.BackendCall;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.protection.CircuitBreakerCounts;
import com.ryuqq.connector.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 통과시키며, 상태 추적을 하지 않습니다.
 * 개발/테스트 환경이나 보호 없이 실행하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 항상 호출</li>
 *   <li>getState(): 항상 CLOSED</li>
 *   <li>getCounts(): 항상 빈 통계</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public <T> T execute(BackendCall<T> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        try {
            return call.call();
        } catch (Exception e) {
            throw BackendCallException.wrap(name, e);
        }
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerCounts getCounts() {
        return CircuitBreakerCounts.empty();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
