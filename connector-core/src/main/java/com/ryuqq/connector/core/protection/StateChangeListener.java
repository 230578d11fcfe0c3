package com.ryuqq.connector.core.protection;

/**
 * Circuit Breaker 상태 전이 리스너.
 *
 * <p>로깅/메트릭 연동에 사용됩니다. 리스너에서 발생한 예외는 호출 결과에 영향을 주지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to);

    static StateChangeListener noop() {
        return (name, from, to) -> { };
    }
}
