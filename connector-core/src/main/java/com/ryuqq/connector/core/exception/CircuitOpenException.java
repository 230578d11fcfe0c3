package com.ryuqq.connector.core.exception;

/**
 * Circuit Breaker가 OPEN 상태라 호출이 시도되지 않았을 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ConnectorException {

    private final String circuitBreakerName;

    public CircuitOpenException(String circuitBreakerName) {
        super(
            "CIRCUIT_OPEN",
            ErrorCategory.UNAVAILABLE,
            false,
            "circuit breaker '" + circuitBreakerName + "' is open"
        );
        this.circuitBreakerName = circuitBreakerName;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }
}
