package com.ryuqq.connector.core.exception;

/**
 * HALF_OPEN 상태의 시험 요청 한도를 초과했을 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class TooManyRequestsException extends ConnectorException {

    private final String circuitBreakerName;

    public TooManyRequestsException(String circuitBreakerName) {
        super(
            "CIRCUIT_HALF_OPEN_LIMIT",
            ErrorCategory.UNAVAILABLE,
            false,
            "too many requests: circuit breaker '" + circuitBreakerName + "' is half-open"
        );
        this.circuitBreakerName = circuitBreakerName;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }
}
