package com.ryuqq.connector.adapter.resilience;

import com.ryuqq.connector.core.executor.BackendCall;
import com.ryuqq.connector.core.protection.CircuitBreaker;
import com.ryuqq.connector.core.retry.CancellationToken;

/**
 * Circuit Breaker와 재시도를 결합한 호출 실행기.
 *
 * <p>호출 체인: {@code CircuitBreaker.execute(RetryExecutor.execute(call))}</p>
 *
 * <ul>
 *   <li>재시도 전체가 Circuit Breaker의 요청 1건으로 집계됩니다.</li>
 *   <li>Circuit이 OPEN이면 재시도 없이 즉시 실패합니다.</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ResilientCallExecutor {

    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;

    public ResilientCallExecutor(CircuitBreaker circuitBreaker, RetryExecutor retryExecutor) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor cannot be null");
        }
        this.circuitBreaker = circuitBreaker;
        this.retryExecutor = retryExecutor;
    }

    public <T> T execute(BackendCall<T> call) {
        return execute(call, CancellationToken.none());
    }

    public <T> T execute(BackendCall<T> call, CancellationToken token) {
        return circuitBreaker.execute(() -> retryExecutor.execute(call, token));
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
