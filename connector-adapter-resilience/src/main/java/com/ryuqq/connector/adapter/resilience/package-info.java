/**
 * 장애 격리 어댑터 패키지.
 *
 * <p>core의 CircuitBreaker SPI와 RetryPolicy를 실제로 실행하는 구현체를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.connector.adapter.resilience.DefaultCircuitBreaker}: 세대 기반 Circuit Breaker</li>
 *   <li>{@link com.ryuqq.connector.adapter.resilience.RetryExecutor}: Exponential Backoff 재시도</li>
 *   <li>{@link com.ryuqq.connector.adapter.resilience.BackoffCalculator}: 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.connector.adapter.resilience.ResilientCallExecutor}: Circuit Breaker + 재시도 결합</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.resilience;
