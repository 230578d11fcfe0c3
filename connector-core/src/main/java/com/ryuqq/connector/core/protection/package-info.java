/**
 * Protection SPI 패키지.
 *
 * <p>어댑터의 백엔드 호출을 보호하는 Circuit Breaker 계약과 설정을 정의합니다.
 * 실제 구현은 {@code connector-adapter-resilience} 모듈의 {@code DefaultCircuitBreaker}입니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <pre>
 * CircuitBreaker.execute(
 *     RetryExecutor.execute(
 *         BackendCall))
 * </pre>
 *
 * <p>Circuit Breaker가 Retry를 감쌉니다. 재시도를 포함한 한 번의 논리적 호출은
 * Circuit Breaker에 한 번의 성공 또는 실패로 집계됩니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.connector.core.protection.noop.NoOpCircuitBreaker}는
 * 항상 호출을 통과시키며 상태를 추적하지 않습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @see com.ryuqq.connector.core.protection.CircuitBreaker
 * @see com.ryuqq.connector.core.protection.noop
 */
package com.ryuqq.connector.core.protection;
