/**
 * 커넥터 예외 계층.
 *
 * <p>모든 예외는 unchecked {@link com.ryuqq.connector.core.exception.ConnectorException}을 상속하며,
 * {@link com.ryuqq.connector.core.exception.ErrorCategory}로 호출자에게 노출되는 분류를 제공합니다.</p>
 *
 * <pre>
 * ConnectorException
 *   ├─ ConnectorNotFoundException        (NOT_FOUND)
 *   ├─ ConnectorDisabledException        (DISABLED)
 *   ├─ UnknownAdapterKindException       (MISCONFIGURED)
 *   ├─ ConnectorInitializationException  (UNAVAILABLE)
 *   ├─ HealthCheckException              (UNAVAILABLE, 비치명적)
 *   ├─ CircuitOpenException              (UNAVAILABLE, 호출 시도 없음)
 *   ├─ TooManyRequestsException          (UNAVAILABLE, 호출 시도 없음)
 *   ├─ TokenAcquisitionException         (UNAVAILABLE)
 *   ├─ RetryExhaustedException           (UNAVAILABLE, 마지막 예외를 cause로 가짐)
 *   ├─ RetryCancelledException           (CANCELLED)
 *   ├─ BackendCallException              (HTTP 상태에 따라 분류)
 *   └─ ConnectorConfigStoreException     (UNAVAILABLE)
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.exception;
