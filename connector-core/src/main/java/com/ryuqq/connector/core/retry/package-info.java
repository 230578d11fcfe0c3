/**
 * 재시도 정책 패키지.
 *
 * <p>{@link com.ryuqq.connector.core.retry.RetryPolicy}는 순수 설정이며,
 * 실행은 {@code connector-adapter-resilience} 모듈의 {@code RetryExecutor}가 담당합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.retry;
