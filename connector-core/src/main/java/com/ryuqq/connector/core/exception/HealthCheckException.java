package com.ryuqq.connector.core.exception;

/**
 * 커넥터 헬스체크 실패.
 *
 * <p>Registry에서는 치명적이지 않습니다. 생성 직후의 헬스체크 실패는
 * 로그로만 남기고 인스턴스는 그대로 캐시됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class HealthCheckException extends ConnectorException {

    public HealthCheckException(String message) {
        this(message, null);
    }

    public HealthCheckException(String message, Throwable cause) {
        super("HEALTH_CHECK_FAILED", ErrorCategory.UNAVAILABLE, true, message, cause);
    }
}
