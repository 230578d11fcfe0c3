package com.ryuqq.connector.core.exception;

/**
 * 커넥터 계층의 최상위 예외.
 *
 * <p>모든 커넥터 예외는 다음 정보를 가집니다:</p>
 * <ul>
 *   <li>errorCode: 기계 판독용 오류 코드 (예: CONNECTOR_NOT_FOUND)</li>
 *   <li>category: 호출자에게 노출되는 오류 분류</li>
 *   <li>retryable: 재시도로 회복 가능한지 여부</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ConnectorException extends RuntimeException {

    private final String errorCode;
    private final ErrorCategory category;
    private final boolean retryable;

    public ConnectorException(String errorCode, ErrorCategory category, boolean retryable, String message) {
        this(errorCode, category, retryable, message, null);
    }

    public ConnectorException(String errorCode, ErrorCategory category, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        this.errorCode = errorCode;
        this.category = category;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
