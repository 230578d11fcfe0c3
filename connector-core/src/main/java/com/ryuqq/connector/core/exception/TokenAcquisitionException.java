package com.ryuqq.connector.core.exception;

/**
 * OAuth2 토큰 획득 실패.
 *
 * <p>네트워크 오류, 200 이외의 응답, 빈 access_token, 해석할 수 없는 expires_in에서 발생합니다.
 * 네트워크 오류와 5xx 응답만 재시도 가능으로 표시됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class TokenAcquisitionException extends ConnectorException {

    public TokenAcquisitionException(String message, boolean retryable) {
        this(message, retryable, null);
    }

    public TokenAcquisitionException(String message, boolean retryable, Throwable cause) {
        super("TOKEN_ACQUISITION_FAILED", ErrorCategory.UNAVAILABLE, retryable, message, cause);
    }
}
