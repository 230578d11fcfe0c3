package com.ryuqq.connector.core.exception;

import java.io.IOException;

/**
 * 어댑터의 백엔드 호출 실패 (HTTP 상태 오류 또는 전송 오류).
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>404: NOT_FOUND, 재시도 불가</li>
 *   <li>408, 429, 5xx: UNAVAILABLE, 재시도 가능</li>
 *   <li>그 외 4xx: UNAVAILABLE, 재시도 불가</li>
 *   <li>전송 오류 (statusCode = -1): UNAVAILABLE, 재시도 가능</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class BackendCallException extends ConnectorException {

    /** 전송 오류처럼 HTTP 상태가 없는 경우의 statusCode. */
    public static final int NO_STATUS = -1;

    private final int statusCode;

    public BackendCallException(String message, int statusCode, ErrorCategory category, boolean retryable, Throwable cause) {
        super("BACKEND_CALL_FAILED", category, retryable, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 오류로부터 생성.
     *
     * @param operation 호출 이름 (로그/메시지용)
     * @param statusCode HTTP 상태 코드
     * @param body 응답 본문
     * @return BackendCallException
     */
    public static BackendCallException ofStatus(String operation, int statusCode, String body) {
        String message = String.format("%s failed: status=%d, body=%s", operation, statusCode, body);
        if (statusCode == 404) {
            return new BackendCallException(message, statusCode, ErrorCategory.NOT_FOUND, false, null);
        }
        boolean retryable = statusCode == 408 || statusCode == 429 || statusCode >= 500;
        return new BackendCallException(message, statusCode, ErrorCategory.UNAVAILABLE, retryable, null);
    }

    /**
     * 전송 오류로부터 생성.
     *
     * @param operation 호출 이름
     * @param cause I/O 예외
     * @return BackendCallException (재시도 가능)
     */
    public static BackendCallException ofTransport(String operation, IOException cause) {
        return new BackendCallException(
            operation + " failed: " + cause.getMessage(), NO_STATUS, ErrorCategory.UNAVAILABLE, true, cause
        );
    }

    /**
     * 임의의 예외를 unchecked 예외로 변환.
     *
     * <p>RuntimeException은 그대로 반환합니다. InterruptedException은
     * 인터럽트 플래그를 복원한 뒤 재시도 불가 예외로 감쌉니다.</p>
     *
     * @param operation 호출 이름
     * @param e 원본 예외
     * @return 던질 RuntimeException
     */
    public static RuntimeException wrap(String operation, Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new BackendCallException(operation + " interrupted", NO_STATUS, ErrorCategory.CANCELLED, false, e);
        }
        if (e instanceof IOException) {
            return ofTransport(operation, (IOException) e);
        }
        return new BackendCallException(operation + " failed: " + e.getMessage(), NO_STATUS, ErrorCategory.UNAVAILABLE, false, e);
    }

    public int getStatusCode() {
        return statusCode;
    }
}
