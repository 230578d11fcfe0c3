package com.ryuqq.connector.core.exception;

/**
 * 외부 설정 저장소 조회 실패.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ConnectorConfigStoreException extends ConnectorException {

    public ConnectorConfigStoreException(String message, Throwable cause) {
        super("CONFIG_STORE_FAILED", ErrorCategory.UNAVAILABLE, true, message, cause);
    }
}
