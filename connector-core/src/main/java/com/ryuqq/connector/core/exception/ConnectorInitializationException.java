package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ConnectorKey;

/**
 * Factory 생성 또는 {@code initialize()} 실패 시 발생.
 *
 * <p>호출자에게는 서비스 사용 불가(UNAVAILABLE)로 분류됩니다.
 * 실패한 생성 결과는 캐시되지 않으므로 다음 조회에서 다시 시도됩니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ConnectorInitializationException extends ConnectorException {

    private final ConnectorKey key;

    public ConnectorInitializationException(ConnectorKey key, String message, Throwable cause) {
        super(
            "CONNECTOR_INITIALIZATION_FAILED",
            ErrorCategory.UNAVAILABLE,
            false,
            String.format("failed to initialize connector for %s: %s", key.cacheKey(), message),
            cause
        );
        this.key = key;
    }

    public ConnectorKey getKey() {
        return key;
    }
}
