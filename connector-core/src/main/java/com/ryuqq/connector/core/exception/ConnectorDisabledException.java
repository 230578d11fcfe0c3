package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ConnectorKey;

/**
 * 커넥터 설정이 비활성화(enabled=false) 상태일 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ConnectorDisabledException extends ConnectorException {

    private final ConnectorKey key;

    public ConnectorDisabledException(ConnectorKey key) {
        super(
            "CONNECTOR_DISABLED",
            ErrorCategory.DISABLED,
            false,
            String.format("connector is disabled for tenantId=%s, storeId=%s, domain=%s",
                key.getTenantId(), key.getStoreId(), key.getDomain())
        );
        this.key = key;
    }

    public ConnectorKey getKey() {
        return key;
    }
}
