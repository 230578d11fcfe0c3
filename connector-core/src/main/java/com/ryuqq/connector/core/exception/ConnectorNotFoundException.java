package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.ConnectorKey;

/**
 * 일치하는 커넥터 설정이 없을 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class ConnectorNotFoundException extends ConnectorException {

    private final ConnectorKey key;

    public ConnectorNotFoundException(ConnectorKey key) {
        super(
            "CONNECTOR_NOT_FOUND",
            ErrorCategory.NOT_FOUND,
            false,
            String.format("connector not found for tenantId=%s, storeId=%s, domain=%s",
                key.getTenantId(), key.getStoreId(), key.getDomain())
        );
        this.key = key;
    }

    public ConnectorKey getKey() {
        return key;
    }
}
