package com.ryuqq.connector.core.exception;

import com.ryuqq.connector.core.model.AdapterKind;

/**
 * 어댑터 종류에 대한 Factory가 등록되지 않았을 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class UnknownAdapterKindException extends ConnectorException {

    private final AdapterKind adapterKind;

    public UnknownAdapterKindException(AdapterKind adapterKind) {
        super(
            "UNKNOWN_ADAPTER_KIND",
            ErrorCategory.MISCONFIGURED,
            false,
            "no factory registered for adapter type: " + adapterKind.getValue()
        );
        this.adapterKind = adapterKind;
    }

    public AdapterKind getAdapterKind() {
        return adapterKind;
    }
}
