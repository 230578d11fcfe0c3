package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.spi.Connector;
import com.ryuqq.connector.core.spi.ConnectorFactory;

/**
 * {@link D365CommerceAdapter} Factory.
 *
 * <pre>{@code
 * registry.registerFactory(D365CommerceConnectorFactory.KIND, new D365CommerceConnectorFactory());
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class D365CommerceConnectorFactory implements ConnectorFactory {

    public static final AdapterKind KIND = D365CommerceAdapter.KIND;

    @Override
    public Connector create(ConnectorConfig config) {
        return new D365CommerceAdapter(config);
    }
}
