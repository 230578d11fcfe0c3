package com.ryuqq.connector.adapter.inmemory.wishlist;

import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import com.ryuqq.connector.core.spi.Connector;
import com.ryuqq.connector.core.spi.ConnectorFactory;

import java.time.Clock;

/**
 * {@link InMemoryWishlistConnector} Factory.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemoryWishlistConnectorFactory implements ConnectorFactory {

    public static final AdapterKind KIND = InMemoryWishlistConnector.KIND;

    private final Clock clock;

    public InMemoryWishlistConnectorFactory() {
        this(Clock.systemUTC());
    }

    public InMemoryWishlistConnectorFactory(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Connector create(ConnectorConfig config) {
        return new InMemoryWishlistConnector(clock);
    }
}
