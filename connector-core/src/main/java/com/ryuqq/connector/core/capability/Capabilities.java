package com.ryuqq.connector.core.capability;

import com.ryuqq.connector.core.spi.Connector;

import java.util.Optional;

/**
 * Connector capability 확인 유틸리티.
 *
 * <p>Registry가 반환하는 기본 {@link Connector}가 도메인 기능을 지원하는지
 * 호출 측에서 확인합니다.</p>
 *
 * <pre>{@code
 * Connector connector = registry.getConnector("ikea", "ikea-seattle", "retail");
 * RetailConnector retail = Capabilities.require(connector, RetailConnector.class);
 * ProductList products = retail.getProducts(ProductFilters.all());
 * }</pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class Capabilities {

    private Capabilities() {
    }

    /**
     * capability 타입으로 변환 시도.
     *
     * @param connector 대상 커넥터
     * @param capability capability 인터페이스
     * @param <T> capability 타입
     * @return 지원하면 변환된 커넥터, 아니면 empty
     */
    public static <T extends Connector> Optional<T> as(Connector connector, Class<T> capability) {
        if (connector == null) {
            throw new IllegalArgumentException("connector cannot be null");
        }
        if (capability == null) {
            throw new IllegalArgumentException("capability cannot be null");
        }
        if (capability.isInstance(connector)) {
            return Optional.of(capability.cast(connector));
        }
        return Optional.empty();
    }

    /**
     * capability 타입으로 변환 (미지원 시 예외).
     *
     * @throws UnsupportedOperationException 커넥터가 capability를 지원하지 않는 경우
     */
    public static <T extends Connector> T require(Connector connector, Class<T> capability) {
        return as(connector, capability).orElseThrow(() -> new UnsupportedOperationException(
            "connector " + connector.getAdapterKind().getValue()
                + " (domain=" + connector.getDomain() + ") does not support " + capability.getSimpleName()
        ));
    }
}
