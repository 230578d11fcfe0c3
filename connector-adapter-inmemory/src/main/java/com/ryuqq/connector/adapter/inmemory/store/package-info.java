/**
 * In-memory ConnectorConfigStore 구현 패키지.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.connector.adapter.inmemory.store.InMemoryConnectorConfigStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.connector.core.spi.ConnectorConfigStore}</li>
 *   <li>{@link com.ryuqq.connector.adapter.inmemory.store.JsonConnectorConfigLoader}:
 *       JSON 문서에서 설정을 읽어 저장소를 채우는 로더</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests, local development and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.connector.core.spi.ConnectorConfigStore
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.inmemory.store;
