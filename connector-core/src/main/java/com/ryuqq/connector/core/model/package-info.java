/**
 * Connector 모델 패키지.
 *
 * <p>커넥터 식별({@link com.ryuqq.connector.core.model.ConnectorKey}),
 * 어댑터 종류({@link com.ryuqq.connector.core.model.AdapterKind}),
 * 설정({@link com.ryuqq.connector.core.model.ConnectorConfig}) 및
 * 런타임 메타데이터({@link com.ryuqq.connector.core.model.ConnectorMetadata})를 정의합니다.</p>
 *
 * <p>모든 타입은 불변이며 생성 시점에 유효성을 검증합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.model;
