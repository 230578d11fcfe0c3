/**
 * In-memory wishlist 커넥터.
 *
 * <p>외부 백엔드 없이 {@link com.ryuqq.connector.core.capability.WishlistConnector} 계약을
 * 구현하는 참조 어댑터입니다. 로컬 개발과 Registry 통합 테스트에 사용합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.inmemory.wishlist;
