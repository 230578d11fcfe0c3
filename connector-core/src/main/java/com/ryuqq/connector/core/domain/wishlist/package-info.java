/**
 * Wishlist 도메인 모델 패키지.
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.domain.wishlist;
