/**
 * OAuth2 client-credentials 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.connector.adapter.oauth2.TokenManager}가 백엔드별 Bearer 토큰을 발급받아 캐시하며,
 * 만료 5분 전부터 다음 호출에서 갱신합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.oauth2;
