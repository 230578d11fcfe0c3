package com.ryuqq.connector.adapter.oauth2;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시된 Bearer 토큰 (불변 record).
 *
 * @author Connector Team
 * @since 1.0.0
 * @param accessToken 액세스 토큰
 * @param expiresAt 만료 시각
 */
public record CachedToken(String accessToken, Instant expiresAt) {

    public CachedToken {
        if (accessToken == null || accessToken.isEmpty()) {
            throw new IllegalArgumentException("accessToken cannot be null or empty");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    /**
     * {@code now + buffer < expiresAt}이면 유효.
     */
    public boolean isValidAt(Instant now, Duration buffer) {
        return now.plus(buffer).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CachedToken{accessToken=****, expiresAt=" + expiresAt + '}';
    }
}
