package com.ryuqq.connector.adapter.oauth2;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 토큰 엔드포인트 응답 DTO.
 *
 * <p>{@code expires_in}은 숫자 또는 숫자 문자열로 올 수 있어 문자열로 받습니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") String expiresIn,
    @JsonProperty("resource") String resource
) {
}
