package com.ryuqq.connector.adapter.oauth2;

import java.net.URI;
import java.time.Duration;

/**
 * OAuth2 client-credentials 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>tokenEndpoint: 토큰 발급 엔드포인트</li>
 *   <li>clientId / clientSecret: 클라이언트 자격 증명</li>
 *   <li>resource: 요청할 리소스 (없으면 폼에서 생략)</li>
 *   <li>expiryBuffer: 만료 전 갱신 여유 시간 (기본 5분)</li>
 *   <li>requestTimeout: 토큰 요청 타임아웃 (기본 30초)</li>
 * </ul>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param tokenEndpoint 토큰 엔드포인트
 * @param clientId 클라이언트 ID
 * @param clientSecret 클라이언트 시크릿
 * @param resource 리소스 (nullable)
 * @param expiryBuffer 갱신 여유 시간
 * @param requestTimeout 요청 타임아웃
 */
public record OAuth2ClientCredentials(
    URI tokenEndpoint,
    String clientId,
    String clientSecret,
    String resource,
    Duration expiryBuffer,
    Duration requestTimeout
) {

    private static final String AZURE_AD_TOKEN_ENDPOINT = "https://login.microsoftonline.com/%s/oauth2/token";

    /**
     * 기본 buffer(5분)와 타임아웃(30초)으로 생성.
     */
    public OAuth2ClientCredentials(URI tokenEndpoint, String clientId, String clientSecret, String resource) {
        this(tokenEndpoint, clientId, clientSecret, resource, Duration.ofMinutes(5), Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OAuth2ClientCredentials {
        if (tokenEndpoint == null) {
            throw new IllegalArgumentException("tokenEndpoint cannot be null");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be null or blank");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("clientSecret cannot be null or blank");
        }
        if (expiryBuffer == null || expiryBuffer.isNegative()) {
            throw new IllegalArgumentException("expiryBuffer cannot be null or negative (current: " + expiryBuffer + ")");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
    }

    /**
     * Azure AD 테넌트의 토큰 엔드포인트로 생성.
     *
     * @param azureTenantId Azure AD 테넌트 ID
     * @param clientId 클라이언트 ID
     * @param clientSecret 클라이언트 시크릿
     * @param resource 리소스 (보통 백엔드 base URL)
     * @return OAuth2ClientCredentials
     */
    public static OAuth2ClientCredentials forAzureAd(String azureTenantId, String clientId, String clientSecret, String resource) {
        if (azureTenantId == null || azureTenantId.isBlank()) {
            throw new IllegalArgumentException("azureTenantId cannot be null or blank");
        }
        URI endpoint = URI.create(String.format(AZURE_AD_TOKEN_ENDPOINT, azureTenantId));
        return new OAuth2ClientCredentials(endpoint, clientId, clientSecret, resource);
    }

    public boolean hasResource() {
        return resource != null && !resource.isBlank();
    }

    public OAuth2ClientCredentials withExpiryBuffer(Duration expiryBuffer) {
        return new OAuth2ClientCredentials(tokenEndpoint, clientId, clientSecret, resource, expiryBuffer, requestTimeout);
    }

    public OAuth2ClientCredentials withRequestTimeout(Duration requestTimeout) {
        return new OAuth2ClientCredentials(tokenEndpoint, clientId, clientSecret, resource, expiryBuffer, requestTimeout);
    }

    @Override
    public String toString() {
        return "OAuth2ClientCredentials{tokenEndpoint=" + tokenEndpoint
            + ", clientId=" + clientId
            + ", clientSecret=****"
            + ", resource=" + resource
            + ", expiryBuffer=" + expiryBuffer
            + ", requestTimeout=" + requestTimeout + '}';
    }
}
