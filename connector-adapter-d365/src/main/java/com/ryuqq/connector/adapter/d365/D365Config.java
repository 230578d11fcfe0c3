package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.adapter.oauth2.OAuth2ClientCredentials;
import com.ryuqq.connector.core.model.ConnectorConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * D365 Commerce Scale Unit 연결 설정 (불변 record).
 *
 * <p><strong>설정 출처:</strong></p>
 * <ul>
 *   <li>{@link #fromConnectorConfig(ConnectorConfig)}: 커넥터 설정 문서의 url + config 맵</li>
 *   <li>{@link #fromEnvironment(Map)}: D365_* 환경 변수</li>
 * </ul>
 *
 * <p><strong>config 맵 키:</strong> {@code apiKey}, {@code demoMode}, {@code azureTenantId},
 * {@code clientId}, {@code clientSecret}, {@code resource}, {@code operatingUnitNumber}</p>
 *
 * @author Connector Team
 * @since 1.0.0
 * @param csuBaseUrl CSU base URL (예: https://my-env.commerce.dynamics.com)
 * @param azureTenantId Azure AD 테넌트 ID (nullable)
 * @param clientId 앱 등록 클라이언트 ID (nullable)
 * @param clientSecret 앱 등록 클라이언트 시크릿 (nullable)
 * @param resource OAuth2 리소스 (없으면 csuBaseUrl)
 * @param operatingUnitNumber 매장 운영 단위 번호 (nullable)
 * @param apiKey Api-Key 헤더 값 (nullable)
 * @param demoMode 데모 모드 여부 (백엔드 호출 없이 내장 카탈로그 사용)
 * @param timeout 요청 타임아웃
 */
public record D365Config(
    String csuBaseUrl,
    String azureTenantId,
    String clientId,
    String clientSecret,
    String resource,
    String operatingUnitNumber,
    String apiKey,
    boolean demoMode,
    Duration timeout
) {

    public static final String ENV_CSU_BASE_URL = "D365_CSU_BASE_URL";
    public static final String ENV_TENANT_ID = "D365_TENANT_ID";
    public static final String ENV_CLIENT_ID = "D365_CLIENT_ID";
    public static final String ENV_CLIENT_SECRET = "D365_CLIENT_SECRET";
    public static final String ENV_RESOURCE = "D365_RESOURCE";
    public static final String ENV_OPERATING_UNIT_NUM = "D365_OPERATING_UNIT_NUM";

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public D365Config {
        if (!demoMode && isBlank(csuBaseUrl)) {
            throw new IllegalArgumentException("csuBaseUrl cannot be null or blank (non-demo mode)");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        csuBaseUrl = csuBaseUrl == null ? "" : stripTrailingSlash(csuBaseUrl.trim());
        resource = isBlank(resource) ? csuBaseUrl : resource;
    }

    /**
     * 커넥터 설정 문서로부터 생성.
     *
     * <p>url은 CSU base URL로 사용되며, timeout이 0이면 기본 30초를 사용합니다.</p>
     *
     * @param config 커넥터 설정
     * @return D365Config
     */
    public static D365Config fromConnectorConfig(ConnectorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        Duration timeout = config.timeout().isZero() ? DEFAULT_TIMEOUT : config.timeout();
        return new D365Config(
            config.url(),
            config.stringValue("azureTenantId").orElse(null),
            config.stringValue("clientId").orElse(null),
            config.stringValue("clientSecret").orElse(null),
            config.stringValue("resource").orElse(null),
            config.stringValue("operatingUnitNumber").orElse(null),
            config.stringValue("apiKey").orElse(null),
            config.booleanValue("demoMode", false),
            timeout
        );
    }

    /**
     * 환경 변수로부터 생성.
     *
     * <p>D365_RESOURCE를 제외한 모든 키가 필수이며, 누락된 키는 한 번에 보고합니다.</p>
     *
     * @param env 환경 변수 맵
     * @return D365Config
     * @throws IllegalArgumentException 필수 키가 누락된 경우
     */
    public static D365Config fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }

        List<String> missing = new ArrayList<>();
        for (String key : List.of(ENV_CSU_BASE_URL, ENV_TENANT_ID, ENV_CLIENT_ID, ENV_CLIENT_SECRET, ENV_OPERATING_UNIT_NUM)) {
            if (isBlank(env.get(key))) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("missing required D365 configuration: " + String.join(", ", missing));
        }

        return new D365Config(
            env.get(ENV_CSU_BASE_URL),
            env.get(ENV_TENANT_ID),
            env.get(ENV_CLIENT_ID),
            env.get(ENV_CLIENT_SECRET),
            env.get(ENV_RESOURCE),
            env.get(ENV_OPERATING_UNIT_NUM),
            null,
            false,
            DEFAULT_TIMEOUT
        );
    }

    public static D365Config fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public boolean hasApiKey() {
        return !isBlank(apiKey);
    }

    public boolean hasOAuth2Credentials() {
        return !isBlank(azureTenantId) && !isBlank(clientId) && !isBlank(clientSecret);
    }

    /**
     * Azure AD client-credentials 자격 증명.
     *
     * @return 자격 증명, 설정되지 않았으면 empty
     */
    public Optional<OAuth2ClientCredentials> oauth2Credentials() {
        if (!hasOAuth2Credentials()) {
            return Optional.empty();
        }
        return Optional.of(OAuth2ClientCredentials.forAzureAd(azureTenantId, clientId, clientSecret, resource)
            .withRequestTimeout(timeout));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "D365Config{csuBaseUrl=" + csuBaseUrl
            + ", azureTenantId=" + azureTenantId
            + ", clientId=" + clientId
            + ", clientSecret=" + (isBlank(clientSecret) ? "" : "****")
            + ", resource=" + resource
            + ", operatingUnitNumber=" + operatingUnitNumber
            + ", apiKey=" + (isBlank(apiKey) ? "" : "****")
            + ", demoMode=" + demoMode
            + ", timeout=" + timeout + '}';
    }
}
