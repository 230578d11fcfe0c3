package com.ryuqq.connector.adapter.d365;

import com.ryuqq.connector.adapter.oauth2.TokenManager;
import com.ryuqq.connector.core.exception.BackendCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * D365 Commerce Scale Unit HTTP 클라이언트.
 *
 * <p>모든 요청에 공통 헤더를 붙입니다:</p>
 * <ul>
 *   <li>{@code Authorization: Bearer <token>} (OAuth2 자격 증명이 있을 때)</li>
 *   <li>{@code Api-Key} (설정된 경우)</li>
 *   <li>{@code Accept: application/json}, {@code OData-MaxVersion: 4.0}, {@code OData-Version: 4.0}</li>
 *   <li>{@code Content-Type: application/json} (POST/PUT/PATCH)</li>
 * </ul>
 *
 * <p>상태 코드 해석은 호출자가 합니다. 이 클래스는 전송 실패만 예외로 던집니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class D365Client {

    private static final Logger log = LoggerFactory.getLogger(D365Client.class);

    private static final String ODATA_VERSION = "4.0";
    private static final String JSON = "application/json";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final TokenManager tokenManager;
    private final String apiKey;
    private final Duration requestTimeout;

    /**
     * D365 클라이언트 생성.
     *
     * @param baseUrl CSU base URL (끝의 '/' 제외)
     * @param httpClient HTTP 클라이언트
     * @param tokenManager Bearer 토큰 관리자 (nullable, 없으면 Authorization 생략)
     * @param apiKey Api-Key 헤더 값 (nullable)
     * @param requestTimeout 요청 타임아웃
     */
    public D365Client(String baseUrl, HttpClient httpClient, TokenManager tokenManager, String apiKey, Duration requestTimeout) {
        if (baseUrl == null) {
            throw new IllegalArgumentException("baseUrl cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.tokenManager = tokenManager;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    /**
     * D365Config로부터 생성. OAuth2 자격 증명이 있으면 TokenManager를 구성합니다.
     *
     * @param config D365 설정
     * @return D365Client
     */
    public static D365Client create(D365Config config) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.timeout())
            .build();
        TokenManager tokenManager = config.oauth2Credentials()
            .map(TokenManager::new)
            .orElse(null);
        return new D365Client(config.csuBaseUrl(), httpClient, tokenManager, config.apiKey(), config.timeout());
    }

    public HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return send("GET", path, null);
    }

    public HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        return send("POST", path, body);
    }

    public HttpResponse<String> put(String path, String body) throws IOException, InterruptedException {
        return send("PUT", path, body);
    }

    public HttpResponse<String> patch(String path, String body) throws IOException, InterruptedException {
        return send("PATCH", path, body);
    }

    public HttpResponse<String> delete(String path) throws IOException, InterruptedException {
        return send("DELETE", path, null);
    }

    /**
     * CSU 루트 엔드포인트로 연결 확인.
     *
     * @throws BackendCallException 200이 아니거나 전송에 실패한 경우
     */
    public void ping() {
        HttpResponse<String> response;
        try {
            response = get("/");
        } catch (IOException | InterruptedException e) {
            throw BackendCallException.wrap("ping", e);
        }
        if (response.statusCode() != 200) {
            throw BackendCallException.ofStatus("ping", response.statusCode(), response.body());
        }
    }

    public Optional<TokenManager> getTokenManager() {
        return Optional.ofNullable(tokenManager);
    }

    /**
     * 캐시된 토큰을 폐기합니다.
     *
     * <p>JDK 17의 HttpClient는 명시적으로 닫을 수 없으므로 참조 해제로 유휴 연결을 반납합니다.</p>
     */
    public void close() {
        if (tokenManager != null) {
            tokenManager.clearToken();
        }
    }

    private HttpResponse<String> send(String method, String path, String body) throws IOException, InterruptedException {
        HttpRequest request = buildRequest(method, path, body);
        log.debug("D365 request: {} {}", method, request.uri());
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    HttpRequest buildRequest(String method, String path, String body) {
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);

        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Accept", JSON)
            .header("OData-MaxVersion", ODATA_VERSION)
            .header("OData-Version", ODATA_VERSION)
            .method(method, publisher);

        if (tokenManager != null) {
            builder.header("Authorization", "Bearer " + tokenManager.getValidBearerToken());
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Api-Key", apiKey);
        }
        if ("POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method)) {
            builder.header("Content-Type", JSON);
        }
        return builder.build();
    }
}
