package com.ryuqq.connector.adapter.oauth2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.core.exception.TokenAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * OAuth2 client-credentials Bearer 토큰 관리자.
 *
 * <p>백엔드 설정 하나당 하나의 인스턴스가 토큰을 발급받아 캐시합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ol>
 *   <li>Fast path: read lock 하에서 캐시 토큰이 유효하면 ({@code now + buffer < expiresAt}) 반환</li>
 *   <li>Slow path: write lock 획득 후 재확인 (대기 중 다른 스레드가 갱신했을 수 있음)</li>
 *   <li>여전히 무효하면 토큰 엔드포인트에 client_credentials grant 요청</li>
 *   <li>새 토큰으로 캐시를 원자적으로 교체</li>
 * </ol>
 *
 * <p>동시에 갱신을 시도한 호출자들은 write lock에서 대기하므로 토큰 요청은 1회만 발생합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final OAuth2ClientCredentials credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private CachedToken cachedToken;

    public TokenManager(OAuth2ClientCredentials credentials) {
        this(
            credentials,
            HttpClient.newBuilder().connectTimeout(requireCredentials(credentials).requestTimeout()).build(),
            new ObjectMapper(),
            Clock.systemUTC()
        );
    }

    /**
     * 협력 객체를 지정하여 생성.
     *
     * @param credentials 자격 증명
     * @param httpClient HTTP 클라이언트
     * @param objectMapper JSON 파서
     * @param clock 시간 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public TokenManager(OAuth2ClientCredentials credentials, HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        requireCredentials(credentials);
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    private static OAuth2ClientCredentials requireCredentials(OAuth2ClientCredentials credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        return credentials;
    }

    /**
     * 유효한 Bearer 토큰 조회 (필요 시 갱신).
     *
     * @return 액세스 토큰
     * @throws TokenAcquisitionException 토큰 발급 실패 시
     */
    public String getValidBearerToken() {
        lock.readLock().lock();
        try {
            if (isValid(cachedToken)) {
                return cachedToken.accessToken();
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (isValid(cachedToken)) {
                return cachedToken.accessToken();
            }

            CachedToken refreshed = requestToken();
            cachedToken = refreshed;
            log.info("Acquired OAuth2 token from {} (expiresAt={})", credentials.tokenEndpoint(), refreshed.expiresAt());
            return refreshed.accessToken();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 캐시 토큰 제거. 다음 호출은 새 토큰을 요청합니다.
     */
    public void clearToken() {
        lock.writeLock().lock();
        try {
            cachedToken = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 캐시 토큰의 만료 시각 (모니터링용).
     *
     * @return 만료 시각, 캐시된 토큰이 없으면 empty
     */
    public Optional<Instant> getTokenExpiry() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cachedToken).map(CachedToken::expiresAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    public OAuth2ClientCredentials getCredentials() {
        return credentials;
    }

    private boolean isValid(CachedToken token) {
        return token != null && token.isValidAt(clock.instant(), credentials.expiryBuffer());
    }

    private CachedToken requestToken() {
        HttpRequest request = HttpRequest.newBuilder(credentials.tokenEndpoint())
            .timeout(credentials.requestTimeout())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(formBody(), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TokenAcquisitionException("failed to request token: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenAcquisitionException("interrupted while requesting token", false, e);
        }

        int status = response.statusCode();
        if (status != 200) {
            throw new TokenAcquisitionException(
                String.format("token request failed: status=%d, body=%s", status, response.body()),
                status >= 500
            );
        }

        TokenResponse tokenResponse = parse(response.body());
        if (tokenResponse.accessToken() == null || tokenResponse.accessToken().isEmpty()) {
            throw new TokenAcquisitionException("token response has empty access_token", false);
        }

        long expiresInSeconds = parseExpiresIn(tokenResponse.expiresIn());
        return new CachedToken(tokenResponse.accessToken(), clock.instant().plusSeconds(expiresInSeconds));
    }

    private TokenResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw new TokenAcquisitionException("token response body is empty", false);
        }
        try {
            return objectMapper.readValue(body, TokenResponse.class);
        } catch (JsonProcessingException e) {
            throw new TokenAcquisitionException("failed to parse token response: " + e.getOriginalMessage(), false, e);
        }
    }

    private static long parseExpiresIn(String expiresIn) {
        if (expiresIn == null || expiresIn.isBlank()) {
            throw new TokenAcquisitionException("token response has no expires_in", false);
        }
        long seconds;
        try {
            seconds = Long.parseLong(expiresIn.trim());
        } catch (NumberFormatException e) {
            throw new TokenAcquisitionException("failed to parse expires_in: " + expiresIn, false, e);
        }
        if (seconds <= 0) {
            throw new TokenAcquisitionException("expires_in must be positive (current: " + seconds + ")", false);
        }
        return seconds;
    }

    String formBody() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("client_id", credentials.clientId());
        form.put("client_secret", credentials.clientSecret());
        if (credentials.hasResource()) {
            form.put("resource", credentials.resource());
        }
        return form.entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
