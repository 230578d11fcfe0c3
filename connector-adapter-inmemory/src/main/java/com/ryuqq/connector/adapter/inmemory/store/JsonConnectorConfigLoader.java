package com.ryuqq.connector.adapter.inmemory.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.connector.core.exception.ConnectorConfigStoreException;
import com.ryuqq.connector.core.model.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 배열 형식의 커넥터 설정 문서 로더.
 *
 * <pre>
 * [
 *   {
 *     "storeId": "ikea-seattle",
 *     "tenantId": "ikea",
 *     "domain": "retail",
 *     "url": "https://commerce.ikea.com/api",
 *     "adapter": "D365CommerceAdapter",
 *     "version": "v1",
 *     "config": { "demoMode": true },
 *     "enabled": true,
 *     "timeout": 10000,
 *     "priority": 1
 *   }
 * ]
 * </pre>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class JsonConnectorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonConnectorConfigLoader.class);

    private static final TypeReference<List<ConnectorConfigDocument>> DOCUMENTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonConnectorConfigLoader() {
        this(new ObjectMapper());
    }

    public JsonConnectorConfigLoader(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 클래스패스 리소스에서 로드.
     *
     * @param resource 리소스 경로 (예: connectors.json)
     * @return 설정 목록
     * @throws ConnectorConfigStoreException 리소스가 없거나 형식이 잘못된 경우
     */
    public List<ConnectorConfig> loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConnectorConfigStoreException("connector configuration resource not found: " + resource, null);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ConnectorConfigStoreException("failed to read connector configurations from " + resource, e);
        }
    }

    /**
     * 파일에서 로드.
     *
     * @param path JSON 파일 경로
     * @return 설정 목록
     * @throws ConnectorConfigStoreException 파일을 읽을 수 없거나 형식이 잘못된 경우
     */
    public List<ConnectorConfig> loadFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ConnectorConfigStoreException("failed to read connector configurations from " + path, e);
        }
    }

    /**
     * 스트림에서 로드.
     *
     * @param in JSON 입력 스트림
     * @param source 오류 메시지에 쓸 출처 이름
     * @return 설정 목록
     * @throws IOException JSON 파싱 실패 시
     * @throws ConnectorConfigStoreException 문서 값이 유효하지 않은 경우
     */
    public List<ConnectorConfig> load(InputStream in, String source) throws IOException {
        List<ConnectorConfigDocument> documents = objectMapper.readValue(in, DOCUMENTS);

        List<ConnectorConfig> configs = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            try {
                configs.add(documents.get(i).toConnectorConfig());
            } catch (IllegalArgumentException e) {
                throw new ConnectorConfigStoreException(
                    "invalid connector configuration at index " + i + " in " + source + ": " + e.getMessage(), e);
            }
        }

        log.info("Loaded connector configurations: source={}, count={}", source, configs.size());
        return configs;
    }
}
