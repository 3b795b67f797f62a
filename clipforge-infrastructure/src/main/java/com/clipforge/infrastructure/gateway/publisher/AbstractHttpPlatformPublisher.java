package com.clipforge.infrastructure.gateway.publisher;

import com.clipforge.domain.production.adapter.gateway.IPlatformPublisherGateway;
import com.clipforge.domain.production.model.valobj.ArtifactRef;
import com.clipforge.domain.production.model.valobj.PublishResult;
import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.common.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 平台发布的公共 HTTP 流程：校验凭证、POST 素材地址与文案、解析远端地址。
 * <p>
 * 任何失败都以 {@link PublishResult#failure(String)} 返回。
 * </p>
 */
@Slf4j
public abstract class AbstractHttpPlatformPublisher implements IPlatformPublisherGateway {

    private final RestTemplate restTemplate;
    private final JsonCodec jsonCodec;
    private final String endpoint;

    protected AbstractHttpPlatformPublisher(RestTemplate restTemplate, JsonCodec jsonCodec, String endpoint) {
        this.restTemplate = restTemplate;
        this.jsonCodec = jsonCodec;
        this.endpoint = StringUtils.trimToEmpty(endpoint);
    }

    @Override
    public PublishResult publish(ArtifactRef artifact, Map<String, String> credentials, String caption) {
        if (artifact == null || StringUtils.isBlank(artifact.publicUrl())) {
            return PublishResult.failure("Artifact has no public url");
        }
        if (StringUtils.isBlank(endpoint)) {
            return PublishResult.failure(platform().getCode() + " publisher endpoint is not configured");
        }
        String accessToken = credentials == null ? null : credentials.get(Constants.CREDENTIAL_ACCESS_TOKEN);
        if (StringUtils.isBlank(accessToken)) {
            return PublishResult.failure("Missing " + Constants.CREDENTIAL_ACCESS_TOKEN + " for " + platform().getCode());
        }
        String missing = missingCredential(credentials);
        if (missing != null) {
            return PublishResult.failure("Missing " + missing + " for " + platform().getCode());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("video_url", artifact.publicUrl());
        body.put("caption", caption);
        customizeBody(body, credentials);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(endpoint,
                    new HttpEntity<>(jsonCodec.writeValue(body), headers), String.class);
            JsonNode payload = StringUtils.isBlank(response.getBody()) ? null : jsonCodec.readTree(response.getBody());
            String remoteUrl = resolveRemoteUrl(payload);
            if (StringUtils.isBlank(remoteUrl)) {
                return PublishResult.failure(platform().getCode() + " publish returned no remote url");
            }
            return PublishResult.success(remoteUrl);
        } catch (RestClientException ex) {
            log.warn("Failed to publish artifact. platform={}, storageKey={}, error={}",
                    platform().getCode(), artifact.storageKey(), ex.getMessage());
            return PublishResult.failure(platform().getCode() + " publish failed: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Failed to read publish response. platform={}, error={}", platform().getCode(), ex.getMessage());
            return PublishResult.failure(platform().getCode() + " publish response unreadable: " + ex.getMessage());
        }
    }

    /**
     * 平台额外必需的凭证键，缺失时返回键名。
     */
    protected String missingCredential(Map<String, String> credentials) {
        return null;
    }

    protected void customizeBody(Map<String, Object> body, Map<String, String> credentials) {
    }

    protected String resolveRemoteUrl(JsonNode payload) {
        if (payload == null) {
            return null;
        }
        JsonNode data = payload.has("data") && payload.get("data").isObject() ? payload.get("data") : payload;
        for (String field : new String[]{"remoteUrl", "url", "permalink"}) {
            JsonNode value = data.get(field);
            if (value != null && StringUtils.isNotBlank(value.asText())) {
                return value.asText();
            }
        }
        return null;
    }
}
