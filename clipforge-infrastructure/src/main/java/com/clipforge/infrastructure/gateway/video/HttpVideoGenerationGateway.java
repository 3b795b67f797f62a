package com.clipforge.infrastructure.gateway.video;

import com.clipforge.domain.production.adapter.gateway.IVideoGenerationGateway;
import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.domain.production.model.valobj.JobPollResult;
import com.clipforge.domain.production.model.valobj.StoryboardScene;
import com.clipforge.domain.production.model.valobj.VideoGenerationRequest;
import com.clipforge.infrastructure.gateway.HttpErrorClassifier;
import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.exception.ConfigurationException;
import com.clipforge.types.exception.ContractValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HTTP 视频生成后端：POST 创建任务，GET 状态端点直到返回明确的结果地址。
 */
@Slf4j
@Component
public class HttpVideoGenerationGateway implements IVideoGenerationGateway {

    private static final Set<String> SUCCESS_STATES = Set.of("success", "succeeded", "completed");
    private static final Set<String> FAIL_STATES = Set.of("fail", "failed", "error", "cancelled");

    private final RestTemplate restTemplate;
    private final JsonCodec jsonCodec;
    private final Clock clock;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public HttpVideoGenerationGateway(@Qualifier("videoRestTemplate") RestTemplate restTemplate,
                                      JsonCodec jsonCodec,
                                      Clock clock,
                                      @Value("${clipforge.video.base-url:}") String baseUrl,
                                      @Value("${clipforge.video.api-key:}") String apiKey,
                                      @Value("${clipforge.video.model:sora-2-text-to-video}") String model) {
        this.restTemplate = restTemplate;
        this.jsonCodec = jsonCodec;
        this.clock = clock;
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public JobHandle submit(VideoGenerationRequest request) {
        requireConfigured();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("reference", request.getJobId());
        body.put("aspect_ratio", StringUtils.defaultIfBlank(request.getAspectRatio(), "portrait"));
        body.put("n_frames", String.valueOf(request.getStoryboard().getTotalSeconds()));
        body.put("persona", request.getPersonaDescription());
        body.put("product", request.getProductName());
        List<Map<String, Object>> shots = new ArrayList<>();
        for (StoryboardScene scene : request.getStoryboard().getScenes()) {
            Map<String, Object> shot = new LinkedHashMap<>();
            shot.put("Scene", scene.getDialogue());
            shot.put("duration", scene.getDurationSeconds());
            shots.add(shot);
        }
        body.put("shots", shots);

        JsonNode response;
        try {
            ResponseEntity<String> entity = restTemplate.postForEntity(baseUrl + "/jobs",
                    new HttpEntity<>(jsonCodec.writeValue(body), headers()), String.class);
            response = jsonCodec.readTree(entity.getBody());
        } catch (RestClientException ex) {
            throw HttpErrorClassifier.classify("Video job submission", ex);
        }
        JsonNode data = unwrap(response);
        String externalId = firstText(data, "taskId", "id", "jobId");
        if (StringUtils.isBlank(externalId)) {
            throw new ContractValidationException("Video backend did not return a job id");
        }
        log.info("Video job submitted. jobId={}, externalId={}", request.getJobId(), externalId);
        return new JobHandle(externalId, LocalDateTime.now(clock));
    }

    @Override
    public JobPollResult poll(JobHandle handle) {
        requireConfigured();
        JsonNode response;
        try {
            ResponseEntity<String> entity = restTemplate.exchange(baseUrl + "/jobs/{id}",
                    HttpMethod.GET,
                    new HttpEntity<>(headers()),
                    String.class,
                    handle.externalId());
            response = jsonCodec.readTree(entity.getBody());
        } catch (RestClientException ex) {
            throw HttpErrorClassifier.classify("Video job poll", ex);
        }
        JsonNode data = unwrap(response);
        String state = StringUtils.lowerCase(firstText(data, "state", "status"), Locale.ROOT);
        if (state != null && SUCCESS_STATES.contains(state)) {
            String resultUrl = resolveResultUrl(data);
            if (StringUtils.isBlank(resultUrl)) {
                return JobPollResult.fail("Backend reported success without a result url");
            }
            return JobPollResult.success(resultUrl);
        }
        if (state != null && FAIL_STATES.contains(state)) {
            return JobPollResult.fail(StringUtils.defaultIfBlank(firstText(data, "failMsg", "error", "message"),
                    "Backend reported state " + state));
        }
        return JobPollResult.pending();
    }

    private String resolveResultUrl(JsonNode data) {
        JsonNode result = data.get("resultJson");
        if (result != null && result.isTextual()) {
            result = jsonCodec.readTree(result.asText());
        }
        if (result == null || result.isNull()) {
            result = data;
        }
        JsonNode urls = result.get("resultUrls");
        if (urls != null && urls.isArray() && urls.size() > 0) {
            return urls.get(0).asText();
        }
        return firstText(result, "resultUrl", "url");
    }

    private JsonNode unwrap(JsonNode response) {
        if (response == null) {
            throw new ContractValidationException("Video backend returned an empty body");
        }
        JsonNode data = response.get("data");
        return data != null && data.isObject() ? data : response;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && StringUtils.isNotBlank(value.asText())) {
                return value.asText();
            }
        }
        return null;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(apiKey)) {
            headers.setBearerAuth(apiKey);
        }
        return headers;
    }

    private void requireConfigured() {
        if (StringUtils.isBlank(baseUrl)) {
            throw new ConfigurationException("clipforge.video.base-url is not configured");
        }
    }
}
