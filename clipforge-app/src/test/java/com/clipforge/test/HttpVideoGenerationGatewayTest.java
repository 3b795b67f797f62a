package com.clipforge.test;

import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.domain.production.model.valobj.JobPollResult;
import com.clipforge.domain.production.model.valobj.StoryboardScene;
import com.clipforge.domain.production.model.valobj.StoryboardSpec;
import com.clipforge.domain.production.model.valobj.VideoGenerationRequest;
import com.clipforge.infrastructure.gateway.video.HttpVideoGenerationGateway;
import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.enums.JobPollStateEnum;
import com.clipforge.types.exception.ConfigurationException;
import com.clipforge.types.exception.TransientProviderException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class HttpVideoGenerationGatewayTest {

    private static final String BASE_URL = "http://video.test/v1";
    private static final JobHandle HANDLE = new JobHandle("task-42", LocalDateTime.of(2026, 3, 2, 10, 0));

    private MockRestServiceServer server;
    private HttpVideoGenerationGateway gateway;

    @BeforeEach
    public void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
        gateway = new HttpVideoGenerationGateway(restTemplate, new JsonCodec(new ObjectMapper()), clock,
                BASE_URL + "/", "secret-key", "sora-2-text-to-video");
    }

    @Test
    public void shouldSubmitStoryboardAndReturnHandle() {
        server.expect(requestTo(BASE_URL + "/jobs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret-key"))
                .andExpect(jsonPath("$.reference").value("job-1"))
                .andExpect(jsonPath("$.n_frames").value("15"))
                .andExpect(jsonPath("$.shots.length()").value(3))
                .andExpect(jsonPath("$.shots[2].Scene").value("Tap the link."))
                .andRespond(withSuccess("{\"code\":200,\"data\":{\"taskId\":\"task-42\"}}", MediaType.APPLICATION_JSON));

        JobHandle handle = gateway.submit(request());

        Assertions.assertEquals("task-42", handle.externalId());
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 10, 0), handle.submittedAt());
        server.verify();
    }

    @Test
    public void shouldMapServerErrorOnSubmitToTransientError() {
        server.expect(requestTo(BASE_URL + "/jobs")).andRespond(withServerError());

        Assertions.assertThrows(TransientProviderException.class, () -> gateway.submit(request()));
    }

    @Test
    public void shouldMapUnauthorizedToConfigurationError() {
        server.expect(requestTo(BASE_URL + "/jobs")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        Assertions.assertThrows(ConfigurationException.class, () -> gateway.submit(request()));
    }

    @Test
    public void shouldReportPendingWhileBackendGenerating() {
        server.expect(requestTo(BASE_URL + "/jobs/task-42"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"data\":{\"state\":\"generating\"}}", MediaType.APPLICATION_JSON));

        Assertions.assertEquals(JobPollStateEnum.PENDING, gateway.poll(HANDLE).state());
    }

    @Test
    public void shouldReadResultUrlFromEmbeddedResultJson() {
        server.expect(requestTo(BASE_URL + "/jobs/task-42"))
                .andRespond(withSuccess("{\"data\":{\"state\":\"success\",\"resultJson\":\"{\\\"resultUrls\\\":[\\\"https://cdn.backend.test/a.mp4\\\"]}\"}}",
                        MediaType.APPLICATION_JSON));

        JobPollResult result = gateway.poll(HANDLE);

        Assertions.assertEquals(JobPollStateEnum.SUCCESS, result.state());
        Assertions.assertEquals("https://cdn.backend.test/a.mp4", result.resultUrl());
    }

    @Test
    public void shouldFailWhenSuccessHasNoResultUrl() {
        server.expect(requestTo(BASE_URL + "/jobs/task-42"))
                .andRespond(withSuccess("{\"status\":\"completed\"}", MediaType.APPLICATION_JSON));

        JobPollResult result = gateway.poll(HANDLE);

        Assertions.assertEquals(JobPollStateEnum.FAIL, result.state());
    }

    @Test
    public void shouldReportBackendFailureMessage() {
        server.expect(requestTo(BASE_URL + "/jobs/task-42"))
                .andRespond(withSuccess("{\"data\":{\"state\":\"fail\",\"failMsg\":\"content policy\"}}", MediaType.APPLICATION_JSON));

        JobPollResult result = gateway.poll(HANDLE);

        Assertions.assertEquals(JobPollStateEnum.FAIL, result.state());
        Assertions.assertEquals("content policy", result.error());
    }

    @Test
    public void shouldTreatRateLimitOnPollAsTransient() {
        server.expect(requestTo(BASE_URL + "/jobs/task-42")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        Assertions.assertThrows(TransientProviderException.class, () -> gateway.poll(HANDLE));
    }

    @Test
    public void shouldRejectCallsWhenBaseUrlMissing() {
        HttpVideoGenerationGateway unconfigured = new HttpVideoGenerationGateway(new RestTemplate(),
                new JsonCodec(new ObjectMapper()), Clock.systemUTC(), " ", "", "sora-2-text-to-video");

        Assertions.assertThrows(ConfigurationException.class, () -> unconfigured.poll(HANDLE));
    }

    private VideoGenerationRequest request() {
        List<StoryboardScene> scenes = List.of(
                StoryboardScene.builder().index(1).dialogue("Hook.").durationSeconds(new BigDecimal("4.0")).build(),
                StoryboardScene.builder().index(2).dialogue("Benefit.").durationSeconds(new BigDecimal("5.0")).build(),
                StoryboardScene.builder().index(3).dialogue("Tap the link.").durationSeconds(new BigDecimal("6.0")).build());
        return VideoGenerationRequest.builder()
                .jobId("job-1")
                .channelId(1L)
                .productName("GlowSerum")
                .personaDescription("Maya, a night-shift nurse")
                .storyboard(StoryboardSpec.builder().scenes(scenes).totalSeconds(15).build())
                .aspectRatio("portrait")
                .build();
    }
}
