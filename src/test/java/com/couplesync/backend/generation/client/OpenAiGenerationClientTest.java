package com.couplesync.backend.generation.client;

import com.couplesync.backend.generation.config.OpenAiProperties;
import com.couplesync.backend.generation.service.GenerationTelemetry;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OpenAiGenerationClientTest {

    private static final String PATH = "/v1/chat/completions";

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private OpenAiProperties props;
    private GenerationTelemetry telemetry;

    private static RestClient restClientHttp11(String baseUrl, Duration readTimeout) {
        // ✅ 固定 HTTP/1.1，避免 h2c 升級讓 WireMock EOF
        HttpClient jdk = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        JdkClientHttpRequestFactory f = new JdkClientHttpRequestFactory(jdk);
        f.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(f)
                .build();
    }

    private OpenAiGenerationClient client(Duration readTimeout) {
        return new OpenAiGenerationClient(restClientHttp11(wm.baseUrl(), readTimeout), props, telemetry);
    }

    private static GenerationRequest planRequest() {
        return new GenerationRequest(GenerationRequest.Purpose.PROGRAM_PLAN, "77",
                "You are a couples therapist.", "Alex and Sam want to talk more.");
    }

    private static String completion(String content, String finishReason) {
        return """
                {"id":"chatcmpl-1","choices":[{"index":0,"message":{"role":"assistant","content":"%s"},"finish_reason":"%s"}],
                 "usage":{"prompt_tokens":120,"completion_tokens":45,"total_tokens":165}}
                """.formatted(content, finishReason);
    }

    @BeforeEach
    void setUp() {
        props = new OpenAiProperties();
        props.setApiKey("sk-test-1234");
        props.setModel("gpt-4o-mini");
        props.setMaxTokens(512);
        telemetry = mock(GenerationTelemetry.class);
    }

    @Test
    void ok_returns_message_content_and_sends_bearer_and_both_roles() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(completion("Hello Alex and Sam", "stop"))));

        String text = client(Duration.ofSeconds(5)).complete(planRequest());

        assertEquals("Hello Alex and Sam", text);
        wm.verify(postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer sk-test-1234"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("512")))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                .withRequestBody(matchingJsonPath("$.messages[1].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("Alex and Sam want to talk more."))));
        verify(telemetry).ok(eq("OPENAI"), eq("gpt-4o-mini"), eq("PROGRAM_PLAN"), eq("77"), anyLong(), eq(120), eq(45));
    }

    @Test
    void unauthorized_maps_to_auth_failed() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(401)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"error\":{\"message\":\"Incorrect API key provided\"}}")));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofSeconds(5)).complete(planRequest()));

        assertEquals("GENERATION_AUTH_FAILED", ex.code());
        verify(telemetry).fail(eq("OPENAI"), eq("gpt-4o-mini"), eq("PROGRAM_PLAN"), eq("77"), anyLong(), eq("GENERATION_AUTH_FAILED"));
    }

    @Test
    void too_many_requests_maps_to_rate_limited() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(429).withBody("{}")));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofSeconds(5)).complete(planRequest()));

        assertEquals("GENERATION_RATE_LIMITED", ex.code());
    }

    @Test
    void server_error_is_not_retried() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(503).withBody("{}")));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofSeconds(5)).complete(planRequest()));

        assertEquals("GENERATION_UPSTREAM_5XX", ex.code());
        wm.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void content_filter_finish_reason_is_blocked() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(completion("", "content_filter"))));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofSeconds(5)).complete(planRequest()));

        assertEquals("GENERATION_BLOCKED", ex.code());
        verify(telemetry).fail(anyString(), anyString(), anyString(), anyString(), anyLong(), eq("GENERATION_BLOCKED"));
    }

    @Test
    void empty_choices_is_empty_response() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"choices\":[]}")));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofSeconds(5)).complete(planRequest()));

        assertEquals("GENERATION_EMPTY_RESPONSE", ex.code());
    }

    @Test
    void slow_upstream_maps_to_timeout() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(completion("late", "stop")).withFixedDelay(1500)));

        GenerationException ex = assertThrows(GenerationException.class, () -> client(Duration.ofMillis(200)).complete(planRequest()));

        assertEquals("GENERATION_TIMEOUT", ex.code());
        verify(telemetry, never()).ok(any(), any(), any(), any(), anyLong(), any(), any());
    }
}
