package com.couplesync.backend.generation.client;

import com.couplesync.backend.generation.config.OpenAiProperties;
import com.couplesync.backend.generation.service.GenerationTelemetry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * OpenAI chat completions
 * - 不在這裡 retry：timeout / 5xx 都直接變成 GenerationException
 */
@Slf4j
public class OpenAiGenerationClient implements GenerationClient {

    private static final ObjectMapper OM = new ObjectMapper();

    private final RestClient http;
    private final OpenAiProperties props;
    private final GenerationTelemetry telemetry;

    public OpenAiGenerationClient(RestClient http, OpenAiProperties props, GenerationTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() { return "OPENAI"; }

    @Override
    public String complete(GenerationRequest request) {
        long t0 = System.nanoTime();
        String purpose = request.purpose().name();

        try {
            JsonNode resp = http.post()
                    .uri("/v1/chat/completions")
                    .header("Authorization", "Bearer " + props.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(buildBody(request))
                    .retrieve()
                    .body(JsonNode.class);

            String text = extractText(resp);
            if (text == null || text.isBlank()) throw new GenerationException("GENERATION_EMPTY_RESPONSE");

            JsonNode usage = (resp == null) ? null : resp.path("usage");
            telemetry.ok(providerCode(), props.getModel(), purpose, request.referenceId(), ms(t0),
                    intOrNull(usage, "prompt_tokens"), intOrNull(usage, "completion_tokens"));
            return text;

        } catch (GenerationException e) {
            telemetry.fail(providerCode(), props.getModel(), purpose, request.referenceId(), ms(t0), e.code());
            throw e;
        } catch (RestClientException e) {
            String code = GenerationErrorMapper.map(e);
            telemetry.fail(providerCode(), props.getModel(), purpose, request.referenceId(), ms(t0), code);
            throw new GenerationException(code, e);
        }
    }

    ObjectNode buildBody(GenerationRequest request) {
        ObjectNode body = OM.createObjectNode();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());

        ArrayNode messages = body.putArray("messages");
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", request.systemPrompt());
        }
        messages.addObject().put("role", "user").put("content", request.userPrompt());
        return body;
    }

    static String extractText(JsonNode resp) {
        if (resp == null) return null;
        JsonNode choices = resp.path("choices");
        if (!choices.isArray() || choices.isEmpty()) return null;

        JsonNode first = choices.get(0);
        if ("content_filter".equals(first.path("finish_reason").asText(null))) {
            throw new GenerationException("GENERATION_BLOCKED");
        }
        JsonNode content = first.path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private static Integer intOrNull(JsonNode n, String field) {
        if (n == null || !n.has(field) || !n.get(field).canConvertToInt()) return null;
        return n.get(field).asInt();
    }

    private static long ms(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
