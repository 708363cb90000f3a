package com.couplesync.backend.generation.config;

import com.couplesync.backend.generation.client.GenerationClient;
import com.couplesync.backend.generation.client.OpenAiGenerationClient;
import com.couplesync.backend.generation.client.StubGenerationClient;
import com.couplesync.backend.generation.service.GenerationTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(OpenAiProperties.class)
public class GenerationConfig {

    /**
     * ✅ 只有 openai enabled=false 才提供 stub，避免 GenerationClient 變成兩個 Bean
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.generation.openai", name = "enabled", havingValue = "false", matchIfMissing = true)
    public GenerationClient stubGenerationClient(ObjectMapper om) {
        log.warn("generation_client provider=STUB (app.generation.openai.enabled=false)");
        return new StubGenerationClient(om);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.generation.openai", name = "enabled", havingValue = "true")
    public RestClient openAiRestClient(OpenAiProperties props) {
        // timeout 一定要有：生成卡住不能拖垮 worker pool
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.generation.openai", name = "enabled", havingValue = "true")
    public GenerationClient openAiGenerationClient(
            RestClient openAiRestClient,
            OpenAiProperties props,
            GenerationTelemetry telemetry
    ) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("OPENAI_API_KEY_MISSING");
        if (k.chars().anyMatch(Character::isWhitespace)) throw new IllegalStateException("OPENAI_API_KEY_HAS_WHITESPACE");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("OPENAI_BASE_URL_MISSING");

        log.info("generation_client provider=OPENAI model={} key=***{}", props.getModel(), k.substring(Math.max(0, k.length() - 4)));
        return new OpenAiGenerationClient(openAiRestClient, props, telemetry);
    }
}
