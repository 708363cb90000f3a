package com.couplesync.backend.generation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.generation.openai")
public class OpenAiProperties {

    /** 開關：dev 沒 key 時走 stub（預設 false） */
    private boolean enabled = false;

    private String baseUrl = "https://api.openai.com";

    private String model = "gpt-3.5-turbo";

    /** 用環境變數帶入：OPENAI_API_KEY */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    /** 14 天計畫輸出很長，read timeout 要放寬 */
    private Duration readTimeout = Duration.ofSeconds(90);

    private int maxTokens = 4000;

    private double temperature = 0.7;

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
