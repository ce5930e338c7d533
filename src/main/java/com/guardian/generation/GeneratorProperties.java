package com.guardian.generation;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "guardian.generator")
public class GeneratorProperties {

    /** Base URL of the Ollama-compatible backend. */
    private String baseUrl = "http://127.0.0.1:11434";

    private String model = "mistral";

    /** Upper bound on generated tokens per call. */
    private int maxTokens = 256;

    /** Wall-clock bound on a single attempt. */
    private Duration timeout = Duration.ofSeconds(60);

    /** Total attempts, including the first. */
    private int maxAttempts = 2;

    /** Pause between attempts. */
    private Duration backoff = Duration.ofMillis(500);

    /** Threads available for concurrent generation calls. */
    private int poolSize = 4;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }

    public void setBackoff(Duration backoff) {
        this.backoff = backoff;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }
}
