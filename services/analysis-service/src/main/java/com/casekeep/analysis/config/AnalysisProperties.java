package com.casekeep.analysis.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private String reasoningBaseUrl = "https://openrouter.ai/api/v1";
    private String reasoningApiKey = "";
    private String reasoningModel = "openai/gpt-4o";
    private double reasoningTemperature = 0.3;
    private String reasoningReferer = "";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration stageTimeout = Duration.ofSeconds(120);
    private Duration emitterTimeout = Duration.ofMinutes(30);
    private Duration staleRunTimeout = Duration.ofMinutes(15);
    private int maxResumeAttempts = 5;
    private boolean reaperEnabled = true;
    private long reaperFixedDelayMs = 60_000;

    public String getReasoningBaseUrl() {
        return reasoningBaseUrl;
    }

    public void setReasoningBaseUrl(String reasoningBaseUrl) {
        this.reasoningBaseUrl = reasoningBaseUrl;
    }

    public String getReasoningApiKey() {
        return reasoningApiKey;
    }

    public void setReasoningApiKey(String reasoningApiKey) {
        this.reasoningApiKey = reasoningApiKey;
    }

    public String getReasoningModel() {
        return reasoningModel;
    }

    public void setReasoningModel(String reasoningModel) {
        this.reasoningModel = reasoningModel;
    }

    public double getReasoningTemperature() {
        return reasoningTemperature;
    }

    public void setReasoningTemperature(double reasoningTemperature) {
        this.reasoningTemperature = reasoningTemperature;
    }

    public String getReasoningReferer() {
        return reasoningReferer;
    }

    public void setReasoningReferer(String reasoningReferer) {
        this.reasoningReferer = reasoningReferer;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getStageTimeout() {
        return stageTimeout;
    }

    public void setStageTimeout(Duration stageTimeout) {
        this.stageTimeout = stageTimeout;
    }

    public Duration getEmitterTimeout() {
        return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
        this.emitterTimeout = emitterTimeout;
    }

    public Duration getStaleRunTimeout() {
        return staleRunTimeout;
    }

    public void setStaleRunTimeout(Duration staleRunTimeout) {
        this.staleRunTimeout = staleRunTimeout;
    }

    public int getMaxResumeAttempts() {
        return maxResumeAttempts;
    }

    public void setMaxResumeAttempts(int maxResumeAttempts) {
        this.maxResumeAttempts = maxResumeAttempts;
    }

    public boolean isReaperEnabled() {
        return reaperEnabled;
    }

    public void setReaperEnabled(boolean reaperEnabled) {
        this.reaperEnabled = reaperEnabled;
    }

    public long getReaperFixedDelayMs() {
        return reaperFixedDelayMs;
    }

    public void setReaperFixedDelayMs(long reaperFixedDelayMs) {
        this.reaperFixedDelayMs = reaperFixedDelayMs;
    }
}
