package com.omegaagi.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide interpreter settings, bound from {@code omega.*}.
 * <p>
 * Built once at startup and handed to the core components through their
 * constructors; nothing in the core reads environment or system properties directly.
 */
@Component
@ConfigurationProperties(prefix = "omega")
public class OmegaProperties {

    private String defaultModel = "gpt-4o";
    private int maxCorrectionAttempts = 3;
    private int maxParallel = 4;
    private long backendTimeoutMs = 60_000;
    private double generationTemperature = 0.2;
    private double evaluationTemperature = 0.1;
    private double correctionTemperature = 0.1;
    private double humanToOmegaTemperature = 0.2;
    private double omegaToHumanTemperature = 0.0;
    private int defaultThreshold = 80;
    private int defaultMaxIterations = 2;
    private String sectionSeparator = "\n\n";
    private boolean autoCorrect = false;

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getMaxCorrectionAttempts() {
        return maxCorrectionAttempts;
    }

    public void setMaxCorrectionAttempts(int maxCorrectionAttempts) {
        this.maxCorrectionAttempts = maxCorrectionAttempts;
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    public void setMaxParallel(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    public long getBackendTimeoutMs() {
        return backendTimeoutMs;
    }

    public void setBackendTimeoutMs(long backendTimeoutMs) {
        this.backendTimeoutMs = backendTimeoutMs;
    }

    public double getGenerationTemperature() {
        return generationTemperature;
    }

    public void setGenerationTemperature(double generationTemperature) {
        this.generationTemperature = generationTemperature;
    }

    public double getEvaluationTemperature() {
        return evaluationTemperature;
    }

    public void setEvaluationTemperature(double evaluationTemperature) {
        this.evaluationTemperature = evaluationTemperature;
    }

    public double getCorrectionTemperature() {
        return correctionTemperature;
    }

    public void setCorrectionTemperature(double correctionTemperature) {
        this.correctionTemperature = correctionTemperature;
    }

    public double getHumanToOmegaTemperature() {
        return humanToOmegaTemperature;
    }

    public void setHumanToOmegaTemperature(double humanToOmegaTemperature) {
        this.humanToOmegaTemperature = humanToOmegaTemperature;
    }

    public double getOmegaToHumanTemperature() {
        return omegaToHumanTemperature;
    }

    public void setOmegaToHumanTemperature(double omegaToHumanTemperature) {
        this.omegaToHumanTemperature = omegaToHumanTemperature;
    }

    public int getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(int defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    public String getSectionSeparator() {
        return sectionSeparator;
    }

    public void setSectionSeparator(String sectionSeparator) {
        this.sectionSeparator = sectionSeparator;
    }

    public boolean isAutoCorrect() {
        return autoCorrect;
    }

    public void setAutoCorrect(boolean autoCorrect) {
        this.autoCorrect = autoCorrect;
    }

    /**
     * Returns the hint when it names a model, otherwise the configured default.
     */
    public String resolveModel(String modelHint) {
        return modelHint != null && !modelHint.isBlank() ? modelHint.trim() : defaultModel;
    }
}
