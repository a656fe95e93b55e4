package com.example.procurement.assistantservice.model;

/**
 * Sampling settings for one generation call. Value semantics, so providers may
 * cache one client per distinct config.
 */
public record SamplingConfig(double temperature, double topP, int maxOutputTokens) {

    public static final SamplingConfig FACTUAL = new SamplingConfig(0.2, 0.8, 512);

    public SamplingConfig {
        if (temperature < 0) {
            throw new IllegalArgumentException("temperature must be >= 0");
        }
        if (topP <= 0 || topP > 1) {
            throw new IllegalArgumentException("topP must be in (0, 1]");
        }
        if (maxOutputTokens <= 0) {
            throw new IllegalArgumentException("maxOutputTokens must be > 0");
        }
    }
}
