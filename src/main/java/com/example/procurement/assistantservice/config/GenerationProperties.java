package com.example.procurement.assistantservice.config;

import com.example.procurement.assistantservice.model.SamplingConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Sampling and timeout settings for answer generation. Defaults favour short,
 * factual, low-variance answers.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    private double temperature = 0.2;
    private double topP = 0.8;
    private int maxOutputTokens = 512;
    private Duration timeout = Duration.ofSeconds(30);

    public SamplingConfig toSamplingConfig() {
        return new SamplingConfig(temperature, topP, maxOutputTokens);
    }
}
